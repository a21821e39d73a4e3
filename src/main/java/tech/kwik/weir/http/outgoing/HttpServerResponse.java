/*
 * Copyright © 2025, 2026 Peter Doornbosch
 *
 * This file is part of Weir, an embeddable HTTP/1.1 server engine
 *
 * Weir is free software: you can redistribute it and/or modify it under
 * the terms of the GNU Lesser General Public License as published by the
 * Free Software Foundation, either version 3 of the License, or (at your option)
 * any later version.
 *
 * Weir is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for
 * more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with this program. If not, see <http://www.gnu.org/licenses/>.
 */
package tech.kwik.weir.http.outgoing;

import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.network.ConnectionHandler;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response under construction. The body is collected in memory and sent by the {@link ResponseWriter} after the
 * endpoint returned.
 */
public class HttpServerResponse {

    private int status = -1;
    private final Map<String, List<String>> headers;
    private final ByteArrayOutputStream body;
    private ConnectionHandler upgradeHandler;
    private Map<String, String> upgradeParameters;

    public HttpServerResponse() {
        headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        body = new ByteArrayOutputStream();
        upgradeParameters = Map.of();
    }

    public HttpServerResponse(int status) {
        this();
        setStatus(status);
    }

    public static HttpServerResponse of(int status, String text) {
        HttpServerResponse response = new HttpServerResponse(status);
        response.setHeader(HttpConstants.HEADER_CONTENT_TYPE, HttpConstants.CONTENT_TYPE_TEXT_PLAIN);
        response.setBody(text.getBytes(StandardCharsets.UTF_8));
        return response;
    }

    /**
     * https://www.rfc-editor.org/rfc/rfc9110.html#name-status-codes
     * "All valid status codes are within the range of 100 to 599, inclusive."
     * "Values outside the range 100..599 are invalid. Implementations often use three-digit integer values outside of
     *  that range (i.e., 600..999) for internal communication of non-HTTP status (e.g., library errors). "
     * @param status
     */
    public void setStatus(int status) {
        if (status < 100 || status > 999) {
            throw new IllegalArgumentException("invalid status code: " + status);
        }
        this.status = status;
    }

    public int status() {
        if (status == -1) {
            throw new IllegalStateException("status not set");
        }
        return status;
    }

    public boolean isStatusSet() {
        return status != -1;
    }

    /**
     * @throws IllegalArgumentException when name or value contains CR, LF or NUL
     */
    public void addHeader(String name, String value) {
        checkHeader(name, value);
        headers.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
    }

    /**
     * @throws IllegalArgumentException when name or value contains CR, LF or NUL
     */
    public void setHeader(String name, String value) {
        checkHeader(name, value);
        List<String> values = new ArrayList<>();
        values.add(value);
        headers.put(name, values);
    }

    /**
     * @return true when the header was added, false when a header with the same name was already present
     */
    public boolean putHeaderIfAbsent(String name, String value) {
        if (headers.containsKey(name)) {
            return false;
        }
        setHeader(name, value);
        return true;
    }

    /**
     * Adds all given headers to the ones already set.
     */
    public void setHeaders(HttpHeaders httpHeaders) {
        httpHeaders.map().forEach((name, values) -> values.forEach(value -> addHeader(name, value)));
    }

    // https://www.rfc-editor.org/rfc/rfc9110.html#name-field-values
    // "Field values containing CR, LF, or NUL characters are invalid and dangerous"
    private static void checkHeader(String name, String value) {
        if (name == null || name.isEmpty() || value == null) {
            throw new IllegalArgumentException("header name and value must be present");
        }
        if (containsForbiddenCharacter(name) || containsForbiddenCharacter(value)) {
            throw new IllegalArgumentException("header " + name.trim() + " contains CR, LF or NUL");
        }
    }

    private static boolean containsForbiddenCharacter(String text) {
        return text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\0') >= 0;
    }

    public void removeHeader(String name) {
        headers.remove(name);
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    public HttpHeaders headers() {
        return HttpHeaders.of(headers, (name, value) -> true);
    }

    public OutputStream getOutputStream() {
        return body;
    }

    public void setBody(byte[] content) {
        body.reset();
        body.writeBytes(content);
    }

    public byte[] body() {
        return body.toByteArray();
    }

    public long size() {
        return body.size();
    }

    /**
     * Sets the handler that takes over the connection once this response has been sent; the response should carry
     * a "Connection: Upgrade" header for the connection to be handed over.
     */
    public void setUpgradeHandler(ConnectionHandler upgradeHandler, Map<String, String> parameters) {
        this.upgradeHandler = upgradeHandler;
        this.upgradeParameters = Map.copyOf(parameters);
    }

    public Optional<ConnectionHandler> upgradeHandler() {
        return Optional.ofNullable(upgradeHandler);
    }

    public Map<String, String> upgradeParameters() {
        return upgradeParameters;
    }

    @Override
    public String toString() {
        return "HttpServerResponse[" + (isStatusSet() ? status : "-") + ", " + size() + " bytes]";
    }
}
