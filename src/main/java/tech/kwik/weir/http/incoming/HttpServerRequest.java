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
package tech.kwik.weir.http.incoming;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpHeaders;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;


public class HttpServerRequest {

    private final RequestStartLine startLine;
    private final String path;
    private final String query;
    private final HttpHeaders headers;
    private final Map<String, String> pathVariables;
    private final InputStream connectionInput;
    private final BodyDecoder bodyDecoder;
    private final Instant requestTime;
    private InputStream body;

    /**
     * @param connectionInput  the (blocking) input of the connection, positioned at the start of the body; the body
     *                         is only decoded when requested
     */
    public HttpServerRequest(RequestStartLine startLine, Map<String, String> pathVariables, HttpHeaders headers,
                             InputStream connectionInput, BodyDecoder bodyDecoder) {
        this.startLine = startLine;
        this.pathVariables = Map.copyOf(pathVariables);
        this.headers = headers;
        this.connectionInput = connectionInput;
        this.bodyDecoder = bodyDecoder;
        String target = startLine.target();
        int queryStart = target.indexOf('?');
        path = startLine.path();
        query = queryStart >= 0 ? target.substring(queryStart + 1) : null;
        requestTime = Instant.now();
    }

    public String method() {
        return startLine.method();
    }

    /**
     * @return the path of the request target, without query
     */
    public String path() {
        return path;
    }

    public Optional<String> query() {
        return Optional.ofNullable(query);
    }

    public String protocol() {
        return startLine.protocol();
    }

    public RequestStartLine startLine() {
        return startLine;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public Map<String, String> pathVariables() {
        return pathVariables;
    }

    public Optional<String> pathVariable(String name) {
        return Optional.ofNullable(pathVariables.get(name));
    }

    /**
     * @return the decoded request body; reading it consumes it from the connection
     */
    public synchronized InputStream body() throws IOException {
        if (body == null) {
            body = bodyDecoder.decode(headers, connectionInput);
        }
        return body;
    }

    /**
     * Reads and drops what is left of the request body, so that the connection is positioned at the next request.
     */
    public void discardBody() throws IOException {
        body().transferTo(OutputStream.nullOutputStream());
    }

    /**
     * Reads and drops what is left of the request body as far as it has arrived, without waiting for more.
     * @return true when the body has been consumed completely
     * @throws IOException when reading fails, or when the body cannot be skipped without blocking
     */
    public boolean discardAvailableBody() throws IOException {
        InputStream decoded = body();
        if (!(decoded instanceof SkippableBody)) {
            throw new IOException("request body " + decoded.getClass().getName() + " cannot be skipped without blocking");
        }
        return ((SkippableBody) decoded).skipAvailable();
    }

    public Instant time() {
        return requestTime;
    }

    @Override
    public String toString() {
        return startLine.toString();
    }
}
