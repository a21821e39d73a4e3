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

import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.HttpStatus;

/**
 * https://www.rfc-editor.org/rfc/rfc9112.html#name-request-line
 * "request-line   = method SP request-target SP HTTP-version"
 */
public class RequestStartLine {

    private final String method;
    private final String target;
    private final String protocol;

    public RequestStartLine(String method, String target, String protocol) {
        this.method = method;
        this.target = target;
        this.protocol = protocol;
    }

    static RequestStartLine parse(String line) throws HttpError {
        int firstSpace = line.indexOf(' ');
        int lastSpace = line.lastIndexOf(' ');
        if (firstSpace <= 0 || lastSpace == firstSpace || lastSpace == line.length() - 1) {
            throw new HttpError("Invalid request line", HttpStatus.BAD_REQUEST);
        }
        String method = line.substring(0, firstSpace);
        String target = line.substring(firstSpace + 1, lastSpace);
        String protocol = line.substring(lastSpace + 1);
        if (!isToken(method) || target.isEmpty() || target.indexOf(' ') >= 0) {
            throw new HttpError("Invalid request line", HttpStatus.BAD_REQUEST);
        }
        if (!protocol.startsWith("HTTP/")) {
            throw new HttpError("Invalid protocol version", HttpStatus.BAD_REQUEST);
        }
        if (!protocol.equals(HttpConstants.PROTOCOL_HTTP_1_1) && !protocol.equals(HttpConstants.PROTOCOL_HTTP_1_0)) {
            throw new HttpError("Unsupported protocol version " + protocol, HttpStatus.HTTP_VERSION_NOT_SUPPORTED);
        }
        return new RequestStartLine(method, target, protocol);
    }

    /**
     * https://www.rfc-editor.org/rfc/rfc9110.html#name-tokens
     */
    static boolean isToken(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c <= 32 || c >= 127 || "\"(),/:;<=>?@[\\]{}".indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    public String method() {
        return method;
    }

    /**
     * @return the request target as received, including a query string if present
     */
    public String target() {
        return target;
    }

    /**
     * @return the path part of the request target, without query
     */
    public String path() {
        int queryStart = target.indexOf('?');
        return queryStart >= 0 ? target.substring(0, queryStart) : target;
    }

    public String protocol() {
        return protocol;
    }

    @Override
    public String toString() {
        return method + " " + target + " " + protocol;
    }
}
