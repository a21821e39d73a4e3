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
package tech.kwik.weir.http;

import java.net.http.HttpHeaders;
import java.util.List;
import java.util.Map;

/**
 * Application level protocol error: carries the HTTP status to respond with, a message and optionally extra
 * response headers.
 */
public class HttpError extends Exception {

    private static final HttpHeaders NO_HEADERS = HttpHeaders.of(Map.of(), (name, value) -> true);

    private final int statusCode;
    private final HttpHeaders headers;

    public HttpError(String message, int statusCode) {
        this(message, statusCode, NO_HEADERS);
    }

    public HttpError(String message, int statusCode, Map<String, List<String>> headers) {
        this(message, statusCode, HttpHeaders.of(headers, (name, value) -> true));
    }

    public HttpError(String message, int statusCode, HttpHeaders headers) {
        super(message);
        this.statusCode = statusCode;
        this.headers = headers;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }
}
