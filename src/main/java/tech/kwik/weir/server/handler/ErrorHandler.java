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
package tech.kwik.weir.server.handler;

import tech.kwik.weir.http.outgoing.HttpServerResponse;

import java.net.http.HttpHeaders;
import java.util.Map;

/**
 * Renders failures into responses.
 */
public interface ErrorHandler {

    /**
     * @param headers  extra headers to include in the response
     */
    HttpServerResponse handleError(int status, String message, HttpHeaders headers);

    default HttpServerResponse handleError(int status, String message) {
        return handleError(status, message, HttpHeaders.of(Map.of(), (name, value) -> true));
    }
}
