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

import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.http.outgoing.HttpServerResponse;

import java.net.http.HttpHeaders;

/**
 * Renders an error as a plain text body listing server, status code, reason phrase and message.
 */
public class DefaultErrorHandler implements ErrorHandler {

    private final String serverName;

    public DefaultErrorHandler(String serverName) {
        this.serverName = serverName;
    }

    @Override
    public HttpServerResponse handleError(int status, String message, HttpHeaders headers) {
        String body = "server=" + serverName + "\n"
                + "code=" + status + "\n"
                + "description=" + HttpStatus.reasonPhrase(status) + "\n"
                + "message=" + message + "\n";
        HttpServerResponse response = HttpServerResponse.of(status, body);
        response.setHeaders(headers);
        response.putHeaderIfAbsent(HttpConstants.HEADER_SERVER, serverName);
        return response;
    }
}
