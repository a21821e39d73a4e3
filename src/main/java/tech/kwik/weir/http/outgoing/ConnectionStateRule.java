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
import tech.kwik.weir.http.incoming.HttpServerRequest;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * https://www.rfc-editor.org/rfc/rfc9112.html#name-persistence
 */
public final class ConnectionStateRule {

    private ConnectionStateRule() {
    }

    /**
     * Determines the connection state from the request and response headers and sets the response's Connection
     * header accordingly.
     * @param request  the request, or null when no request could be parsed
     */
    public static ConnectionState considerConnectionState(HttpServerRequest request, HttpServerResponse response) {
        List<String> responseOptions = connectionOptions(response.headers().allValues(HttpConstants.HEADER_CONNECTION));
        ConnectionState state;
        if (responseOptions.contains(HttpConstants.CONNECTION_UPGRADE.toLowerCase(Locale.ROOT))) {
            return ConnectionState.UPGRADE;
        }
        else if (responseOptions.contains(HttpConstants.CONNECTION_CLOSE) || request == null) {
            state = ConnectionState.CLOSE;
        }
        else {
            List<String> requestOptions = connectionOptions(request.headers().allValues(HttpConstants.HEADER_CONNECTION));
            if (requestOptions.contains(HttpConstants.CONNECTION_CLOSE)) {
                state = ConnectionState.CLOSE;
            }
            else if (requestOptions.contains(HttpConstants.CONNECTION_KEEP_ALIVE)) {
                state = ConnectionState.KEEP_ALIVE;
            }
            else if (HttpConstants.PROTOCOL_HTTP_1_1.equals(request.protocol())) {
                state = ConnectionState.KEEP_ALIVE;
            }
            else {
                state = ConnectionState.CLOSE;
            }
        }
        response.setHeader(HttpConstants.HEADER_CONNECTION,
                state == ConnectionState.CLOSE ? HttpConstants.CONNECTION_CLOSE : HttpConstants.CONNECTION_KEEP_ALIVE);
        return state;
    }

    private static List<String> connectionOptions(List<String> values) {
        return values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(option -> option.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }
}
