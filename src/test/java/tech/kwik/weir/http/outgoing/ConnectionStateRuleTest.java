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

import org.junit.jupiter.api.Test;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.incoming.RequestStartLine;
import tech.kwik.weir.http.incoming.SimpleBodyDecoder;

import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionStateRuleTest {

    @Test
    void http11RequestWithoutConnectionHeaderShouldKeepAlive() {
        // Given
        HttpServerRequest request = request("HTTP/1.1", Map.of());
        HttpServerResponse response = new HttpServerResponse(200);

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, response);

        // Then
        assertThat(state).isEqualTo(ConnectionState.KEEP_ALIVE);
        assertThat(response.header("Connection")).hasValue("keep-alive");
    }

    @Test
    void http10RequestWithoutConnectionHeaderShouldClose() {
        // Given
        HttpServerRequest request = request("HTTP/1.0", Map.of());
        HttpServerResponse response = new HttpServerResponse(200);

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, response);

        // Then
        assertThat(state).isEqualTo(ConnectionState.CLOSE);
        assertThat(response.header("Connection")).hasValue("close");
    }

    @Test
    void http10RequestAskingForKeepAliveShouldKeepAlive() {
        // Given
        HttpServerRequest request = request("HTTP/1.0", Map.of("Connection", "Keep-Alive"));
        HttpServerResponse response = new HttpServerResponse(200);

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, response);

        // Then
        assertThat(state).isEqualTo(ConnectionState.KEEP_ALIVE);
    }

    @Test
    void requestAskingForCloseShouldClose() {
        // Given
        HttpServerRequest request = request("HTTP/1.1", Map.of("Connection", "close"));

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, new HttpServerResponse(200));

        // Then
        assertThat(state).isEqualTo(ConnectionState.CLOSE);
    }

    @Test
    void responseWithCloseShouldOverrideKeepAliveRequest() {
        // Given
        HttpServerRequest request = request("HTTP/1.1", Map.of("Connection", "keep-alive"));
        HttpServerResponse response = new HttpServerResponse(200);
        response.setHeader("Connection", "close");

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, response);

        // Then
        assertThat(state).isEqualTo(ConnectionState.CLOSE);
    }

    @Test
    void responseWithUpgradeShouldUpgrade() {
        // Given
        HttpServerRequest request = request("HTTP/1.1", Map.of("Connection", "Upgrade", "Upgrade", "echo"));
        HttpServerResponse response = new HttpServerResponse(101);
        response.setHeader("Connection", "Upgrade");

        // When
        ConnectionState state = ConnectionStateRule.considerConnectionState(request, response);

        // Then
        assertThat(state).isEqualTo(ConnectionState.UPGRADE);
        assertThat(response.header("Connection")).hasValue("Upgrade");
    }

    @Test
    void missingRequestShouldClose() {
        assertThat(ConnectionStateRule.considerConnectionState(null, new HttpServerResponse(400)))
                .isEqualTo(ConnectionState.CLOSE);
    }

    private static HttpServerRequest request(String protocol, Map<String, String> headers) {
        Map<String, List<String>> headerMap = new HashMap<>();
        headers.forEach((name, value) -> headerMap.put(name, List.of(value)));
        return new HttpServerRequest(new RequestStartLine("GET", "/", protocol), Map.of(),
                HttpHeaders.of(headerMap, (name, value) -> true), InputStream.nullInputStream(), new SimpleBodyDecoder());
    }
}
