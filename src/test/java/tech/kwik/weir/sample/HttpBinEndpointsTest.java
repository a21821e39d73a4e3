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
package tech.kwik.weir.sample;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.incoming.RequestStartLine;
import tech.kwik.weir.http.incoming.SimpleBodyDecoder;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.server.router.HttpRouter;

import java.io.ByteArrayInputStream;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpBinEndpointsTest {

    private final HttpBinEndpoints endpoints = new HttpBinEndpoints();

    @Test
    void statusShouldRespondWithRequestedCode() throws Exception {
        // When
        HttpServerResponse response = endpoints.status(request("GET", "/status/418", Map.of("code", "418"), ""));

        // Then
        assertThat(response.status()).isEqualTo(418);
    }

    @Test
    void invalidStatusCodeShouldBeBadRequest() {
        assertThatThrownBy(() -> endpoints.status(request("GET", "/status/abc", Map.of("code", "abc"), "")))
                .isInstanceOf(HttpError.class)
                .extracting(error -> ((HttpError) error).getStatusCode())
                .isEqualTo(400);
    }

    @Test
    void statusCodeOutOfRangeShouldBeBadRequest() {
        assertThatThrownBy(() -> endpoints.status(request("GET", "/status/700", Map.of("code", "700"), "")))
                .isInstanceOf(HttpError.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void anythingShouldEchoRequest() throws Exception {
        // When
        HttpServerResponse response = endpoints.anything(
                request("POST", "/anything/a/b?x=1", Map.of("*", "a/b"), "payload"));

        // Then
        JSONObject json = new JSONObject(new String(response.body(), StandardCharsets.UTF_8));
        assertThat(json.getString("method")).isEqualTo("POST");
        assertThat(json.getString("path")).isEqualTo("/anything/a/b");
        assertThat(json.getString("query")).isEqualTo("x=1");
        assertThat(json.getString("data")).isEqualTo("payload");
        assertThat(json.getString("rest")).isEqualTo("a/b");
        assertThat(json.getJSONObject("headers").getString("Content-Length")).isEqualTo("7");
        assertThat(response.header("Content-Type")).contains(HttpBinEndpoints.CONTENT_TYPE_JSON);
    }

    @Test
    void md5ShouldHashBody() throws Exception {
        // When
        HttpServerResponse response = endpoints.md5(request("POST", "/md5", Map.of(), "abc"));

        // Then
        JSONObject json = new JSONObject(new String(response.body(), StandardCharsets.UTF_8));
        assertThat(json.getString("md5")).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }

    @Test
    void registeredRoutesShouldBeFound() {
        // When
        HttpRouter router = endpoints.register(new HttpRouter());

        // Then
        assertThat(router.getRoute("GET", "/headers")).isPresent();
        assertThat(router.getRoute("POST", "/status/201"))
                .hasValueSatisfying(match -> assertThat(match.pathVariables()).containsEntry("code", "201"));
        assertThat(router.getRoute("GET", "/anything/deeper/still")).isPresent();
        assertThat(router.getRoute("GET", "/md5")).isEmpty();
    }

    private static HttpServerRequest request(String method, String target, Map<String, String> pathVariables,
                                             String body) {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        HttpHeaders headers = HttpHeaders.of(
                Map.of("Host", List.of("test"), "Content-Length", List.of(Integer.toString(bytes.length))),
                (name, value) -> true);
        return new HttpServerRequest(new RequestStartLine(method, target, "HTTP/1.1"), pathVariables, headers,
                new ByteArrayInputStream(bytes), new SimpleBodyDecoder());
    }
}
