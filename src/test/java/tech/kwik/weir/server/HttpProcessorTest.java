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
package tech.kwik.weir.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.incoming.SimpleBodyDecoder;
import tech.kwik.weir.http.outgoing.ConnectionState;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.network.BufferedInput;
import tech.kwik.weir.network.virtual.VirtualSocket;
import tech.kwik.weir.server.handler.ErrorHandler;
import tech.kwik.weir.server.router.Endpoint;
import tech.kwik.weir.server.router.HttpRouter;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class HttpProcessorTest {

    private VirtualSocket[] pair;
    private HttpProcessor.Components components;

    @BeforeEach
    void setUp() {
        pair = VirtualSocket.createPair();
        components = new HttpProcessor.Components(new SampleRoutes().router(null), new SimpleBodyDecoder(),
                HttpServerConfig.defaults());
    }

    //region routing
    @Test
    void routedRequestShouldProduceEndpointResponse() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /hello HTTP/1.1\r\nHost: test\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(200);
        assertThat(body(result.response())).isEqualTo("hello");
        assertThat(result.connectionState()).isEqualTo(ConnectionState.KEEP_ALIVE);
        assertThat(result.request().path()).isEqualTo("/hello");
    }

    @Test
    void serverHeaderShouldBeAddedWhenAbsent() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /hello HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().header("Server")).hasValue(HttpServerConfig.DEFAULT_SERVER_NAME);
    }

    @Test
    void routeMissShouldGive404AndClose() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /nope HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(404);
        assertThat(body(result.response())).contains("Current url has no mapping");
        assertThat(result.connectionState()).isEqualTo(ConnectionState.CLOSE);
    }

    @Test
    void http10RequestShouldClose() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /hello HTTP/1.0\r\n\r\n");

        // Then
        assertThat(result.connectionState()).isEqualTo(ConnectionState.CLOSE);
    }
    //endregion

    //region errors
    @Test
    void httpErrorFromEndpointShouldBeRenderedWithItsStatus() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /forbidden HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(403);
        assertThat(body(result.response())).contains("forbidden");
        assertThat(result.connectionState()).isEqualTo(ConnectionState.KEEP_ALIVE);
    }

    @Test
    void unclassifiedFailureShouldGive500WithMessage() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /fail HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(500);
        assertThat(body(result.response())).contains("message=boom");
    }

    @Test
    void failureWithoutMessageShouldGive500UnknownError() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("GET /fail-without-message HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(500);
        assertThat(body(result.response())).contains("message=Unknown error");
    }

    @Test
    void endpointWithoutResponseShouldGive500() throws Exception {
        // Given
        components = new HttpProcessor.Components(new HttpRouter().route("GET", "/null", request -> null),
                new SimpleBodyDecoder(), HttpServerConfig.defaults());

        // When
        HttpProcessor.ProcessingResult result = process("GET /null HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(500);
    }

    @Test
    void malformedHeadersShouldBeRenderedAndClose() throws Exception {
        // When
        HttpProcessor.ProcessingResult result = process("NOT A REQUEST LINE AT ALL\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(400);
        assertThat(body(result.response())).contains("Invalid request headers");
        assertThat(result.connectionState()).isEqualTo(ConnectionState.CLOSE);
        assertThat(result.request()).isNull();
    }

    @Test
    void peerClosingBeforeAnyByteShouldGiveNoResponse() {
        // Given
        pair[1].close();

        // When
        HttpProcessor.ProcessingResult result = HttpProcessor.processRequest(components, new BufferedInput(pair[0], 64));

        // Then
        assertThat(result.response()).isNull();
        assertThat(result.connectionState()).isEqualTo(ConnectionState.CLOSE);
    }

    @Test
    void customErrorHandlerShouldRenderErrors() throws Exception {
        // Given
        ErrorHandler errorHandler = (status, message, headers) -> HttpServerResponse.of(status, "custom: " + message);
        components.setErrorHandler(errorHandler);

        // When
        HttpProcessor.ProcessingResult result = process("GET /nope HTTP/1.1\r\n\r\n");

        // Then
        assertThat(body(result.response())).isEqualTo("custom: Current url has no mapping");
    }
    //endregion

    //region interceptors
    @Test
    void interceptorResponseShouldShortCircuitEndpoint() throws Exception {
        // Given
        Endpoint endpoint = mock(Endpoint.class);
        components = new HttpProcessor.Components(new HttpRouter().route("GET", "/secret", endpoint),
                new SimpleBodyDecoder(), HttpServerConfig.defaults());
        components.addRequestInterceptor(request -> Optional.empty());
        components.addRequestInterceptor(request -> Optional.of(HttpServerResponse.of(401, "who are you")));

        // When
        HttpProcessor.ProcessingResult result = process("GET /secret HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(401);
        verify(endpoint, never()).handle(any());
    }

    @Test
    void httpErrorFromInterceptorShouldBeRendered() throws Exception {
        // Given
        components.addRequestInterceptor(request -> {
            throw new HttpError("not allowed", 403);
        });

        // When
        HttpProcessor.ProcessingResult result = process("GET /hello HTTP/1.1\r\n\r\n");

        // Then
        assertThat(result.response().status()).isEqualTo(403);
    }

    @Test
    void settingNullErrorHandlerShouldRestoreDefault() throws Exception {
        // Given
        ErrorHandler errorHandler = mock(ErrorHandler.class);
        components.setErrorHandler(errorHandler);

        // When
        components.setErrorHandler(null);
        HttpProcessor.ProcessingResult result = process("GET /nope HTTP/1.1\r\n\r\n");

        // Then
        verify(errorHandler, never()).handleError(anyInt(), anyString(), any());
        assertThat(body(result.response())).startsWith("server=");
    }
    //endregion

    private HttpProcessor.ProcessingResult process(String request) throws Exception {
        pair[1].getOutputStream().write(request.getBytes(StandardCharsets.ISO_8859_1));
        return HttpProcessor.processRequest(components, new BufferedInput(pair[0], 64));
    }

    private static String body(HttpServerResponse response) {
        return new String(response.body(), StandardCharsets.UTF_8);
    }
}
