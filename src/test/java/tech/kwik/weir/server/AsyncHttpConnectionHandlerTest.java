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

import org.junit.jupiter.api.Test;
import tech.kwik.weir.http.incoming.HttpServerRequest;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.network.virtual.VirtualSocket;
import tech.kwik.weir.server.handler.RequestInterceptor;
import tech.kwik.weir.server.router.Endpoint;
import tech.kwik.weir.server.router.HttpRouter;
import tech.kwik.weir.test.HttpTestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AsyncHttpConnectionHandlerTest extends AbstractConnectionHandlerTest {

    private static final int WORKERS = 2;

    @Override
    protected ConnectionHandler createHandler(HttpRouter router) {
        return new AsyncHttpConnectionHandler(router, HttpServerConfig.builder().workerThreads(WORKERS).build());
    }

    @Override
    protected void addRequestInterceptor(ConnectionHandler handler, RequestInterceptor interceptor) {
        ((AsyncHttpConnectionHandler) handler).addRequestInterceptor(interceptor);
    }

    @Test
    void moreConnectionsThanWorkersShouldAllBeServed() throws Exception {
        // Given
        List<HttpTestClient> clients = new ArrayList<>();
        for (int i = 0; i < WORKERS * 4; i++) {
            clients.add(connect());
        }

        // When
        for (HttpTestClient each: clients) {
            each.send(HttpTestClient.get("/hello"));
        }

        // Then
        for (HttpTestClient each: clients) {
            assertThat(each.readResponse().body()).isEqualTo("hello");
            each.close();
        }
    }

    @Test
    void idleConnectionShouldNotOccupyWorker() throws Exception {
        // Given
        List<HttpTestClient> idle = new ArrayList<>();
        for (int i = 0; i < WORKERS * 2; i++) {
            idle.add(connect());
        }

        // When
        client.send(HttpTestClient.get("/hello"));

        // Then
        assertThat(client.readResponse().body()).isEqualTo("hello");
        for (HttpTestClient each: idle) {
            each.close();
        }
    }

    @Test
    void withheldRequestBodyShouldNotOccupyTheOnlyWorker() throws Exception {
        // Given
        client.close();
        handler.stop();
        handler = new AsyncHttpConnectionHandler(routes.router(null), HttpServerConfig.builder().workerThreads(1).build());
        client = connect();
        HttpTestClient other = connect();

        // When
        client.send("POST /ignore HTTP/1.1\r\nContent-Length: 5\r\n\r\n");
        HttpTestClient.Response ignored = client.readResponse();
        other.send(HttpTestClient.get("/hello"));

        // Then
        assertThat(ignored.body()).isEqualTo("ignored");
        CompletableFuture<HttpTestClient.Response> otherResponse = CompletableFuture.supplyAsync(() -> {
            try {
                return other.readResponse();
            }
            catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        assertThat(otherResponse.get(2, TimeUnit.SECONDS).body()).isEqualTo("hello");
        other.close();
    }

    @Test
    void requestBodyArrivingAfterResponseShouldBeDiscardedBeforeNextRequest() throws Exception {
        // Given
        client.send("POST /ignore HTTP/1.1\r\nContent-Length: 5\r\n\r\n");
        assertThat(client.readResponse().body()).isEqualTo("ignored");

        // When
        client.send("xx");
        client.send("xxx" + HttpTestClient.get("/hello"));

        // Then
        HttpTestClient.Response response = client.readResponse();
        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("hello");
    }

    @Test
    void peerClosingWithinRequestBodyShouldEndConnection() throws Exception {
        // Given
        client.send("POST /ignore HTTP/1.1\r\nTransfer-Encoding: chunked\r\n\r\n5\r\nab");
        assertThat(client.readResponse().body()).isEqualTo("ignored");

        // When
        ((VirtualSocket) client.connection()).shutdownOutput();

        // Then
        assertThat(client.isClosedByServer()).isTrue();
    }

    @Test
    void asyncEndpointShouldCompleteOnWorker() throws Exception {
        // Given
        CompletableFuture<HttpServerResponse> later = new CompletableFuture<>();
        client.close();
        handler.stop();
        handler = createHandler(new HttpRouter().route("GET", "/async", new AsyncEndpoint(later)));
        client = connect();

        // When
        client.send(HttpTestClient.get("/async"));
        later.complete(HttpServerResponse.of(202, "accepted"));

        // Then
        HttpTestClient.Response response = client.readResponse();
        assertThat(response.status()).isEqualTo(202);
        assertThat(response.body()).isEqualTo("accepted");
    }

    @Test
    void failedAsyncEndpointShouldGiveErrorResponse() throws Exception {
        // Given
        CompletableFuture<HttpServerResponse> later = new CompletableFuture<>();
        client.close();
        handler.stop();
        handler = createHandler(new HttpRouter().route("GET", "/async", new AsyncEndpoint(later)));
        client = connect();

        // When
        client.send(HttpTestClient.get("/async"));
        later.completeExceptionally(new IllegalStateException("too late"));

        // Then
        HttpTestClient.Response response = client.readResponse();
        assertThat(response.status()).isEqualTo(500);
        assertThat(response.body()).contains("message=too late");
    }

    private static class AsyncEndpoint implements Endpoint {

        private final CompletableFuture<HttpServerResponse> response;

        AsyncEndpoint(CompletableFuture<HttpServerResponse> response) {
            this.response = response;
        }

        @Override
        public HttpServerResponse handle(HttpServerRequest request) {
            return response.join();
        }

        @Override
        public CompletableFuture<HttpServerResponse> handleAsync(HttpServerRequest request) {
            return response;
        }
    }
}
