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

import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.server.router.HttpRouter;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes used by the connection handler and processor tests.
 */
class SampleRoutes {

    final AtomicInteger requestCount = new AtomicInteger();
    final AtomicInteger concurrentRequests = new AtomicInteger();
    final AtomicInteger maxConcurrentRequests = new AtomicInteger();

    HttpRouter router(ConnectionHandler upgradeHandler) {
        return new HttpRouter()
                .route("GET", "/hello", request -> HttpServerResponse.of(200, "hello"))
                .route("GET", "/count", request -> counted())
                .route("GET", "/forbidden", request -> {
                    throw new HttpError("forbidden", 403);
                })
                .route("GET", "/fail", request -> {
                    throw new IllegalStateException("boom");
                })
                .route("GET", "/fail-without-message", request -> {
                    throw new IllegalStateException();
                })
                .route("GET", "/close", request -> {
                    HttpServerResponse response = HttpServerResponse.of(200, "bye");
                    response.setHeader("Connection", "close");
                    return response;
                })
                .route("POST", "/ignore", request -> HttpServerResponse.of(200, "ignored"))
                .route("POST", "/echo", request -> {
                    HttpServerResponse response = new HttpServerResponse(200);
                    response.setBody(request.body().readAllBytes());
                    return response;
                })
                .route("GET", "/upgrade", request -> {
                    HttpServerResponse response = new HttpServerResponse(101);
                    response.setHeader("Connection", "Upgrade");
                    response.setHeader("Upgrade", "echo");
                    if (upgradeHandler != null) {
                        response.setUpgradeHandler(upgradeHandler, Map.of("protocol", "echo"));
                    }
                    return response;
                });
    }

    private HttpServerResponse counted() throws HttpError {
        int active = concurrentRequests.incrementAndGet();
        maxConcurrentRequests.accumulateAndGet(active, Math::max);
        try {
            Thread.sleep(10);
            int sequence = requestCount.incrementAndGet();
            HttpServerResponse response = new HttpServerResponse(200);
            response.setBody(Integer.toString(sequence).getBytes(StandardCharsets.US_ASCII));
            return response;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpError("interrupted", 500);
        }
        finally {
            concurrentRequests.decrementAndGet();
        }
    }
}
