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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.kwik.weir.http.incoming.BodyDecoder;
import tech.kwik.weir.http.incoming.SimpleBodyDecoder;
import tech.kwik.weir.network.BrokenPipeException;
import tech.kwik.weir.network.Connection;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.network.IOMode;
import tech.kwik.weir.server.handler.ErrorHandler;
import tech.kwik.weir.server.handler.RequestInterceptor;
import tech.kwik.weir.server.router.HttpRouter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves connections with {@link HttpProcessorCoroutine}s that share a fixed pool of worker threads.
 */
public class AsyncHttpConnectionHandler implements ConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(AsyncHttpConnectionHandler.class);

    private final HttpProcessor.Components components;
    private final ExecutorService executor;
    private volatile boolean stopped;

    public AsyncHttpConnectionHandler(HttpRouter router) {
        this(router, HttpServerConfig.defaults());
    }

    public AsyncHttpConnectionHandler(HttpRouter router, HttpServerConfig config) {
        this(router, new SimpleBodyDecoder(), config);
    }

    public AsyncHttpConnectionHandler(HttpRouter router, BodyDecoder bodyDecoder, HttpServerConfig config) {
        this.components = new HttpProcessor.Components(router, bodyDecoder, config);
        this.executor = Executors.newFixedThreadPool(config.workerThreads(),
                config.processorAffinity().threadFactory("weir-worker"));
        log.debug("Cooperative connection handler started with {} workers", config.workerThreads());
    }

    @Override
    public void handleConnection(Connection connection, Map<String, String> parameters) {
        if (stopped) {
            log.debug("Handler stopped, refusing connection");
            closeQuietly(connection);
            return;
        }
        connection.setInputIOMode(IOMode.NON_BLOCKING);
        connection.setOutputIOMode(IOMode.NON_BLOCKING);
        HttpProcessorCoroutine coroutine = new HttpProcessorCoroutine(components, connection, executor);
        coroutine.start().whenComplete((result, error) -> {
            if (error != null && !(error instanceof BrokenPipeException) && !(error instanceof CancellationException)) {
                log.debug("Connection ended with error: {}", error.toString());
            }
            if (!coroutine.isUpgraded()) {
                closeQuietly(connection);
            }
        });
    }

    public void addRequestInterceptor(RequestInterceptor interceptor) {
        components.addRequestInterceptor(interceptor);
    }

    /**
     * @param errorHandler  the error handler, or null to restore the default one
     */
    public void setErrorHandler(ErrorHandler errorHandler) {
        components.setErrorHandler(errorHandler);
    }

    /**
     * Refuses new connections and shuts down the worker pool: steps already scheduled still run, connections
     * waiting for I/O are closed once they would resume.
     */
    @Override
    public void stop() {
        stopped = true;
        executor.shutdown();
    }

    public boolean isStopped() {
        return stopped;
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        }
        catch (IOException e) {
            log.debug("Closing connection failed", e);
        }
    }
}
