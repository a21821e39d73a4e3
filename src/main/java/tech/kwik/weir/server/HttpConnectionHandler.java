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
import tech.kwik.weir.http.outgoing.ConnectionState;
import tech.kwik.weir.http.outgoing.HttpServerResponse;
import tech.kwik.weir.http.outgoing.ResponseWriter;
import tech.kwik.weir.network.BrokenPipeException;
import tech.kwik.weir.network.BufferedInput;
import tech.kwik.weir.network.Connection;
import tech.kwik.weir.network.ConnectionHandler;
import tech.kwik.weir.network.IOMode;
import tech.kwik.weir.server.handler.ErrorHandler;
import tech.kwik.weir.server.handler.RequestInterceptor;
import tech.kwik.weir.server.router.HttpRouter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadFactory;

/**
 * Serves each connection on a thread of its own, processing requests one after the other with blocking I/O for as
 * long as the connection is kept alive.
 */
public class HttpConnectionHandler implements ConnectionHandler {

    private static final Logger log = LoggerFactory.getLogger(HttpConnectionHandler.class);

    private final HttpProcessor.Components components;
    private final ThreadFactory threadFactory;
    private final ResponseWriter responseWriter;
    private volatile boolean stopped;

    public HttpConnectionHandler(HttpRouter router) {
        this(router, HttpServerConfig.defaults());
    }

    public HttpConnectionHandler(HttpRouter router, HttpServerConfig config) {
        this(router, new SimpleBodyDecoder(), config);
    }

    public HttpConnectionHandler(HttpRouter router, BodyDecoder bodyDecoder, HttpServerConfig config) {
        this(new HttpProcessor.Components(router, bodyDecoder, config),
                config.processorAffinity().threadFactory("weir-connection"));
    }

    HttpConnectionHandler(HttpProcessor.Components components, ThreadFactory threadFactory) {
        this.components = components;
        this.threadFactory = threadFactory;
        this.responseWriter = new ResponseWriter();
    }

    @Override
    public void handleConnection(Connection connection, Map<String, String> parameters) {
        if (stopped) {
            log.debug("Handler stopped, refusing connection");
            closeQuietly(connection);
            return;
        }
        connection.setInputIOMode(IOMode.BLOCKING);
        connection.setOutputIOMode(IOMode.BLOCKING);
        threadFactory.newThread(new Task(connection)).start();
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
     * Refuses new connections; connections being served are not interrupted.
     */
    @Override
    public void stop() {
        stopped = true;
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

    /**
     * Request/response loop of one connection.
     */
    class Task implements Runnable {

        private final Connection connection;

        Task(Connection connection) {
            this.connection = connection;
        }

        @Override
        public void run() {
            HttpServerConfig config = components.config();
            BufferedInput input = new BufferedInput(connection, config.inputBufferSize());
            ByteArrayOutputStream headersOutBuffer = new ByteArrayOutputStream(config.headersBufferCapacity());
            boolean upgraded = false;
            try {
                ConnectionState connectionState = ConnectionState.CLOSE;
                do {
                    HttpProcessor.ProcessingResult result = HttpProcessor.processRequest(components, input);
                    HttpServerResponse response = result.response();
                    if (response == null) {
                        break;
                    }
                    responseWriter.send(response, connection, headersOutBuffer);
                    connectionState = result.connectionState();
                    if (connectionState == ConnectionState.KEEP_ALIVE) {
                        result.request().discardBody();
                    }
                    else if (connectionState == ConnectionState.UPGRADE) {
                        upgraded = upgrade(response, input);
                    }
                }
                while (connectionState == ConnectionState.KEEP_ALIVE);
            }
            catch (BrokenPipeException e) {
                log.warn("Connection broken by peer: {}", e.getMessage());
            }
            catch (IOException e) {
                log.debug("Connection failed: {}", e.toString());
            }
            catch (RuntimeException e) {
                log.error("Unexpected failure while serving connection", e);
            }
            finally {
                if (!upgraded) {
                    closeQuietly(connection);
                }
            }
        }

        private boolean upgrade(HttpServerResponse response, BufferedInput input) {
            Optional<ConnectionHandler> upgradeHandler = response.upgradeHandler();
            if (upgradeHandler.isEmpty()) {
                log.warn("Connection upgrade requested, but response has no upgrade handler; closing connection");
                return false;
            }
            upgradeHandler.get().handleConnection(input.asConnection(), response.upgradeParameters());
            return true;
        }
    }
}
