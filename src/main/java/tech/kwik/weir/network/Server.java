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
package tech.kwik.weir.network;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Accept loop: takes connections from a provider and passes each one to a connection handler.
 */
public class Server implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Server.class);

    private final ConnectionProvider connectionProvider;
    private final ConnectionHandler connectionHandler;
    private volatile boolean stopped;
    private Thread acceptThread;

    public Server(ConnectionProvider connectionProvider, ConnectionHandler connectionHandler) {
        this.connectionProvider = connectionProvider;
        this.connectionHandler = connectionHandler;
    }

    /**
     * Runs the accept loop in the calling thread, until {@link #stop()} is called or the provider fails.
     */
    @Override
    public void run() {
        while (!stopped) {
            Connection connection;
            try {
                connection = connectionProvider.getConnection();
            }
            catch (IOException e) {
                if (!stopped) {
                    log.error("Accepting connection failed, stopping server", e);
                    stopped = true;
                }
                break;
            }
            if (connection != null) {
                if (!stopped) {
                    connectionHandler.handleConnection(connection, Map.of());
                }
                else {
                    closeQuietly(connection);
                }
            }
        }
        log.debug("Accept loop ended");
    }

    public synchronized void start() {
        if (acceptThread != null) {
            throw new IllegalStateException("server already started");
        }
        acceptThread = new Thread(this, "weir-accept");
        acceptThread.start();
    }

    public void stop() {
        stopped = true;
        try {
            connectionProvider.close();
        }
        catch (IOException e) {
            log.warn("Closing connection provider failed", e);
        }
        connectionHandler.stop();
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
