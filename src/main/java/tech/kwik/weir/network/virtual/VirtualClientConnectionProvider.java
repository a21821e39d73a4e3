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
package tech.kwik.weir.network.virtual;

import tech.kwik.weir.network.Connection;
import tech.kwik.weir.network.ConnectionProvider;

import java.io.IOException;

/**
 * Client side connection provider connecting to a virtual interface.
 */
public class VirtualClientConnectionProvider implements ConnectionProvider {

    private final VirtualInterface virtualInterface;
    private volatile boolean open;

    public VirtualClientConnectionProvider(String interfaceName) {
        this.virtualInterface = VirtualInterface.obtain(interfaceName);
        this.open = true;
    }

    /**
     * Connects and waits until the server side accepted the connection.
     */
    @Override
    public Connection getConnection() throws IOException {
        if (!open) {
            throw new IOException("connection provider closed");
        }
        VirtualSocket socket = virtualInterface.connect().getSocket();
        if (socket == null) {
            throw new IOException("connection to virtual interface '" + virtualInterface.getName() + "' not accepted");
        }
        return socket;
    }

    /**
     * Submits a connection request without waiting. Use {@link ConnectionSubmission#getSocketNonBlocking()} to
     * poll for the result.
     * @return the submission, or null when the interface is busy; the caller decides when to retry
     */
    public ConnectionSubmission connectNonBlocking() throws IOException {
        if (!open) {
            throw new IOException("connection provider closed");
        }
        return virtualInterface.connectNonBlocking();
    }

    @Override
    public synchronized void close() {
        if (open) {
            open = false;
            virtualInterface.close();
        }
    }
}
