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

/**
 * Server side connection provider accepting connections on a virtual interface.
 */
public class VirtualServerConnectionProvider implements ConnectionProvider {

    private final VirtualInterface virtualInterface;
    private volatile boolean open;

    /**
     * @param interfaceName  name of the interface; the provider holds a share of it until closed
     */
    public VirtualServerConnectionProvider(String interfaceName) {
        this.virtualInterface = VirtualInterface.obtain(interfaceName);
        this.open = true;
    }

    /**
     * Waits for the next connection.
     * @return the server side socket, or null when the provider was closed while waiting
     */
    @Override
    public Connection getConnection() {
        if (!open) {
            return null;
        }
        return virtualInterface.accept(() -> open);
    }

    /**
     * @return the server side socket of a pending connection, or null; never waits
     */
    public Connection getConnectionNonBlocking() {
        return open ? virtualInterface.acceptNonBlocking() : null;
    }

    public String getInterfaceName() {
        return virtualInterface.getName();
    }

    @Override
    public synchronized void close() {
        if (open) {
            open = false;
            virtualInterface.notifyAcceptors();
            virtualInterface.close();
        }
    }
}
