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

import java.util.Map;

/**
 * Takes ownership of an established connection and serves it. Also used as the handler that takes over a raw
 * connection after an HTTP protocol upgrade.
 */
@FunctionalInterface
public interface ConnectionHandler {

    /**
     * @param connection  the connection, owned by this handler from now on
     * @param parameters  handler specific parameters, e.g. negotiated during an HTTP upgrade; never null
     */
    void handleConnection(Connection connection, Map<String, String> parameters);

    /**
     * Stops accepting new connections. Advisory: connections already being served are not interrupted.
     */
    default void stop() {
    }
}
