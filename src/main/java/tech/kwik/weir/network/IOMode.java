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

/**
 * Determines whether read and write operations on a {@link Connection} wait for progress or return immediately.
 */
public enum IOMode {

    /**
     * Read waits until at least one byte is available (or end of stream), write waits until at least one byte is
     * accepted.
     */
    BLOCKING,

    /**
     * Read and write return 0 when no progress can be made; use {@link Connection#awaitReadable()} and
     * {@link Connection#awaitWritable()} to get notified when progress is possible.
     */
    NON_BLOCKING
}
