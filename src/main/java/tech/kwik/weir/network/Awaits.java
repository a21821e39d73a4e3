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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocking waits on readiness futures, translated to the IOException world of blocking streams.
 */
public final class Awaits {

    private Awaits() {
    }

    public static void await(CompletableFuture<?> readiness) throws IOException {
        try {
            readiness.get();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for connection");
        }
        catch (CancellationException e) {
            throw new InterruptedIOException("wait for connection cancelled");
        }
        catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException(e.getCause());
        }
    }

    /**
     * Writes all bytes, waiting for capacity when the connection output is in non-blocking mode.
     */
    public static void writeFully(Connection connection, byte[] data, int offset, int length) throws IOException {
        int end = offset + length;
        while (offset < end) {
            int written = connection.write(data, offset, end - offset);
            if (written == 0) {
                await(connection.awaitWritable());
            }
            offset += written;
        }
    }
}
