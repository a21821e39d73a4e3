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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * A bidirectional byte transport. Input and output side each have their own {@link IOMode}.
 */
public interface Connection extends Closeable {

    /**
     * Reads bytes into the given buffer.
     * @return the number of bytes read, -1 at end of stream, or 0 when the input is in non-blocking mode and no data
     * is available
     * @throws BrokenPipeException when this side of the connection has been closed
     */
    int read(byte[] buffer, int offset, int length) throws IOException;

    /**
     * Writes bytes from the given buffer. Not all bytes are necessarily accepted.
     * @return the number of bytes accepted; 0 when the output is in non-blocking mode and no capacity is available
     * @throws BrokenPipeException when the peer has closed its side of the connection
     */
    int write(byte[] buffer, int offset, int length) throws IOException;

    void setInputIOMode(IOMode mode);

    IOMode getInputIOMode();

    void setOutputIOMode(IOMode mode);

    IOMode getOutputIOMode();

    /**
     * @return a future that completes when a read would make progress (data available, end of stream or closed)
     */
    CompletableFuture<Void> awaitReadable();

    /**
     * @return a future that completes when a write would make progress (capacity available or closed)
     */
    CompletableFuture<Void> awaitWritable();

    /**
     * @return an input stream that always blocks, regardless of the input IO mode of this connection
     */
    default InputStream getInputStream() {
        return new ConnectionInputStream(this);
    }

    /**
     * @return an output stream that always blocks until all bytes are written, regardless of the output IO mode
     */
    default OutputStream getOutputStream() {
        return new ConnectionOutputStream(this);
    }
}
