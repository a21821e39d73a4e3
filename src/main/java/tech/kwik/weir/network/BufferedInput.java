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
import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * Buffered proxy for the input side of a connection. Bytes read ahead (e.g. by a header reader that read past the
 * end of the header block) can be pushed back, so that they are returned first by subsequent reads.
 * Not thread safe: owned by the single flow that processes the connection.
 */
public class BufferedInput {

    private final Connection connection;
    private byte[] buffer;
    private int position;
    private int limit;
    private boolean endOfStream;

    public BufferedInput(Connection connection, int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("buffer size must be positive");
        }
        this.connection = connection;
        this.buffer = new byte[bufferSize];
    }

    /**
     * Reads buffered bytes first, then from the connection, honouring its input IO mode.
     * @return number of bytes read, -1 at end of stream, 0 when in non-blocking mode and nothing is available
     */
    public int read(byte[] data, int offset, int length) throws IOException {
        if (length == 0) {
            return 0;
        }
        if (position < limit) {
            int count = Math.min(length, limit - position);
            System.arraycopy(buffer, position, data, offset, count);
            position += count;
            return count;
        }
        if (length >= buffer.length) {
            int read = connection.read(data, offset, length);
            if (read < 0) {
                endOfStream = true;
            }
            return read;
        }
        int read = fill();
        if (read <= 0) {
            return read;
        }
        return read(data, offset, length);
    }

    /**
     * Number of bytes that can be read without blocking. When nothing is buffered and the connection is in
     * non-blocking mode, the connection is polled once.
     */
    public int available() throws IOException {
        if (position == limit && connection.getInputIOMode() == IOMode.NON_BLOCKING) {
            fill();
        }
        return buffered();
    }

    /**
     * @return true when the connection reported end of stream and all buffered bytes have been read
     */
    public boolean isEndOfStream() {
        return endOfStream && position == limit;
    }

    private int fill() throws IOException {
        int read = connection.read(buffer, 0, buffer.length);
        if (read < 0) {
            endOfStream = true;
        }
        else if (read > 0) {
            position = 0;
            limit = read;
        }
        return read;
    }

    /**
     * Pushes bytes back in front of the buffered data.
     */
    public void unread(byte[] data, int offset, int length) {
        if (length == 0) {
            return;
        }
        if (length <= position) {
            position -= length;
            System.arraycopy(data, offset, buffer, position, length);
        }
        else {
            int buffered = limit - position;
            byte[] enlarged = new byte[Math.max(buffer.length, length + buffered)];
            System.arraycopy(data, offset, enlarged, 0, length);
            System.arraycopy(buffer, position, enlarged, length, buffered);
            buffer = enlarged;
            position = 0;
            limit = length + buffered;
        }
    }

    public int buffered() {
        return limit - position;
    }

    public CompletableFuture<Void> awaitReadable() {
        if (position < limit) {
            return CompletableFuture.completedFuture(null);
        }
        return connection.awaitReadable();
    }

    public Connection connection() {
        return connection;
    }

    /**
     * @return the connection, with reads served from the buffered bytes first; used to hand over a connection on
     * which data has already been read ahead
     */
    public Connection asConnection() {
        if (buffered() == 0) {
            return connection;
        }
        return new Connection() {
            @Override
            public int read(byte[] data, int offset, int length) throws IOException {
                return BufferedInput.this.read(data, offset, length);
            }

            @Override
            public int write(byte[] data, int offset, int length) throws IOException {
                return connection.write(data, offset, length);
            }

            @Override
            public void setInputIOMode(IOMode mode) {
                connection.setInputIOMode(mode);
            }

            @Override
            public IOMode getInputIOMode() {
                return connection.getInputIOMode();
            }

            @Override
            public void setOutputIOMode(IOMode mode) {
                connection.setOutputIOMode(mode);
            }

            @Override
            public IOMode getOutputIOMode() {
                return connection.getOutputIOMode();
            }

            @Override
            public CompletableFuture<Void> awaitReadable() {
                return BufferedInput.this.awaitReadable();
            }

            @Override
            public CompletableFuture<Void> awaitWritable() {
                return connection.awaitWritable();
            }

            @Override
            public void close() throws IOException {
                connection.close();
            }
        };
    }

    /**
     * @return a stream view that blocks until data is available, also when the connection is in non-blocking mode.
     * Its {@link InputStream#available()} never blocks. Closing the stream does not close the connection.
     */
    public InputStream asInputStream() {
        return new InputStream() {
            @Override
            public int read() throws IOException {
                byte[] single = new byte[1];
                int read = read(single, 0, 1);
                return read < 0 ? -1 : single[0] & 0xff;
            }

            @Override
            public int read(byte[] data, int offset, int length) throws IOException {
                if (length == 0) {
                    return 0;
                }
                while (true) {
                    int read = BufferedInput.this.read(data, offset, length);
                    if (read != 0) {
                        return read;
                    }
                    Awaits.await(awaitReadable());
                }
            }

            @Override
            public int available() throws IOException {
                return BufferedInput.this.available();
            }
        };
    }
}
