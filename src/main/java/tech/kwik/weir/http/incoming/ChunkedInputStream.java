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
package tech.kwik.weir.http.incoming;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.net.ProtocolException;

/**
 * https://www.rfc-editor.org/rfc/rfc9112.html#name-chunked-transfer-coding
 * "chunked-body   = *chunk
 *                   last-chunk
 *                   trailer-section
 *                   CRLF"
 * Chunk extensions and trailer fields are read and ignored. Closing this stream does not close the underlying stream.
 * Framing is parsed byte by byte, so that {@link #skipAvailable()} can stop anywhere without losing its place.
 */
public class ChunkedInputStream extends InputStream implements SkippableBody {

    private static final int MAX_LINE_LENGTH = 4096;

    private enum State {
        CHUNK_SIZE,
        CHUNK_DATA,
        CHUNK_END,
        TRAILER,
        DONE
    }

    private final InputStream input;
    private final StringBuilder line;
    private State state;
    private long chunkRemaining;
    private byte[] skipBuffer;

    public ChunkedInputStream(InputStream input) {
        this.input = input;
        this.line = new StringBuilder();
        this.state = State.CHUNK_SIZE;
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int read = read(single, 0, 1);
        return read < 0 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (state == State.DONE) {
            return -1;
        }
        if (length == 0) {
            return 0;
        }
        while (state != State.DONE) {
            if (state == State.CHUNK_DATA) {
                return readChunkData(buffer, offset, length);
            }
            readFraming(input.read());
        }
        return -1;
    }

    @Override
    public boolean skipAvailable() throws IOException {
        while (state != State.DONE) {
            int available = input.available();
            if (available == 0) {
                return false;
            }
            if (state == State.CHUNK_DATA) {
                if (skipBuffer == null) {
                    skipBuffer = new byte[4096];
                }
                readChunkData(skipBuffer, 0, Math.min(available, skipBuffer.length));
            }
            else {
                readFraming(input.read());
            }
        }
        return true;
    }

    private int readChunkData(byte[] buffer, int offset, int length) throws IOException {
        int read = input.read(buffer, offset, (int) Math.min(length, chunkRemaining));
        if (read < 0) {
            throw new EOFException("connection closed within chunk");
        }
        chunkRemaining -= read;
        if (chunkRemaining == 0) {
            state = State.CHUNK_END;
        }
        return read;
    }

    private void readFraming(int value) throws IOException {
        if (value < 0) {
            throw new EOFException("connection closed within chunked body");
        }
        if (value != '\n') {
            if (line.length() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("chunk line too long");
            }
            line.append((char) value);
            return;
        }
        int length = line.length();
        if (length > 0 && line.charAt(length - 1) == '\r') {
            line.setLength(length - 1);
        }
        String completed = line.toString();
        line.setLength(0);
        switch (state) {
            case CHUNK_SIZE:
                chunkRemaining = parseChunkSize(completed);
                state = chunkRemaining == 0 ? State.TRAILER : State.CHUNK_DATA;
                break;
            case CHUNK_END:
                if (!completed.isEmpty()) {
                    throw new ProtocolException("chunk data not followed by CRLF");
                }
                state = State.CHUNK_SIZE;
                break;
            case TRAILER:
                // Trailer fields are ignored; an empty line ends the body.
                if (completed.isEmpty()) {
                    state = State.DONE;
                }
                break;
            default:
                throw new IllegalStateException("no framing expected in state " + state);
        }
    }

    private static long parseChunkSize(String line) throws ProtocolException {
        int extension = line.indexOf(';');
        String size = (extension >= 0 ? line.substring(0, extension) : line).trim();
        try {
            long chunkSize = Long.parseLong(size, 16);
            if (chunkSize < 0) {
                throw new ProtocolException("invalid chunk size: " + line);
            }
            return chunkSize;
        }
        catch (NumberFormatException e) {
            throw new ProtocolException("invalid chunk size: " + line);
        }
    }
}
