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

/**
 * Body framed by a Content-Length. Closing this stream does not close the underlying stream.
 */
public class FixedLengthInputStream extends InputStream implements SkippableBody {

    private final InputStream input;
    private long remaining;
    private byte[] skipBuffer;

    public FixedLengthInputStream(InputStream input, long length) {
        this.input = input;
        this.remaining = length;
    }

    @Override
    public int read() throws IOException {
        if (remaining == 0) {
            return -1;
        }
        int value = input.read();
        if (value < 0) {
            throw new EOFException("connection closed before end of request body");
        }
        remaining--;
        return value;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (remaining == 0) {
            return -1;
        }
        if (length == 0) {
            return 0;
        }
        int read = input.read(buffer, offset, (int) Math.min(length, remaining));
        if (read < 0) {
            throw new EOFException("connection closed before end of request body");
        }
        remaining -= read;
        return read;
    }

    @Override
    public int available() throws IOException {
        return (int) Math.min(input.available(), remaining);
    }

    @Override
    public boolean skipAvailable() throws IOException {
        while (remaining > 0) {
            int available = input.available();
            if (available == 0) {
                return false;
            }
            if (skipBuffer == null) {
                skipBuffer = new byte[4096];
            }
            read(skipBuffer, 0, Math.min(available, skipBuffer.length));
        }
        return true;
    }

    public long remaining() {
        return remaining;
    }
}
