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
import tech.kwik.weir.network.IOMode;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Duplex endpoint built from two pipes running in opposite directions. Sockets are created in pairs, see
 * {@link #createPair()}: what one side writes, the other side reads.
 */
public class VirtualSocket implements Connection {

    private final Pipe.Reader input;
    private final Pipe.Writer output;

    VirtualSocket(Pipe.Reader input, Pipe.Writer output) {
        this.input = input;
        this.output = output;
    }

    /**
     * Creates a connected socket pair; element 0 is the server side, element 1 the client side.
     */
    public static VirtualSocket[] createPair() {
        Pipe pipeIn = new Pipe();
        Pipe pipeOut = new Pipe();
        VirtualSocket serverSocket = new VirtualSocket(pipeIn.getReader(), pipeOut.getWriter());
        VirtualSocket clientSocket = new VirtualSocket(pipeOut.getReader(), pipeIn.getWriter());
        return new VirtualSocket[] { serverSocket, clientSocket };
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        return input.read(buffer, offset, length);
    }

    @Override
    public int write(byte[] buffer, int offset, int length) throws IOException {
        return output.write(buffer, offset, length);
    }

    @Override
    public void setInputIOMode(IOMode mode) {
        input.setIOMode(mode);
    }

    @Override
    public IOMode getInputIOMode() {
        return input.getIOMode();
    }

    @Override
    public void setOutputIOMode(IOMode mode) {
        output.setIOMode(mode);
    }

    @Override
    public IOMode getOutputIOMode() {
        return output.getIOMode();
    }

    @Override
    public CompletableFuture<Void> awaitReadable() {
        return input.awaitReadable();
    }

    @Override
    public CompletableFuture<Void> awaitWritable() {
        return output.awaitWritable();
    }

    /**
     * Closes the output side (the peer reads end of stream once buffered bytes are consumed) and the input side
     * (the peer's writes fail with a broken pipe).
     */
    @Override
    public void close() {
        output.close();
        input.close();
    }

    /**
     * Closes the output side only; the peer reads end of stream, while this socket can still read.
     */
    public void shutdownOutput() {
        output.close();
    }
}
