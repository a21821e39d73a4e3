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
package tech.kwik.weir.http.outgoing;

import tech.kwik.weir.http.HttpConstants;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.network.Awaits;
import tech.kwik.weir.network.Connection;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Serializes a response as an HTTP/1.1 message: status line, header fields, Content-Length and body.
 * https://www.rfc-editor.org/rfc/rfc9112.html#name-message-format
 */
public class ResponseWriter {

    private static final byte[] CRLF = { '\r', '\n' };

    /**
     * Writes the response, blocking until all bytes are written.
     * @param headersOutBuffer  buffer used to assemble the status line and headers; reset before use
     */
    public void send(HttpServerResponse response, Connection connection, ByteArrayOutputStream headersOutBuffer) throws IOException {
        writeHead(response, headersOutBuffer);
        Awaits.writeFully(connection, headersOutBuffer.toByteArray(), 0, headersOutBuffer.size());
        if (HttpStatus.mayHaveContent(response.status())) {
            byte[] body = response.body();
            Awaits.writeFully(connection, body, 0, body.length);
        }
    }

    /**
     * Writes the response without blocking: when the connection cannot take more bytes, writing resumes on the given
     * executor once it becomes writable.
     * @return future that completes when all bytes have been written
     */
    public CompletableFuture<Void> sendAsync(HttpServerResponse response, Connection connection,
                                             ByteArrayOutputStream headersOutBuffer, Executor executor) {
        writeHead(response, headersOutBuffer);
        if (HttpStatus.mayHaveContent(response.status())) {
            headersOutBuffer.writeBytes(response.body());
        }
        byte[] message = headersOutBuffer.toByteArray();
        CompletableFuture<Void> done = new CompletableFuture<>();
        writeAvailable(connection, message, 0, done, executor);
        return done;
    }

    private void writeAvailable(Connection connection, byte[] data, int offset, CompletableFuture<Void> done, Executor executor) {
        try {
            while (offset < data.length && !done.isDone()) {
                int written = connection.write(data, offset, data.length - offset);
                if (written == 0) {
                    int resumeAt = offset;
                    connection.awaitWritable().handleAsync((ready, error) -> {
                        if (error != null) {
                            done.completeExceptionally(error);
                        }
                        else {
                            writeAvailable(connection, data, resumeAt, done, executor);
                        }
                        return null;
                    }, executor).exceptionally(rejected -> {
                        done.completeExceptionally(rejected);
                        return null;
                    });
                    return;
                }
                offset += written;
            }
            done.complete(null);
        }
        catch (IOException e) {
            done.completeExceptionally(e);
        }
    }

    void writeHead(HttpServerResponse response, ByteArrayOutputStream out) {
        out.reset();
        int status = response.status();
        writeLine(out, HttpConstants.PROTOCOL_HTTP_1_1 + " " + status + " " + HttpStatus.reasonPhrase(status));
        for (Map.Entry<String, List<String>> header: response.headers().map().entrySet()) {
            if (header.getKey().equalsIgnoreCase(HttpConstants.HEADER_CONTENT_LENGTH)) {
                continue;
            }
            for (String value: header.getValue()) {
                writeLine(out, header.getKey() + ": " + value);
            }
        }
        if (HttpStatus.mayHaveContent(status)) {
            writeLine(out, HttpConstants.HEADER_CONTENT_LENGTH + ": " + response.size());
        }
        out.writeBytes(CRLF);
    }

    private static void writeLine(ByteArrayOutputStream out, String line) {
        out.writeBytes(line.getBytes(StandardCharsets.ISO_8859_1));
        out.writeBytes(CRLF);
    }
}
