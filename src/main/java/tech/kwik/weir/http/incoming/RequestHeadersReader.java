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

import tech.kwik.weir.http.HttpError;
import tech.kwik.weir.http.HttpStatus;
import tech.kwik.weir.network.Awaits;
import tech.kwik.weir.network.BufferedInput;
import tech.kwik.weir.network.ConnectionClosedException;

import java.io.IOException;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Reads and parses the request line and header section of an HTTP/1.x request, bounded by a maximum size.
 * Bytes read beyond the end of the header section are pushed back into the {@link BufferedInput}.
 */
public class RequestHeadersReader {

    public static final int DEFAULT_READ_CHUNK_SIZE = 2048;
    public static final int DEFAULT_MAX_HEADERS_SIZE = 4096;

    private final int readChunkSize;
    private final int maxHeadersSize;

    public RequestHeadersReader() {
        this(DEFAULT_READ_CHUNK_SIZE, DEFAULT_MAX_HEADERS_SIZE);
    }

    public RequestHeadersReader(int readChunkSize, int maxHeadersSize) {
        if (readChunkSize <= 0 || maxHeadersSize <= 0) {
            throw new IllegalArgumentException("read chunk size and max headers size must be positive");
        }
        this.readChunkSize = readChunkSize;
        this.maxHeadersSize = maxHeadersSize;
    }

    /**
     * Reads the header section, waiting for data when necessary.
     * @throws HttpError when the request line or headers are malformed, or exceed the maximum size
     * @throws ConnectionClosedException when the stream ends before any byte was received
     * @throws IOException when reading fails
     */
    public Result readHeaders(BufferedInput input) throws IOException, HttpError {
        HeaderSection section = new HeaderSection();
        byte[] chunk = new byte[readChunkSize];
        while (true) {
            int read = input.read(chunk, 0, chunk.length);
            if (read == 0) {
                Awaits.await(input.awaitReadable());
                continue;
            }
            Result result = section.append(chunk, read, input);
            if (result != null) {
                return result;
            }
        }
    }

    /**
     * Reads the header section without ever blocking on the connection: when no data is available, reading resumes
     * on the given executor once the input becomes readable. Cancelling the returned future stops reading.
     * @return future completing with the result, or exceptionally with the errors listed for
     * {@link #readHeaders(BufferedInput)}
     */
    public CompletableFuture<Result> readHeadersAsync(BufferedInput input, Executor executor) {
        CompletableFuture<Result> result = new CompletableFuture<>();
        readAvailable(input, new HeaderSection(), new byte[readChunkSize], result, executor);
        return result;
    }

    private void readAvailable(BufferedInput input, HeaderSection section, byte[] chunk,
                               CompletableFuture<Result> result, Executor executor) {
        try {
            while (!result.isDone()) {
                int read = input.read(chunk, 0, chunk.length);
                if (read == 0) {
                    input.awaitReadable().handleAsync((ready, error) -> {
                        if (error != null) {
                            result.completeExceptionally(error);
                        }
                        else {
                            readAvailable(input, section, chunk, result, executor);
                        }
                        return null;
                    }, executor).exceptionally(rejected -> {
                        result.completeExceptionally(rejected);
                        return null;
                    });
                    return;
                }
                Result parsed = section.append(chunk, read, input);
                if (parsed != null) {
                    result.complete(parsed);
                }
            }
        }
        catch (IOException | HttpError e) {
            result.completeExceptionally(e);
        }
    }

    static Result parse(String headerSection) throws HttpError {
        String[] lines = headerSection.split("\r\n", -1);
        int index = 0;
        // https://www.rfc-editor.org/rfc/rfc9112.html#name-message-parsing
        // "a server that is expecting to receive and parse a request-line SHOULD ignore at least one empty line (CRLF)
        //  received prior to the request-line."
        while (index < lines.length && lines[index].isEmpty()) {
            index++;
        }
        if (index == lines.length) {
            throw new HttpError("Missing request line", HttpStatus.BAD_REQUEST);
        }
        RequestStartLine startLine = RequestStartLine.parse(lines[index++]);

        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (; index < lines.length; index++) {
            String line = lines[index];
            if (line.isEmpty()) {
                continue;
            }
            // https://www.rfc-editor.org/rfc/rfc9112.html#name-obsolete-line-folding
            if (line.charAt(0) == ' ' || line.charAt(0) == '\t') {
                throw new HttpError("Obsolete line folding in header section", HttpStatus.BAD_REQUEST);
            }
            int colon = line.indexOf(':');
            if (colon <= 0 || !RequestStartLine.isToken(line.substring(0, colon))) {
                throw new HttpError("Invalid header line", HttpStatus.BAD_REQUEST);
            }
            String name = line.substring(0, colon);
            String value = line.substring(colon + 1).trim();
            headers.computeIfAbsent(name, key -> new ArrayList<>()).add(value);
        }
        return new Result(startLine, HttpHeaders.of(headers, (name, value) -> true));
    }

    private class HeaderSection {

        private final byte[] bytes = new byte[maxHeadersSize + readChunkSize];
        private int size;

        /**
         * @return the parsed result when the end of the header section has been received, null when more data is
         * needed
         */
        Result append(byte[] chunk, int length, BufferedInput input) throws IOException, HttpError {
            if (length < 0) {
                if (size == 0) {
                    throw new ConnectionClosedException("connection closed before request was received");
                }
                throw new HttpError("Incomplete request headers", HttpStatus.BAD_REQUEST);
            }
            int searchFrom = Math.max(0, size - 3);
            System.arraycopy(chunk, 0, bytes, size, length);
            size += length;
            int end = indexOfEmptyLine(searchFrom);
            if (end < 0) {
                if (size >= maxHeadersSize) {
                    throw new HttpError("Request headers too large", HttpStatus.REQUEST_HEADER_FIELDS_TOO_LARGE);
                }
                return null;
            }
            int sectionLength = end + 4;
            if (sectionLength > maxHeadersSize) {
                throw new HttpError("Request headers too large", HttpStatus.REQUEST_HEADER_FIELDS_TOO_LARGE);
            }
            input.unread(bytes, sectionLength, size - sectionLength);
            return parse(new String(bytes, 0, end, StandardCharsets.ISO_8859_1));
        }

        private int indexOfEmptyLine(int from) {
            for (int i = from; i + 3 < size; i++) {
                if (bytes[i] == '\r' && bytes[i + 1] == '\n' && bytes[i + 2] == '\r' && bytes[i + 3] == '\n') {
                    return i;
                }
            }
            return -1;
        }
    }

    public static class Result {

        private final RequestStartLine startLine;
        private final HttpHeaders headers;

        public Result(RequestStartLine startLine, HttpHeaders headers) {
            this.startLine = startLine;
            this.headers = headers;
        }

        public RequestStartLine startLine() {
            return startLine;
        }

        public HttpHeaders headers() {
            return headers;
        }
    }
}
