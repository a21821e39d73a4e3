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
package tech.kwik.weir.server;

import tech.kwik.weir.concurrent.ProcessorAffinity;
import tech.kwik.weir.http.incoming.RequestHeadersReader;

/**
 * Settings shared by the connection handlers. Immutable; create with {@link #builder()}.
 */
public class HttpServerConfig {

    public static final String DEFAULT_SERVER_NAME = "weir/1.0";

    private final String serverName;
    private final int maxHeadersSize;
    private final int readChunkSize;
    private final int headersBufferCapacity;
    private final int inputBufferSize;
    private final int workerThreads;
    private final int reservedCpus;

    private HttpServerConfig(Builder builder) {
        serverName = builder.serverName;
        maxHeadersSize = builder.maxHeadersSize;
        readChunkSize = builder.readChunkSize;
        headersBufferCapacity = builder.headersBufferCapacity;
        inputBufferSize = builder.inputBufferSize;
        workerThreads = builder.workerThreads;
        reservedCpus = builder.reservedCpus;
    }

    public static HttpServerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return value of the Server header added to responses that do not have one
     */
    public String serverName() {
        return serverName;
    }

    public int maxHeadersSize() {
        return maxHeadersSize;
    }

    public int readChunkSize() {
        return readChunkSize;
    }

    /**
     * @return initial capacity of the per connection buffer used to assemble response heads
     */
    public int headersBufferCapacity() {
        return headersBufferCapacity;
    }

    public int inputBufferSize() {
        return inputBufferSize;
    }

    /**
     * @return number of workers of the cooperative handler's pool; when not set, the number of processors left after
     * reserving {@link #reservedCpus()}
     */
    public int workerThreads() {
        return workerThreads > 0 ? workerThreads : processorAffinity().workerCount();
    }

    public int reservedCpus() {
        return reservedCpus;
    }

    public ProcessorAffinity processorAffinity() {
        return ProcessorAffinity.reserving(reservedCpus);
    }

    public RequestHeadersReader createHeadersReader() {
        return new RequestHeadersReader(readChunkSize, maxHeadersSize);
    }

    @Override
    public String toString() {
        return "HttpServerConfig[serverName=" + serverName + ", maxHeadersSize=" + maxHeadersSize
                + ", readChunkSize=" + readChunkSize + ", workerThreads=" + workerThreads()
                + ", reservedCpus=" + reservedCpus + "]";
    }

    public static class Builder {

        private String serverName = DEFAULT_SERVER_NAME;
        private int maxHeadersSize = RequestHeadersReader.DEFAULT_MAX_HEADERS_SIZE;
        private int readChunkSize = RequestHeadersReader.DEFAULT_READ_CHUNK_SIZE;
        private int headersBufferCapacity = 2048;
        private int inputBufferSize = 4096;
        private int workerThreads;
        private int reservedCpus = 1;

        private Builder() {
        }

        public Builder serverName(String serverName) {
            if (serverName == null || serverName.isBlank()) {
                throw new IllegalArgumentException("server name must not be empty");
            }
            this.serverName = serverName;
            return this;
        }

        public Builder maxHeadersSize(int maxHeadersSize) {
            if (maxHeadersSize <= 0) {
                throw new IllegalArgumentException("max headers size must be > 0");
            }
            this.maxHeadersSize = maxHeadersSize;
            return this;
        }

        public Builder readChunkSize(int readChunkSize) {
            if (readChunkSize <= 0) {
                throw new IllegalArgumentException("read chunk size must be > 0");
            }
            this.readChunkSize = readChunkSize;
            return this;
        }

        public Builder headersBufferCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("headers buffer capacity must be > 0");
            }
            this.headersBufferCapacity = capacity;
            return this;
        }

        public Builder inputBufferSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("input buffer size must be > 0");
            }
            this.inputBufferSize = size;
            return this;
        }

        /**
         * @param workerThreads  size of the cooperative worker pool; 0 means derived from the available processors
         */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 0) {
                throw new IllegalArgumentException("worker threads must be >= 0");
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder reservedCpus(int reservedCpus) {
            if (reservedCpus < 0) {
                throw new IllegalArgumentException("reserved cpus must be >= 0");
            }
            this.reservedCpus = reservedCpus;
            return this;
        }

        public HttpServerConfig build() {
            return new HttpServerConfig(this);
        }
    }
}
