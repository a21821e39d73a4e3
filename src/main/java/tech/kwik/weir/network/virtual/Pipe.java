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

import tech.kwik.weir.network.BrokenPipeException;
import tech.kwik.weir.network.IOMode;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unidirectional, in-process byte conduit with independent read and write ends. Bytes are buffered in a bounded
 * ring buffer; the writer waits (or, in non-blocking mode, returns 0) when it is full.
 */
public class Pipe {

    public static final int DEFAULT_CAPACITY = 64 * 1024;

    private final byte[] buffer;
    private final ReentrantLock lock;
    private final Condition readable;
    private final Condition writable;
    private final List<CompletableFuture<Void>> readWaiters;
    private final List<CompletableFuture<Void>> writeWaiters;
    private final Reader reader;
    private final Writer writer;
    private int readPosition;
    private int count;
    private boolean readerClosed;
    private boolean writerClosed;

    public Pipe() {
        this(DEFAULT_CAPACITY);
    }

    public Pipe(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        buffer = new byte[capacity];
        lock = new ReentrantLock();
        readable = lock.newCondition();
        writable = lock.newCondition();
        readWaiters = new ArrayList<>();
        writeWaiters = new ArrayList<>();
        reader = new Reader();
        writer = new Writer();
    }

    public Reader getReader() {
        return reader;
    }

    public Writer getWriter() {
        return writer;
    }

    private static void completeAll(List<CompletableFuture<Void>> waiters) {
        for (CompletableFuture<Void> waiter: waiters) {
            waiter.complete(null);
        }
    }

    // Caller must hold the lock; complete the returned futures only after unlocking.
    private List<CompletableFuture<Void>> drain(List<CompletableFuture<Void>> waiters) {
        if (waiters.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Void>> drained = new ArrayList<>(waiters);
        waiters.clear();
        return drained;
    }

    public class Reader {

        private volatile IOMode ioMode = IOMode.BLOCKING;

        public int read(byte[] data, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            List<CompletableFuture<Void>> toComplete;
            int read;
            lock.lock();
            try {
                while (count == 0 && !writerClosed && !readerClosed) {
                    if (ioMode == IOMode.NON_BLOCKING) {
                        return 0;
                    }
                    try {
                        readable.await();
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("interrupted while reading from pipe");
                    }
                }
                if (readerClosed) {
                    throw new BrokenPipeException("pipe reader is closed");
                }
                if (count == 0) {
                    return -1;
                }
                read = Math.min(length, count);
                int firstPart = Math.min(read, buffer.length - readPosition);
                System.arraycopy(buffer, readPosition, data, offset, firstPart);
                System.arraycopy(buffer, 0, data, offset + firstPart, read - firstPart);
                readPosition = (readPosition + read) % buffer.length;
                count -= read;
                writable.signalAll();
                toComplete = drain(writeWaiters);
            }
            finally {
                lock.unlock();
            }
            completeAll(toComplete);
            return read;
        }

        public CompletableFuture<Void> awaitReadable() {
            lock.lock();
            try {
                if (count > 0 || writerClosed || readerClosed) {
                    return CompletableFuture.completedFuture(null);
                }
                CompletableFuture<Void> waiter = new CompletableFuture<>();
                readWaiters.add(waiter);
                return waiter;
            }
            finally {
                lock.unlock();
            }
        }

        public int available() {
            lock.lock();
            try {
                return count;
            }
            finally {
                lock.unlock();
            }
        }

        public void setIOMode(IOMode ioMode) {
            this.ioMode = ioMode;
        }

        public IOMode getIOMode() {
            return ioMode;
        }

        public void close() {
            List<CompletableFuture<Void>> toComplete = new ArrayList<>();
            lock.lock();
            try {
                readerClosed = true;
                readable.signalAll();
                writable.signalAll();
                toComplete.addAll(drain(readWaiters));
                toComplete.addAll(drain(writeWaiters));
            }
            finally {
                lock.unlock();
            }
            completeAll(toComplete);
        }
    }

    public class Writer {

        private volatile IOMode ioMode = IOMode.BLOCKING;

        public int write(byte[] data, int offset, int length) throws IOException {
            if (length == 0) {
                return 0;
            }
            List<CompletableFuture<Void>> toComplete;
            int written;
            lock.lock();
            try {
                while (true) {
                    if (readerClosed) {
                        throw new BrokenPipeException("pipe reader is closed");
                    }
                    if (writerClosed) {
                        throw new IOException("pipe writer is closed");
                    }
                    if (count < buffer.length) {
                        break;
                    }
                    if (ioMode == IOMode.NON_BLOCKING) {
                        return 0;
                    }
                    try {
                        writable.await();
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("interrupted while writing to pipe");
                    }
                }
                written = Math.min(length, buffer.length - count);
                int writePosition = (readPosition + count) % buffer.length;
                int firstPart = Math.min(written, buffer.length - writePosition);
                System.arraycopy(data, offset, buffer, writePosition, firstPart);
                System.arraycopy(data, offset + firstPart, buffer, 0, written - firstPart);
                count += written;
                readable.signalAll();
                toComplete = drain(readWaiters);
            }
            finally {
                lock.unlock();
            }
            completeAll(toComplete);
            return written;
        }

        public CompletableFuture<Void> awaitWritable() {
            lock.lock();
            try {
                if (count < buffer.length || readerClosed || writerClosed) {
                    return CompletableFuture.completedFuture(null);
                }
                CompletableFuture<Void> waiter = new CompletableFuture<>();
                writeWaiters.add(waiter);
                return waiter;
            }
            finally {
                lock.unlock();
            }
        }

        public void setIOMode(IOMode ioMode) {
            this.ioMode = ioMode;
        }

        public IOMode getIOMode() {
            return ioMode;
        }

        /**
         * Closes the write end; the reader receives the remaining buffered bytes, then end of stream.
         */
        public void close() {
            List<CompletableFuture<Void>> toComplete = new ArrayList<>();
            lock.lock();
            try {
                writerClosed = true;
                readable.signalAll();
                writable.signalAll();
                toComplete.addAll(drain(readWaiters));
                toComplete.addAll(drain(writeWaiters));
            }
            finally {
                lock.unlock();
            }
            completeAll(toComplete);
        }
    }
}
