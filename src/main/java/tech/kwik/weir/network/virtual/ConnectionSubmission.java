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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A pending client connection request on a {@link VirtualInterface}. Resolved exactly once, by an accept; from then
 * on the holder of the submission exclusively owns the resolved socket.
 */
public class ConnectionSubmission {

    private final ReentrantLock lock;
    private final Condition resolved;
    private VirtualSocket socket;
    private volatile boolean valid;

    ConnectionSubmission() {
        lock = new ReentrantLock();
        resolved = lock.newCondition();
        valid = true;
    }

    void setSocket(VirtualSocket socket) {
        lock.lock();
        try {
            if (this.socket != null) {
                throw new IllegalStateException("connection submission already resolved");
            }
            this.socket = socket;
            resolved.signalAll();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Waits until the submission is resolved or invalidated.
     * @return the client side socket, or null when invalidated (or interrupted) before resolution
     */
    public VirtualSocket getSocket() {
        lock.lock();
        try {
            while (socket == null && valid) {
                try {
                    resolved.await();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
            return socket;
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @return the client side socket if resolved and the lock is immediately available, null otherwise
     */
    public VirtualSocket getSocketNonBlocking() {
        if (valid && lock.tryLock()) {
            try {
                return socket;
            }
            finally {
                lock.unlock();
            }
        }
        return null;
    }

    public boolean isValid() {
        return valid;
    }

    /**
     * Cancels the submission: threads waiting in {@link #getSocket()} wake up. A socket resolved before remains
     * available through {@link #getSocket()}.
     */
    public void invalidate() {
        lock.lock();
        try {
            valid = false;
            resolved.signalAll();
        }
        finally {
            lock.unlock();
        }
    }
}
