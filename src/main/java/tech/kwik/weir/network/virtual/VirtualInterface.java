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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Named rendezvous point pairing "connect" and "accept" calls into connected {@link VirtualSocket}s. Interfaces are
 * discoverable process wide by name, see {@link #obtain(String)}.
 * <p>
 * Ownership is shared by all holders that obtained the interface; each {@link #obtain(String)} must be balanced by
 * one {@link #close()}. When the last holder closes it, the interface is removed from the {@link InterfaceRegistry}.
 */
public class VirtualInterface implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(VirtualInterface.class);

    private final String name;
    private final InterfaceRegistry registry;
    final ReentrantLock submissionsLock;
    private final Condition submissionAvailable;
    private final Deque<ConnectionSubmission> submissions;
    // Guarded by the registry lock.
    private int holders;

    VirtualInterface(String name, InterfaceRegistry registry) {
        this.name = name;
        this.registry = registry;
        submissionsLock = new ReentrantLock();
        submissionAvailable = submissionsLock.newCondition();
        submissions = new ArrayDeque<>();
        holders = 1;
    }

    /**
     * Returns the live interface registered under the given name, or creates (and registers) a new one.
     */
    public static VirtualInterface obtain(String name) {
        return InterfaceRegistry.getInstance().obtain(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Submits a connection request and returns immediately. The submission is resolved by a matching accept.
     */
    public ConnectionSubmission connect() {
        ConnectionSubmission submission = new ConnectionSubmission();
        submissionsLock.lock();
        try {
            submissions.addLast(submission);
            submissionAvailable.signal();
        }
        finally {
            submissionsLock.unlock();
        }
        return submission;
    }

    /**
     * Like {@link #connect()}, but only when the interface lock is immediately available.
     * @return the submission, or null when the lock is contended; the caller decides whether and when to retry
     */
    public ConnectionSubmission connectNonBlocking() {
        if (!submissionsLock.tryLock()) {
            return null;
        }
        try {
            ConnectionSubmission submission = new ConnectionSubmission();
            submissions.addLast(submission);
            submissionAvailable.signal();
            return submission;
        }
        finally {
            submissionsLock.unlock();
        }
    }

    /**
     * Accepts the oldest pending submission.
     * @param waitingHandle  when true, waits until a submission is available; when false, returns null immediately
     * @return the server side socket, or null
     */
    public VirtualSocket accept(boolean waitingHandle) {
        return accept(() -> waitingHandle);
    }

    /**
     * Accepts the oldest pending submission, waiting as long as the given condition holds. The condition is
     * re-evaluated after every wake-up, so that {@link #notifyAcceptors()} can end the wait.
     * @return the server side socket, or null when the condition no longer holds (or the thread was interrupted)
     */
    public VirtualSocket accept(BooleanSupplier waitingHandle) {
        ConnectionSubmission submission;
        submissionsLock.lock();
        try {
            while (waitingHandle.getAsBoolean() && submissions.isEmpty()) {
                try {
                    submissionAvailable.await();
                }
                catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return null;
                }
            }
            if (!waitingHandle.getAsBoolean() || submissions.isEmpty()) {
                return null;
            }
            submission = submissions.pollFirst();
        }
        finally {
            submissionsLock.unlock();
        }
        return acceptSubmission(submission);
    }

    /**
     * Accepts the oldest pending submission, only when the interface lock is immediately available and a submission
     * is pending. Never waits.
     * @return the server side socket, or null
     */
    public VirtualSocket acceptNonBlocking() {
        if (!submissionsLock.tryLock()) {
            return null;
        }
        ConnectionSubmission submission;
        try {
            submission = submissions.pollFirst();
        }
        finally {
            submissionsLock.unlock();
        }
        return submission != null ? acceptSubmission(submission) : null;
    }

    /**
     * Wakes up all threads waiting in {@link #accept(BooleanSupplier)}.
     */
    public void notifyAcceptors() {
        submissionsLock.lock();
        try {
            submissionAvailable.signalAll();
        }
        finally {
            submissionsLock.unlock();
        }
    }

    public int pendingSubmissions() {
        submissionsLock.lock();
        try {
            return submissions.size();
        }
        finally {
            submissionsLock.unlock();
        }
    }

    private VirtualSocket acceptSubmission(ConnectionSubmission submission) {
        VirtualSocket[] pair = VirtualSocket.createPair();
        submission.setSocket(pair[1]);
        if (!submission.isValid()) {
            // Nobody will pick up the client side; the server side reads end of stream.
            pair[1].close();
        }
        log.debug("Accepted connection on virtual interface '{}'", name);
        return pair[0];
    }

    /**
     * Releases this holder's share of the interface. The last release unregisters the interface.
     * @throws IllegalStateException when all holders already released the interface
     */
    @Override
    public void close() {
        ReentrantLock registryLock = registry.lock();
        registryLock.lock();
        try {
            if (holders == 0) {
                throw new IllegalStateException("virtual interface '" + name + "' already released");
            }
            holders--;
            if (holders == 0) {
                registry.unregister(name);
            }
        }
        finally {
            registryLock.unlock();
        }
    }

    // Called with the registry lock held.
    void retain() {
        holders++;
    }

    // Called with the registry lock held.
    boolean isHeld() {
        return holders > 0;
    }

    @Override
    public String toString() {
        return "VirtualInterface[" + name + "]";
    }
}
