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

import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process wide table of virtual interfaces by name. The registry does not own the interfaces: it only keeps weak,
 * lookup-only references. An interface is unregistered when its last holder releases it.
 * <p>
 * Created on first use, never torn down. All access is guarded by a single reentrant lock, so that unregistering
 * while releasing an interface from within a registry operation does not deadlock.
 */
public final class InterfaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InterfaceRegistry.class);

    private static final InterfaceRegistry INSTANCE = new InterfaceRegistry();

    private final ReentrantLock lock;
    private final Map<String, WeakReference<VirtualInterface>> interfaces;

    private InterfaceRegistry() {
        lock = new ReentrantLock();
        interfaces = new HashMap<>();
    }

    public static InterfaceRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * @throws NameCollisionException if a live interface with the same name is registered
     */
    public void register(VirtualInterface virtualInterface) {
        lock.lock();
        try {
            String name = virtualInterface.getName();
            if (lookupLive(name).isPresent()) {
                throw new NameCollisionException(name);
            }
            interfaces.put(name, new WeakReference<>(virtualInterface));
            log.debug("Registered virtual interface '{}'", name);
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * @throws InterfaceNotFoundException if no interface with the given name is registered
     */
    public void unregister(String name) {
        lock.lock();
        try {
            if (interfaces.remove(name) == null) {
                throw new InterfaceNotFoundException(name);
            }
            log.debug("Unregistered virtual interface '{}'", name);
        }
        finally {
            lock.unlock();
        }
    }

    public Optional<VirtualInterface> lookup(String name) {
        lock.lock();
        try {
            return lookupLive(name);
        }
        finally {
            lock.unlock();
        }
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    /**
     * Returns the live interface with the given name, taking a share of its ownership, or creates and registers a new
     * one. Lookup and registration happen under one lock acquisition.
     */
    VirtualInterface obtain(String name) {
        lock.lock();
        try {
            Optional<VirtualInterface> existing = lookupLive(name);
            if (existing.isPresent()) {
                existing.get().retain();
                return existing.get();
            }
            if (interfaces.containsKey(name)) {
                // Collected without being released by its holders.
                interfaces.remove(name);
            }
            VirtualInterface created = new VirtualInterface(name, this);
            register(created);
            return created;
        }
        finally {
            lock.unlock();
        }
    }

    ReentrantLock lock() {
        return lock;
    }

    private Optional<VirtualInterface> lookupLive(String name) {
        WeakReference<VirtualInterface> reference = interfaces.get(name);
        VirtualInterface virtualInterface = reference != null ? reference.get() : null;
        if (virtualInterface != null && virtualInterface.isHeld()) {
            return Optional.of(virtualInterface);
        }
        return Optional.empty();
    }
}
