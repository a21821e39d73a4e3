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
package tech.kwik.weir.concurrent;

/**
 * Range of processors that connection workers are meant to run on, leaving a number of processors reserved for
 * system and accept duties. The JVM offers no portable way to pin threads, so this is a hint: it sizes worker pools
 * and is reported in worker thread names, it never constrains scheduling.
 */
public class ProcessorAffinity {

    private final int firstCpu;
    private final int lastCpu;

    private ProcessorAffinity(int firstCpu, int lastCpu) {
        this.firstCpu = firstCpu;
        this.lastCpu = lastCpu;
    }

    /**
     * @param reservedCpus  number of processors to keep free of workers; at least one processor always remains
     */
    public static ProcessorAffinity reserving(int reservedCpus) {
        return forProcessors(Runtime.getRuntime().availableProcessors(), reservedCpus);
    }

    static ProcessorAffinity forProcessors(int availableProcessors, int reservedCpus) {
        if (reservedCpus < 0) {
            throw new IllegalArgumentException("reserved cpus must be >= 0");
        }
        int concurrency = Math.max(1, availableProcessors - reservedCpus);
        return new ProcessorAffinity(0, concurrency - 1);
    }

    public int firstCpu() {
        return firstCpu;
    }

    public int lastCpu() {
        return lastCpu;
    }

    public int workerCount() {
        return lastCpu - firstCpu + 1;
    }

    /**
     * Thread factory whose thread names carry the cpu range, e.g. "weir-connection[cpu0-6]-1".
     */
    public DaemonThreadFactory threadFactory(String namePrefix) {
        return new DaemonThreadFactory(namePrefix + "[" + this + "]");
    }

    @Override
    public String toString() {
        return "cpu" + firstCpu + "-" + lastCpu;
    }
}
