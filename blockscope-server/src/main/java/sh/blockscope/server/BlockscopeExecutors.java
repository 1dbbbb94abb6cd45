// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.blockscope.server;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the service's executors.
 */
public final class BlockscopeExecutors {

    private static final AtomicInteger FETCH_THREAD_ID = new AtomicInteger(0);

    private BlockscopeExecutors() {
    }

    /**
     * Creates a bounded pool for concurrent node lookups.
     *
     * <p>Threads are daemons named {@code blockscope-fetch-N}.
     *
     * @param threads the number of threads in the pool
     * @return a fixed-size thread pool
     * @throws IllegalArgumentException if threads is less than 1
     */
    public static ExecutorService newFetchExecutor(final int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got: " + threads);
        }
        return Executors.newFixedThreadPool(threads, r -> {
            // mask the sign bit so ids stay non-negative after overflow
            final int id = FETCH_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            final Thread t = new Thread(r, "blockscope-fetch-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
