// SPDX-License-Identifier: Apache-2.0
package org.apimon.example.crud;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.apimon.instrumentation.db.ConnectionPoolStatusSource;

/**
 * A fixed size pool of pretend database connections.
 * <p>
 * Callers lease a connection for the duration of a statement and wait when none is idle. The pool reports its
 * state in the same text form a pooling database driver would, so it can feed
 * {@link org.apimon.instrumentation.db.ConnectionPoolMetrics}.
 */
public final class SimulatedConnectionPool implements ConnectionPoolStatusSource {

    private final int size;
    private final Duration acquireTimeout;
    private final Semaphore permits;
    private final AtomicInteger checkedOut = new AtomicInteger();
    private final AtomicInteger waiters = new AtomicInteger();
    private final AtomicBoolean reachable = new AtomicBoolean(true);

    public SimulatedConnectionPool(int size, @NonNull Duration acquireTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be positive, but was: " + size);
        }
        this.size = size;
        this.acquireTimeout = Objects.requireNonNull(acquireTimeout, "acquire timeout must not be null");
        this.permits = new Semaphore(size, true);
    }

    /**
     * Leases a connection, waiting up to the acquire timeout for one to become idle.
     *
     * @return the lease to close once the statement completes
     * @throws DataAccessException if the database is unreachable, the timeout elapses or the caller is interrupted
     */
    @NonNull
    public Connection acquire() {
        if (!reachable.get()) {
            throw new DataAccessException("database is unreachable");
        }
        waiters.incrementAndGet();
        final boolean acquired;
        try {
            acquired = permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataAccessException("interrupted while waiting for a connection", e);
        } finally {
            waiters.decrementAndGet();
        }
        if (!acquired) {
            throw new DataAccessException("no connection available within " + acquireTimeout);
        }
        checkedOut.incrementAndGet();
        return new Connection();
    }

    /**
     * Simulates the database going down or coming back.
     */
    public void setReachable(boolean reachable) {
        this.reachable.set(reachable);
    }

    public int size() {
        return size;
    }

    @NonNull
    @Override
    public String status() {
        final int out = checkedOut.get();
        return "Pool size: " + size
                + "  Connections in pool: " + (size - out)
                + " Current Overflow: 0"
                + " Current Checked out connections: " + out
                + " Waiters: " + waiters.get();
    }

    /**
     * A leased connection, returned to the pool on close.
     */
    public final class Connection implements AutoCloseable {

        private final AtomicBoolean closed = new AtomicBoolean();

        private Connection() {}

        /**
         * @throws DataAccessException if the database became unreachable after the lease
         */
        public void checkReachable() {
            if (!reachable.get()) {
                throw new DataAccessException("database is unreachable");
            }
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                checkedOut.decrementAndGet();
                permits.release();
            }
        }
    }
}
