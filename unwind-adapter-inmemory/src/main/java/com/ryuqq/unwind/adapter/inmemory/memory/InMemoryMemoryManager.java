package com.ryuqq.unwind.adapter.inmemory.memory;

import com.ryuqq.unwind.core.spi.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link MemoryManager} SPI for testing and reference purposes.
 *
 * <p>Instead of waiting for the garbage collector, tests decide which tracked objects are
 * unreachable with {@link #markUnreachable(Object)} and deliver the notifications with {@link #sweep()}.
 * Callbacks run on the thread that calls {@code sweep()}, so finalizer behavior is fully deterministic.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tracked:</strong> IdentityHashMap&lt;Object, List&lt;Tracking&gt;&gt; - Registrations per referent (identity, not equals)</li>
 *   <li><strong>unreachable:</strong> List&lt;Tracking&gt; - Registrations waiting for the next sweep</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Tracked objects are strongly referenced until swept or cleaned (never collected)</li>
 *   <li>Reachability is whatever the test says it is</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryMemoryManager memory = new InMemoryMemoryManager();
 * FinalizerRegistry registry = new DefaultFinalizerRegistry(memory);
 *
 * Connection conn = new Connection(socket);
 * registry.register(conn, socket, Socket::close);
 *
 * // 1. 도달 불가로 표시
 * memory.markUnreachable(conn);
 *
 * // 2. 통지 전달 (호출 스레드에서 cleanup 실행)
 * int delivered = memory.sweep();
 * </pre>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public class InMemoryMemoryManager implements MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryManager.class);

    private final Map<Object, List<Tracking>> tracked = new IdentityHashMap<>();
    private final List<Tracking> unreachable = new ArrayList<>();

    @Override
    public synchronized Registration track(Object referent, Runnable onUnreachable) {
        if (referent == null) {
            throw new IllegalArgumentException("referent cannot be null");
        }
        if (onUnreachable == null) {
            throw new IllegalArgumentException("onUnreachable cannot be null");
        }
        Tracking tracking = new Tracking(referent, onUnreachable);
        tracked.computeIfAbsent(referent, key -> new ArrayList<>()).add(tracking);
        return tracking;
    }

    /**
     * Marks an object as unreachable.
     *
     * <p>All registrations for the object are queued for the next {@link #sweep()}.</p>
     *
     * @param referent previously tracked object
     * @return number of registrations queued (0 if the object is not tracked)
     * @throws IllegalArgumentException if referent is null
     */
    public synchronized int markUnreachable(Object referent) {
        if (referent == null) {
            throw new IllegalArgumentException("referent cannot be null");
        }
        List<Tracking> registrations = tracked.remove(referent);
        if (registrations == null) {
            return 0;
        }
        unreachable.addAll(registrations);
        return registrations.size();
    }

    /**
     * Delivers queued unreachability notifications on the calling thread.
     *
     * <p>A failing callback is logged and does not prevent the remaining callbacks from running.</p>
     *
     * @return number of callbacks invoked
     */
    public int sweep() {
        List<Tracking> batch;
        synchronized (this) {
            batch = new ArrayList<>(unreachable);
            unreachable.clear();
        }
        int delivered = 0;
        for (Tracking tracking : batch) {
            if (!tracking.claim()) {
                continue;
            }
            try {
                tracking.onUnreachable.run();
            } catch (RuntimeException e) {
                log.warn("Unreachability callback failed for {}", tracking.referentType, e);
            }
            delivered++;
        }
        return delivered;
    }

    /**
     * Number of registrations not yet swept or cleaned.
     *
     * @return pending registration count
     */
    public synchronized int pendingCount() {
        int count = 0;
        for (List<Tracking> registrations : tracked.values()) {
            count += registrations.size();
        }
        return count + unreachable.size();
    }

    /**
     * Drops all registrations without invoking any callback.
     */
    public synchronized void clear() {
        tracked.clear();
        unreachable.clear();
    }

    private synchronized void untrack(Tracking tracking) {
        List<Tracking> registrations = tracked.get(tracking.referent);
        if (registrations != null) {
            registrations.remove(tracking);
            if (registrations.isEmpty()) {
                tracked.remove(tracking.referent);
            }
        }
        unreachable.remove(tracking);
    }

    private final class Tracking implements Registration {

        private final Object referent;
        private final String referentType;
        private final Runnable onUnreachable;
        private boolean done;

        private Tracking(Object referent, Runnable onUnreachable) {
            this.referent = referent;
            this.referentType = referent.getClass().getName();
            this.onUnreachable = onUnreachable;
        }

        private boolean claim() {
            synchronized (InMemoryMemoryManager.this) {
                if (done) {
                    return false;
                }
                done = true;
                return true;
            }
        }

        /**
         * Explicit clean: runs the callback once on the calling thread, like {@link java.lang.ref.Cleaner.Cleanable#clean()}.
         */
        @Override
        public void clean() {
            if (!claim()) {
                return;
            }
            untrack(this);
            onUnreachable.run();
        }
    }
}
