package com.ryuqq.unwind.adapter.runner;

import com.ryuqq.unwind.core.spi.MemoryManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.concurrent.ThreadFactory;

/**
 * {@link Cleaner} 기반 MemoryManager 어댑터.
 *
 * <p>JVM GC가 referent를 phantom reachable로 판정하면 Cleaner 스레드에서 callback을 호출합니다.
 * 호출 시점과 순서는 GC가 결정하며 보장되지 않습니다.</p>
 *
 * <p><strong>주의:</strong> callback이 referent를 캡처하면 referent는 절대 수거되지 않습니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class CleanerMemoryManager implements MemoryManager {

    private static final Logger log = LoggerFactory.getLogger(CleanerMemoryManager.class);

    private final Cleaner cleaner;

    /**
     * 생성자 (전용 Cleaner 스레드 생성).
     */
    public CleanerMemoryManager() {
        this(Cleaner.create());
    }

    /**
     * 생성자 (Cleaner 스레드 팩토리 지정).
     *
     * @param threadFactory Cleaner 스레드 팩토리
     * @throws IllegalArgumentException threadFactory가 null인 경우
     */
    public CleanerMemoryManager(ThreadFactory threadFactory) {
        this(Cleaner.create(requireThreadFactory(threadFactory)));
    }

    /**
     * 생성자 (기존 Cleaner 공유).
     *
     * @param cleaner 사용할 Cleaner
     * @throws IllegalArgumentException cleaner가 null인 경우
     */
    public CleanerMemoryManager(Cleaner cleaner) {
        if (cleaner == null) {
            throw new IllegalArgumentException("cleaner cannot be null");
        }
        this.cleaner = cleaner;
    }

    @Override
    public Registration track(Object referent, Runnable onUnreachable) {
        if (referent == null) {
            throw new IllegalArgumentException("referent cannot be null");
        }
        if (onUnreachable == null) {
            throw new IllegalArgumentException("onUnreachable cannot be null");
        }
        Cleaner.Cleanable cleanable = cleaner.register(referent, new LoggingCallback(onUnreachable));
        return cleanable::clean;
    }

    private static ThreadFactory requireThreadFactory(ThreadFactory threadFactory) {
        if (threadFactory == null) {
            throw new IllegalArgumentException("threadFactory cannot be null");
        }
        return threadFactory;
    }

    /**
     * Cleaner는 callback 예외를 무시하므로 로그로 남김. referent를 참조하지 않도록 static.
     */
    private static final class LoggingCallback implements Runnable {

        private final Runnable delegate;

        private LoggingCallback(Runnable delegate) {
            this.delegate = delegate;
        }

        @Override
        public void run() {
            try {
                delegate.run();
            } catch (RuntimeException e) {
                log.error("Unreachability callback failed on cleaner thread", e);
            }
        }
    }
}
