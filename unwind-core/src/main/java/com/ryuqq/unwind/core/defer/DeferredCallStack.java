package com.ryuqq.unwind.core.defer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * context 하나에 속한 deferred action stack.
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>실행 순서는 등록의 역순 (LIFO)</li>
 *   <li>{@link #drain(Consumer)}는 stack 당 정확히 한 번만 실행</li>
 *   <li>각 엔트리는 최대 한 번 실행</li>
 *   <li>엔트리가 실패해도 나머지 엔트리는 계속 실행 (실패는 failureSink로 전달)</li>
 *   <li>drain 시작 이후의 예약은 거부</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 단일 스레드 전용입니다. 소유 스레드 검증은 InvocationContext가 담당합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class DeferredCallStack {

    private final Deque<DeferredEntry> entries = new ArrayDeque<>();
    private long nextSequence;
    private boolean drainStarted;

    /**
     * deferred action 예약.
     *
     * @param description 설명
     * @param action 실행할 작업
     * @param capturedArgs 등록 시점에 고정할 인자
     * @return 생성된 엔트리
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws IllegalStateException drain이 이미 시작된 경우
     */
    public DeferredEntry schedule(String description, DeferredAction action, List<Object> capturedArgs) {
        if (drainStarted) {
            throw new IllegalStateException("Cannot schedule '" + description + "': deferred stack is already draining");
        }
        DeferredEntry entry = new DeferredEntry(nextSequence, description, capturedArgs, action);
        nextSequence++;
        entries.push(entry);
        return entry;
    }

    /**
     * 예약된 작업을 LIFO 순서로 모두 실행.
     *
     * @param failureSink 엔트리가 던진 예외를 받는 콜백 (현재 엔트리 실행 직후, 다음 엔트리 실행 전에 호출)
     * @return 실행한 엔트리 수
     * @throws IllegalArgumentException failureSink가 null인 경우
     * @throws IllegalStateException 이미 drain한 경우
     */
    public int drain(Consumer<Throwable> failureSink) {
        if (failureSink == null) {
            throw new IllegalArgumentException("failureSink cannot be null");
        }
        if (drainStarted) {
            throw new IllegalStateException("Deferred stack has already been drained");
        }
        drainStarted = true;

        int executed = 0;
        DeferredEntry entry;
        while ((entry = entries.poll()) != null) {
            executed++;
            try {
                entry.action().run();
            } catch (Throwable t) {
                failureSink.accept(t);
            }
        }
        return executed;
    }

    /**
     * 아직 실행되지 않은 엔트리 수.
     *
     * @return 대기 중인 엔트리 수
     */
    public int size() {
        return entries.size();
    }

    /**
     * drain 시작 여부.
     *
     * @return drain이 시작되었으면 true
     */
    public boolean isDrainStarted() {
        return drainStarted;
    }

    /**
     * 대기 중인 엔트리 스냅샷 (실행될 순서).
     *
     * @return 불변 목록
     */
    public List<DeferredEntry> pending() {
        return List.copyOf(new ArrayList<>(entries));
    }
}
