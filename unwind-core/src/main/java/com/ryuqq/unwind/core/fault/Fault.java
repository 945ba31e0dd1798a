package com.ryuqq.unwind.core.fault;

import com.ryuqq.unwind.core.error.ErrorValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 활성 fault (불변 record).
 *
 * <p>raise 시점의 payload와 발생 context, 그리고 지금까지 통과한 context 경로를 담습니다.
 * payload는 임의의 타입(null 포함)이며 {@link #payloadAs(Class)}로 안전하게 다운캐스트합니다.</p>
 *
 * <p><strong>대체(supersede) 체인:</strong></p>
 * <ul>
 *   <li>unwind 중 deferred action이 새 fault를 발생시키면 새 fault가 기존 fault를 대체합니다.</li>
 *   <li>기존 fault는 버려지지 않고 {@link #superseded()}로 연결됩니다 (최신 → 과거 순).</li>
 *   <li>기존 fault의 경로에는 대체가 일어난 context까지 기록됩니다.</li>
 * </ul>
 *
 * @param payload raise에 전달된 값 (null 허용)
 * @param origin fault가 발생한 context 이름
 * @param unwindPath 통과한 context 이름 목록 (안쪽 → 바깥쪽)
 * @param superseded 이 fault가 대체한 이전 fault (없으면 null)
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record Fault(
    Object payload,
    String origin,
    List<String> unwindPath,
    Fault superseded
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException origin이 null이거나 빈 문자열인 경우, unwindPath가 null인 경우
     */
    public Fault {
        if (origin == null || origin.isBlank()) {
            throw new IllegalArgumentException("origin cannot be null or blank");
        }
        if (unwindPath == null) {
            throw new IllegalArgumentException("unwindPath cannot be null");
        }
        unwindPath = List.copyOf(unwindPath);
        // payload, superseded는 null 허용
    }

    /**
     * 새로 발생한 fault 생성 (경로 비어 있음).
     *
     * @param payload raise에 전달된 값
     * @param origin 발생 context 이름
     * @return Fault 인스턴스
     */
    public static Fault raised(Object payload, String origin) {
        return new Fault(payload, origin, List.of(), null);
    }

    /**
     * context 하나를 통과한 fault 생성.
     *
     * @param contextName 방금 빠져나온 context 이름
     * @return 경로가 확장된 새 Fault
     */
    public Fault passedThrough(String contextName) {
        if (contextName == null || contextName.isBlank()) {
            throw new IllegalArgumentException("contextName cannot be null or blank");
        }
        List<String> path = new ArrayList<>(unwindPath);
        path.add(contextName);
        return new Fault(payload, origin, path, superseded);
    }

    /**
     * 이전 fault를 대체하는 fault 생성.
     *
     * <p>이 fault가 이미 대체 체인을 가지고 있으면 체인의 끝에 previous를 연결합니다.</p>
     *
     * @param previous 대체되는 fault
     * @return 체인이 연결된 새 Fault
     */
    public Fault supersede(Fault previous) {
        if (previous == null) {
            throw new IllegalArgumentException("previous cannot be null");
        }
        Fault tail = superseded == null ? previous : superseded.supersede(previous);
        return new Fault(payload, origin, unwindPath, tail);
    }

    /**
     * payload를 지정한 타입으로 조회.
     *
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 타입이 일치하면 payload, 아니면 empty
     */
    public <T> Optional<T> payloadAs(Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return type.isInstance(payload) ? Optional.of(type.cast(payload)) : Optional.empty();
    }

    /**
     * 다른 fault를 대체했는지 확인.
     *
     * @return 대체 체인이 있으면 true
     */
    public boolean isSuperseding() {
        return superseded != null;
    }

    /**
     * 대체된 fault 목록 (최신 → 과거 순).
     *
     * @return 불변 목록
     */
    public List<Fault> supersededChain() {
        List<Fault> chain = new ArrayList<>();
        for (Fault f = superseded; f != null; f = f.superseded()) {
            chain.add(f);
        }
        return Collections.unmodifiableList(chain);
    }

    /**
     * payload의 사람이 읽을 수 있는 설명.
     *
     * @return ErrorValue는 description, Throwable은 "클래스: 메시지", 그 외는 String.valueOf
     */
    public String describe() {
        if (payload instanceof ErrorValue error) {
            return error.description();
        }
        if (payload instanceof Throwable throwable) {
            return throwable.getClass().getName()
                + (throwable.getMessage() != null ? ": " + throwable.getMessage() : "");
        }
        return String.valueOf(payload);
    }
}
