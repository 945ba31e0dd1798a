package com.ryuqq.unwind.core.defer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 예약된 deferred action 하나 (불변 record).
 *
 * <p><strong>인자 캡처:</strong> capturedArgs는 {@code defer} 호출 시점에 고정된 값입니다.
 * 이후 원본 변수가 바뀌어도 이 엔트리는 예약 당시의 값을 사용합니다. 반면 action 본문이
 * 클로저로 읽는 값은 실행 시점의 값입니다.</p>
 *
 * <p>가변 객체를 인자로 넘기면 참조가 고정될 뿐 객체 내용은 고정되지 않습니다.</p>
 *
 * @param sequence 같은 stack 안에서의 등록 순번 (0부터)
 * @param description 로그/진단용 설명
 * @param capturedArgs 등록 시점에 고정된 인자 (불변, null 요소 허용)
 * @param action 실행할 작업
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record DeferredEntry(
    long sequence,
    String description,
    List<Object> capturedArgs,
    DeferredAction action
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public DeferredEntry {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must not be negative (current: " + sequence + ")");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        if (capturedArgs == null) {
            throw new IllegalArgumentException("capturedArgs cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        // List.copyOf는 null 요소를 거부하므로 직접 복사
        capturedArgs = Collections.unmodifiableList(new ArrayList<>(capturedArgs));
    }
}
