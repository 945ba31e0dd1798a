package com.ryuqq.unwind.core.error;

import java.util.Optional;

/**
 * 예상된 실패를 나타내는 값.
 *
 * <p>{@link #description()}을 제공하는 모든 값이 자격을 가집니다. 이 프로토콜 자체는
 * 제어 흐름에 아무 영향도 주지 않으며, 호출자가 반환값으로 받아 직접 분기합니다.
 * 잘못된 입력이나 파일 없음 같은 일상적인 실패는 fault 대신 이 값으로 전달합니다.</p>
 *
 * <p><strong>종류 판별:</strong></p>
 * <ul>
 *   <li>구체 타입: {@code instanceof} 또는 {@link Errors#as(ErrorValue, Class)}</li>
 *   <li>동일성: {@link Errors#is(ErrorValue, ErrorValue)} (cause 체인 포함)</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface ErrorValue {

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명 (null 불가)
     */
    String description();

    /**
     * 이 오류가 감싸고 있는 원인 오류.
     *
     * @return 원인 오류, 없으면 empty
     */
    default Optional<ErrorValue> cause() {
        return Optional.empty();
    }
}
