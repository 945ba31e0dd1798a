package com.ryuqq.unwind.core.error;

import com.ryuqq.unwind.core.fault.Fault;

import java.util.Optional;

/**
 * 복구된 fault를 예상된 실패 값으로 변환한 오류.
 *
 * <p>payload가 {@link ErrorValue}이면 그 값을 cause로 노출하므로
 * {@link Errors#is(ErrorValue, ErrorValue)}로 원래 오류 종류를 판별할 수 있습니다.</p>
 *
 * @param fault 복구된 fault
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record RecoveredFault(Fault fault) implements ErrorValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fault가 null인 경우
     */
    public RecoveredFault {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
    }

    @Override
    public String description() {
        return "recovered fault in '" + fault.origin() + "': " + fault.describe();
    }

    @Override
    public Optional<ErrorValue> cause() {
        return fault.payloadAs(ErrorValue.class);
    }
}
