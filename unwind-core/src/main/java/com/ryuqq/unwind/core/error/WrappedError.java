package com.ryuqq.unwind.core.error;

import java.util.Optional;

/**
 * 문맥 메시지를 덧붙여 다른 오류를 감싼 오류 값.
 *
 * @param message 덧붙일 문맥 (예: "open config.yml")
 * @param wrapped 원인 오류
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record WrappedError(String message, ErrorValue wrapped) implements ErrorValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException message가 비었거나 wrapped가 null인 경우
     */
    public WrappedError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (wrapped == null) {
            throw new IllegalArgumentException("wrapped cannot be null");
        }
    }

    @Override
    public String description() {
        return message + ": " + wrapped.description();
    }

    @Override
    public Optional<ErrorValue> cause() {
        return Optional.of(wrapped);
    }
}
