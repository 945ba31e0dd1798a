package com.ryuqq.unwind.core.context;

import com.ryuqq.unwind.core.error.ErrorValue;

/**
 * 중첩 깊이 초과 fault의 payload.
 *
 * @param contextName 진입하려던 context 이름
 * @param maxDepth 설정된 최대 깊이
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record DepthExceeded(String contextName, int maxDepth) implements ErrorValue {

    @Override
    public String description() {
        return "maximum invocation depth " + maxDepth + " exceeded entering '" + contextName + "'";
    }
}
