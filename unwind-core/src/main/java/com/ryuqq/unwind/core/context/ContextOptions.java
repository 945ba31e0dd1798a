package com.ryuqq.unwind.core.context;

import com.ryuqq.unwind.core.spi.FatalFaultHandler;
import com.ryuqq.unwind.core.spi.noop.NoOpFatalFaultHandler;

/**
 * context chain 전체에 적용되는 옵션 (불변 record).
 *
 * @param maxDepth 허용되는 최대 중첩 깊이 (root = 1)
 * @param fatalFaultHandler 치명적 fault 처리기
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record ContextOptions(int maxDepth, FatalFaultHandler fatalFaultHandler) {

    /**
     * 기본 최대 깊이.
     */
    public static final int DEFAULT_MAX_DEPTH = 1024;

    /**
     * 기본 옵션 생성자.
     *
     * <p>기본값: maxDepth=1024, fatalFaultHandler=no-op</p>
     */
    public ContextOptions() {
        this(DEFAULT_MAX_DEPTH, NoOpFatalFaultHandler.INSTANCE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ContextOptions {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException(
                "maxDepth must be positive (current: " + maxDepth + ")"
            );
        }
        if (fatalFaultHandler == null) {
            throw new IllegalArgumentException("fatalFaultHandler cannot be null");
        }
    }
}
