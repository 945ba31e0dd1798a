package com.ryuqq.unwind.core.spi.noop;

import com.ryuqq.unwind.core.fault.FatalFaultReport;
import com.ryuqq.unwind.core.spi.FatalFaultHandler;

/**
 * 아무 처리도 하지 않는 FatalFaultHandler.
 *
 * <p>보고는 호출 스레드로 던져지는 FatalFaultError에만 맡깁니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class NoOpFatalFaultHandler implements FatalFaultHandler {

    /**
     * 공유 인스턴스.
     */
    public static final NoOpFatalFaultHandler INSTANCE = new NoOpFatalFaultHandler();

    private NoOpFatalFaultHandler() {
    }

    @Override
    public void onFatal(FatalFaultReport report) {
        // no-op
    }
}
