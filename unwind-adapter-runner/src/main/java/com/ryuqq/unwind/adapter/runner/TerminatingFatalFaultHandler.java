package com.ryuqq.unwind.adapter.runner;

import com.ryuqq.unwind.core.fault.FatalFaultReport;
import com.ryuqq.unwind.core.spi.FatalFaultHandler;

import java.util.function.IntConsumer;

/**
 * 보고 후 프로세스를 종료하는 FatalFaultHandler.
 *
 * <p>복구되지 않은 fault를 조용한 손상보다 빠르고 눈에 띄는 실패로 처리합니다.
 * 기본 종료 코드는 2입니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>delegate.onFatal(report) (기본: LoggingFatalFaultHandler)</li>
 *   <li>exitHook.accept(exitStatus) (기본: System::exit)</li>
 * </ol>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class TerminatingFatalFaultHandler implements FatalFaultHandler {

    /**
     * 기본 종료 코드.
     */
    public static final int DEFAULT_EXIT_STATUS = 2;

    private final FatalFaultHandler delegate;
    private final IntConsumer exitHook;
    private final int exitStatus;

    /**
     * 생성자 (로그 후 System.exit(2)).
     */
    public TerminatingFatalFaultHandler() {
        this(new LoggingFatalFaultHandler(), System::exit, DEFAULT_EXIT_STATUS);
    }

    /**
     * 생성자.
     *
     * @param delegate 종료 전에 보고를 맡을 처리기
     * @param exitHook 종료 함수
     * @param exitStatus 종료 코드 (1 이상)
     * @throws IllegalArgumentException 의존성이 null이거나 exitStatus가 양수가 아닌 경우
     */
    public TerminatingFatalFaultHandler(FatalFaultHandler delegate, IntConsumer exitHook, int exitStatus) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (exitHook == null) {
            throw new IllegalArgumentException("exitHook cannot be null");
        }
        if (exitStatus <= 0) {
            throw new IllegalArgumentException("exitStatus must be positive (current: " + exitStatus + ")");
        }
        this.delegate = delegate;
        this.exitHook = exitHook;
        this.exitStatus = exitStatus;
    }

    @Override
    public void onFatal(FatalFaultReport report) {
        try {
            delegate.onFatal(report);
        } finally {
            exitHook.accept(exitStatus);
        }
    }
}
