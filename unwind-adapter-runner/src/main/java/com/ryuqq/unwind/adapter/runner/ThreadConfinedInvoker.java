package com.ryuqq.unwind.adapter.runner;

import com.ryuqq.unwind.application.invoker.Invoker;
import com.ryuqq.unwind.core.context.Body;
import com.ryuqq.unwind.core.context.ContextOptions;
import com.ryuqq.unwind.core.context.InvocationContext;
import com.ryuqq.unwind.core.error.Result;
import com.ryuqq.unwind.core.spi.FatalFaultHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 호출 스레드에 root context를 여는 Invoker 구현체.
 *
 * <p>호출마다 독립된 context chain을 만들며, chain은 호출 스레드 전용입니다.
 * 인스턴스 자체는 상태가 없으므로 여러 스레드가 공유해도 안전합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>InvokerConfig + FatalFaultHandler → ContextOptions 변환 (생성 시 1회)</li>
 *   <li>run: {@link InvocationContext#enter}로 root context 실행</li>
 *   <li>attempt: {@link InvocationContext#enterAttempt}로 실행, fault는 Err로 변환</li>
 * </ol>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class ThreadConfinedInvoker implements Invoker {

    private static final Logger log = LoggerFactory.getLogger(ThreadConfinedInvoker.class);

    private final InvokerConfig config;
    private final ContextOptions options;

    /**
     * 생성자 (기본 LoggingFatalFaultHandler 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ThreadConfinedInvoker(InvokerConfig config) {
        this(config, new LoggingFatalFaultHandler());
    }

    /**
     * 생성자 (커스텀 FatalFaultHandler 주입).
     *
     * @param config 설정
     * @param fatalFaultHandler 치명적 fault 처리기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ThreadConfinedInvoker(InvokerConfig config, FatalFaultHandler fatalFaultHandler) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (fatalFaultHandler == null) {
            throw new IllegalArgumentException("fatalFaultHandler cannot be null");
        }
        this.config = config;
        this.options = new ContextOptions(config.maxDepth(), fatalFaultHandler);
    }

    @Override
    public <T> T run(String name, Body<T> body) {
        return InvocationContext.enter(name, options, body);
    }

    @Override
    public <T> Result<T> attempt(String name, Body<T> body) {
        Result<T> result = InvocationContext.enterAttempt(name, options, body);
        if (config.logRecoveredAttempts()) {
            result.failure().ifPresent(error ->
                log.warn("Attempt '{}' ended with a recovered fault: {}", name, error.description()));
        }
        return result;
    }
}
