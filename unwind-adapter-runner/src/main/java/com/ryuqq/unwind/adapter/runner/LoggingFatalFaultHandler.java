package com.ryuqq.unwind.adapter.runner;

import com.ryuqq.unwind.core.fault.FatalFaultReport;
import com.ryuqq.unwind.core.spi.FatalFaultHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 치명적 fault 보고서를 ERROR 로그로 남기는 FatalFaultHandler.
 *
 * <p>payload가 Throwable이면 stack trace도 함께 기록합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class LoggingFatalFaultHandler implements FatalFaultHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingFatalFaultHandler.class);

    @Override
    public void onFatal(FatalFaultReport report) {
        if (report.payload() instanceof Throwable cause) {
            log.error("{}", report.render(), cause);
        } else {
            log.error("{}", report.render());
        }
    }
}
