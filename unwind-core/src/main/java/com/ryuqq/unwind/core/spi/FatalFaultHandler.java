package com.ryuqq.unwind.core.spi;

import com.ryuqq.unwind.core.fault.FatalFaultReport;

/**
 * 복구되지 않은 fault 처리 SPI.
 *
 * <p>최외곽 context가 fault를 안고 종료될 때, {@link com.ryuqq.unwind.core.fault.FatalFaultError}를
 * 던지기 직전에 한 번 호출됩니다. 보고(로그, 알림)나 프로세스 종료를 담당합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>fault가 발생한 스레드에서 동기적으로 호출됩니다.</li>
 *   <li>이 메서드가 정상 반환하면 FatalFaultError가 호출 스레드로 던져집니다.</li>
 *   <li>예외를 던져도 FatalFaultError는 그대로 던져지며, 예외는 suppressed로 보존됩니다.</li>
 * </ul>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public interface FatalFaultHandler {

    /**
     * 치명적 fault 처리.
     *
     * @param report payload, unwind 경로, 대체된 fault를 담은 보고서
     */
    void onFatal(FatalFaultReport report);
}
