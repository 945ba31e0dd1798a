package com.ryuqq.unwind.core.fault;

/**
 * 최외곽 context까지 복구되지 않은 fault.
 *
 * <p>{@link Error}를 상속하므로 일반적인 {@code catch (Exception e)}에 잡히지 않고
 * 호출 스레드를 종료시킵니다. 보고서는 {@link #report()}로 조회합니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class FatalFaultError extends Error {

    private static final long serialVersionUID = 1L;

    private final transient FatalFaultReport report;

    /**
     * 생성자.
     *
     * @param report 치명적 fault 보고서
     * @throws IllegalArgumentException report가 null인 경우
     */
    public FatalFaultError(FatalFaultReport report) {
        super(requireReport(report).render(), payloadCause(report));
        this.report = report;
    }

    /**
     * 보고서 조회.
     *
     * @return 치명적 fault 보고서
     */
    public FatalFaultReport report() {
        return report;
    }

    private static FatalFaultReport requireReport(FatalFaultReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        return report;
    }

    private static Throwable payloadCause(FatalFaultReport report) {
        return report.payload() instanceof Throwable t ? t : null;
    }
}
