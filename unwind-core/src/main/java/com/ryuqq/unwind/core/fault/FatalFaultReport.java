package com.ryuqq.unwind.core.fault;

import java.util.List;

/**
 * 복구되지 않은 fault의 최종 보고서.
 *
 * <p>payload, 통과한 context 경로(안쪽 → 바깥쪽), 그리고 unwind 도중 대체된 fault 전체를 담습니다.</p>
 *
 * @param fault 최외곽 context를 빠져나온 fault
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public record FatalFaultReport(Fault fault) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException fault가 null인 경우
     */
    public FatalFaultReport {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
    }

    /**
     * fault payload.
     *
     * @return payload (null 가능)
     */
    public Object payload() {
        return fault.payload();
    }

    /**
     * 통과한 context 경로.
     *
     * @return context 이름 목록 (안쪽 → 바깥쪽)
     */
    public List<String> unwindPath() {
        return fault.unwindPath();
    }

    /**
     * unwind 도중 대체된 fault 목록.
     *
     * @return 최신 → 과거 순 목록
     */
    public List<Fault> supersededFaults() {
        return fault.supersededChain();
    }

    /**
     * 한 줄 요약.
     *
     * @return "fault in 'origin': 설명" 형식
     */
    public String summary() {
        return "fault in '" + fault.origin() + "': " + fault.describe();
    }

    /**
     * 여러 줄 보고서 렌더링.
     *
     * <pre>
     * fatal fault in 'open': disk full
     *   unwind path: open -&gt; load -&gt; main
     *   superseded: fault in 'parse': bad header (path: parse)
     * </pre>
     *
     * @return 보고서 문자열
     */
    public String render() {
        StringBuilder sb = new StringBuilder("fatal ").append(summary());
        sb.append(System.lineSeparator())
            .append("  unwind path: ").append(String.join(" -> ", fault.unwindPath()));
        for (Fault previous : fault.supersededChain()) {
            sb.append(System.lineSeparator())
                .append("  superseded: fault in '").append(previous.origin()).append("': ")
                .append(previous.describe())
                .append(" (path: ").append(String.join(" -> ", previous.unwindPath())).append(')');
        }
        return sb.toString();
    }
}
