package com.ryuqq.unwind.testkit.contract;

import com.ryuqq.unwind.core.fault.FatalFaultReport;
import com.ryuqq.unwind.core.spi.FatalFaultHandler;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * FatalFaultHandler that records every report instead of terminating the process.
 *
 * <p>Thread-safe: reports from several threads are kept in arrival order.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public class RecordingFatalFaultHandler implements FatalFaultHandler {

    private final List<FatalFaultReport> reports = new CopyOnWriteArrayList<>();

    @Override
    public void onFatal(FatalFaultReport report) {
        reports.add(report);
    }

    /**
     * Returns the recorded reports.
     *
     * @return immutable snapshot in arrival order
     */
    public List<FatalFaultReport> reports() {
        return List.copyOf(reports);
    }

    /**
     * Returns the last recorded report.
     *
     * @return last report
     * @throws IllegalStateException if nothing was recorded
     */
    public FatalFaultReport lastReport() {
        if (reports.isEmpty()) {
            throw new IllegalStateException("No fatal fault has been reported");
        }
        return reports.get(reports.size() - 1);
    }

    /**
     * Clears the recorded reports.
     */
    public void clear() {
        reports.clear();
    }
}
