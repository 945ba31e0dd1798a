package com.ryuqq.unwind.core.context;

import com.ryuqq.unwind.core.fault.Fault;

/**
 * fault를 바깥 context로 운반하는 내부 Throwable.
 *
 * <p>{@link Error}를 상속하여 일반적인 {@code catch (Exception e)}에 잡히지 않도록 합니다.
 * {@code catch (Throwable t)}로 잡고 다시 던지지 않으면 unwind가 중단되므로, 직접 잡거나
 * 던지지 마십시오. 제어 흐름 전용이므로 stack trace는 채우지 않습니다.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
public final class FaultSignal extends Error {

    private static final long serialVersionUID = 1L;

    // Fault는 직렬화 대상이 아님
    private final transient Fault fault;

    FaultSignal(Fault fault) {
        super("fault in '" + fault.origin() + "': " + fault.describe(), null, false, false);
        this.fault = fault;
    }

    /**
     * 운반 중인 fault.
     *
     * @return fault
     */
    public Fault fault() {
        return fault;
    }
}
