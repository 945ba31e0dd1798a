/**
 * Contract test infrastructure.
 *
 * <p>Provides {@link com.ryuqq.unwind.testkit.contract.AbstractContractTest} and
 * {@link com.ryuqq.unwind.testkit.contract.RecordingFatalFaultHandler} so that adapter
 * implementations can be verified against the same deferred-execution scenarios.</p>
 *
 * @author Unwind Team
 * @since 1.0.0
 */
package com.ryuqq.unwind.testkit.contract;
