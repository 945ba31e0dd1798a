package com.ryuqq.unwind.core.context;

import com.ryuqq.unwind.core.defer.DeferredAction;
import com.ryuqq.unwind.core.defer.DeferredCallStack;
import com.ryuqq.unwind.core.defer.DeferredEntry;
import com.ryuqq.unwind.core.error.RecoveredFault;
import com.ryuqq.unwind.core.error.Result;
import com.ryuqq.unwind.core.fault.FatalFaultError;
import com.ryuqq.unwind.core.fault.FatalFaultReport;
import com.ryuqq.unwind.core.fault.Fault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * 하나의 논리적 실행 단위 (call frame).
 *
 * <p>deferred action stack, 바깥 context 참조, 활성 fault를 소유합니다.
 * 진입 시 생성되고, deferred stack이 모두 실행된 뒤 종료됩니다.</p>
 *
 * <p><strong>실행 흐름:</strong></p>
 * <pre>
 * enter / call
 *   ↓
 * body.apply(context)
 *   ├─ 정상 반환 ─────────────┐
 *   └─ raise / 예외 → UNWINDING ┤
 *                             ↓
 * deferred stack drain (LIFO, 정확히 한 번)
 *   - 엔트리에서 recover() → RECOVERED
 *   - 엔트리에서 새 fault  → 기존 fault를 대체 (UNWINDING)
 *                             ↓
 * exit
 *   ├─ NORMAL / RECOVERED → 호출자에게 정상 반환
 *   ├─ UNWINDING + parent → 바깥 context로 fault 전파
 *   └─ UNWINDING + root   → FATAL, FatalFaultHandler 호출 후 FatalFaultError
 * </pre>
 *
 * <p><strong>recover 규칙:</strong></p>
 * <ul>
 *   <li>이 context의 deferred action 안에서 직접 호출될 때만 효과가 있습니다.</li>
 *   <li>본문이나, deferred action이 연 하위 context 안에서 호출하면 아무 효과 없이 empty를 반환합니다.</li>
 *   <li>활성 fault가 없으면 empty를 반환합니다.</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> context는 생성한 스레드 전용입니다. 다른 스레드에서 사용하면
 * {@link IllegalStateException}이 발생합니다. 스레드마다 독립된 context chain을 가지므로
 * 한 스레드의 fault는 다른 스레드에 영향을 주지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String value = InvocationContext.enter("main", options, ctx -&gt; {
 *     ctx.defer(() -&gt; log.info("main done"));
 *     return ctx.call("load", load -&gt; {
 *         load.defer(() -&gt; load.recover()
 *             .ifPresent(fault -&gt; load.setResult("fallback")));
 *         throw load.raise("disk full");
 *     });
 * });
 * // value == "fallback"
 * </pre>
 *
 * <p><strong>반환값 타입:</strong> context는 본문의 반환 타입 {@code T}로 타입이 정해지며,
 * {@link #setResult(Object)}는 같은 타입의 값만 받습니다.</p>
 *
 * @param <T> 이 context가 호출자에게 반환하는 값의 타입
 * @author Unwind Team
 * @since 1.0.0
 */
public final class InvocationContext<T> {

    private static final Logger log = LoggerFactory.getLogger(InvocationContext.class);

    private final String name;
    private final InvocationContext<?> parent;
    private final ContextOptions options;
    private final Thread owner;
    private final int depth;
    private final DeferredCallStack deferredStack = new DeferredCallStack();

    private ContextState state = ContextState.NORMAL;
    private Fault activeFault;
    private final boolean returnsFault;
    private InvocationContext<?> child;
    private boolean draining;
    private boolean exited;
    private boolean resultOverridden;
    private T resultOverride;

    private InvocationContext(String name, InvocationContext<?> parent, ContextOptions options, boolean returnsFault) {
        this.name = name;
        this.parent = parent;
        this.options = options;
        this.returnsFault = returnsFault;
        this.owner = Thread.currentThread();
        this.depth = parent == null ? 1 : parent.depth + 1;
    }

    /**
     * root context를 열고 본문을 실행.
     *
     * @param name root context 이름
     * @param options chain 옵션
     * @param body 실행할 본문
     * @param <R> 반환 타입
     * @return 본문 반환값, 복구된 경우 setResult 값 또는 null
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws FatalFaultError 어디에서도 복구되지 않은 fault
     */
    public static <R> R enter(String name, ContextOptions options, Body<R> body) {
        validateRoot(name, options, body);
        return new InvocationContext<R>(name, null, options, false).execute(body);
    }

    /**
     * root context를 열고, 빠져나온 fault를 {@link RecoveredFault} 오류로 변환.
     *
     * <p>fault가 root를 빠져나와도 FATAL로 가지 않으며 FatalFaultHandler도 호출되지 않습니다.
     * 본문 안의 deferred action이 fault를 복구하면 {@code Ok(setResult 값 또는 null)}을 반환합니다.</p>
     *
     * @param name root context 이름
     * @param options chain 옵션
     * @param body 실행할 본문
     * @param <R> 값 타입
     * @return 본문 반환값의 Ok, 또는 복구된 fault의 Err (null을 반환하지 않음)
     */
    public static <R> Result<R> enterAttempt(String name, ContextOptions options, Body<R> body) {
        validateRoot(name, options, body);
        return settle(new InvocationContext<R>(name, null, options, true), body);
    }

    /**
     * 하위 context를 열고 본문을 실행.
     *
     * <p>하위 context에서 복구되지 않은 fault는 이 메서드에서 다시 던져져 현재 context의 fault가 됩니다.</p>
     *
     * @param name 하위 context 이름
     * @param body 실행할 본문
     * @param <R> 반환 타입
     * @return 본문 반환값, 복구된 경우 setResult 값 또는 null
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws IllegalStateException 이 context가 가장 안쪽 활성 context가 아니거나 이미 종료된 경우
     */
    public <R> R call(String name, Body<R> body) {
        InvocationContext<R> callee = open("call", name, body, false);
        try {
            return callee.execute(body);
        } finally {
            child = null;
        }
    }

    /**
     * 하위 context에서 본문을 실행하고, fault를 예상된 실패로 변환.
     *
     * <p>본문이 정상 반환하면 {@code Ok(value)}, fault로 끝나면 {@code Err(RecoveredFault)}를 반환합니다.
     * 본문의 deferred action이 fault를 복구한 경우 {@code Ok(setResult 값 또는 null)}입니다.
     * 깊이 제한 초과는 현재 context의 fault로 발생합니다.</p>
     *
     * @param name 하위 context 이름
     * @param body 실행할 본문
     * @param <R> 값 타입
     * @return Ok 또는 Err (null을 반환하지 않음)
     */
    public <R> Result<R> attempt(String name, Body<R> body) {
        InvocationContext<R> callee = open("attempt", name, body, true);
        try {
            return settle(callee, body);
        } finally {
            child = null;
        }
    }

    /**
     * deferred action 예약 (클로저 캡처, 실행 시점 값 관찰).
     *
     * @param action 실행할 작업
     * @return 생성된 엔트리
     */
    public DeferredEntry defer(DeferredAction action) {
        return defer("deferred action in '" + name + "'", action);
    }

    /**
     * 설명을 붙여 deferred action 예약.
     *
     * @param description 진단용 설명
     * @param action 실행할 작업
     * @return 생성된 엔트리
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     * @throws IllegalStateException drain이 이미 시작되었거나, 다른 스레드이거나, 가장 안쪽 context가 아닌 경우
     */
    public DeferredEntry defer(String description, DeferredAction action) {
        checkActive("defer");
        return deferredStack.schedule(description, action, List.of());
    }

    /**
     * 인자를 값으로 고정하여 deferred action 예약.
     *
     * <p>argument는 이 호출 시점에 고정됩니다. 이후 원본 변수가 바뀌어도 action은 고정된 값을 받습니다.</p>
     *
     * @param action 실행할 작업
     * @param argument 고정할 인자 (null 허용)
     * @param <A> 인자 타입
     * @return 생성된 엔트리
     */
    public <A> DeferredEntry defer(Consumer<? super A> action, A argument) {
        checkActive("defer");
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return deferredStack.schedule(
            "deferred call in '" + name + "'",
            () -> action.accept(argument),
            Collections.singletonList(argument)
        );
    }

    /**
     * 인자 두 개를 값으로 고정하여 deferred action 예약.
     *
     * @param action 실행할 작업
     * @param first 고정할 첫 번째 인자
     * @param second 고정할 두 번째 인자
     * @param <A> 첫 번째 인자 타입
     * @param <B> 두 번째 인자 타입
     * @return 생성된 엔트리
     */
    public <A, B> DeferredEntry defer(BiConsumer<? super A, ? super B> action, A first, B second) {
        checkActive("defer");
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return deferredStack.schedule(
            "deferred call in '" + name + "'",
            () -> action.accept(first, second),
            Arrays.asList(first, second)
        );
    }

    /**
     * fault 발생.
     *
     * <p>항상 예외를 던지며 정상 반환하지 않습니다. 반환 타입은 컴파일러의 흐름 분석을 위해
     * {@code throw ctx.raise(payload)} 형태로 쓸 수 있게 하기 위한 것입니다.</p>
     *
     * @param payload fault payload (임의 타입, null 허용)
     * @return 반환하지 않음
     * @throws FaultSignal 항상
     * @throws IllegalStateException 다른 스레드이거나, 가장 안쪽 context가 아니거나, 이미 종료된 경우
     */
    public FaultSignal raise(Object payload) {
        checkActive("raise");
        Fault fault = Fault.raised(payload, name);
        log.debug("Fault raised in '{}': {}", name, fault.describe());
        throw new FaultSignal(fault);
    }

    /**
     * 활성 fault를 회수하고 unwind를 정상 반환으로 전환.
     *
     * <p>이 context의 deferred action 안에서 직접 호출될 때만 효과가 있습니다.
     * 그 외의 위치(본문, 하위 context)나 활성 fault가 없을 때는 아무 효과 없이 empty를 반환합니다.
     * 한 번 회수한 뒤 같은 drain 안에서 다시 호출하면 empty를 반환합니다.</p>
     *
     * @return 회수한 fault, 없으면 empty
     * @throws IllegalStateException 다른 스레드에서 호출한 경우
     */
    public Optional<Fault> recover() {
        checkOwner("recover");
        if (exited || !draining || child != null || activeFault == null) {
            return Optional.empty();
        }
        Fault recovered = activeFault;
        activeFault = null;
        state = StateTransition.transition(state, ContextState.RECOVERED);
        log.debug("Fault recovered in '{}': {}", name, recovered.describe());
        return Optional.of(recovered);
    }

    /**
     * 이 context가 호출자에게 반환할 값을 지정.
     *
     * <p>주로 recover 이후 deferred action에서 호출하여 복구된 호출의 반환값을 정합니다.
     * 정상 종료 시에도 본문 반환값보다 우선합니다.</p>
     *
     * @param value 반환할 값 (null 허용)
     * @throws IllegalStateException 다른 스레드이거나, 가장 안쪽 context가 아니거나, 이미 종료된 경우
     */
    public void setResult(T value) {
        checkActive("setResult");
        this.resultOverridden = true;
        this.resultOverride = value;
    }

    /**
     * context 이름.
     *
     * @return 이름
     */
    public String name() {
        return name;
    }

    /**
     * 중첩 깊이 (root = 1).
     *
     * @return 깊이
     */
    public int depth() {
        return depth;
    }

    /**
     * 바깥 context.
     *
     * @return 바깥 context, root이면 empty
     */
    public Optional<InvocationContext<?>> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * 현재 상태.
     *
     * @return 상태
     */
    public ContextState state() {
        return state;
    }

    /**
     * 활성 fault.
     *
     * @return 활성 fault, 없으면 empty
     */
    public Optional<Fault> activeFault() {
        return Optional.ofNullable(activeFault);
    }

    /**
     * deferred stack 실행 중인지 확인.
     *
     * @return drain 중이면 true
     */
    public boolean isDraining() {
        return draining;
    }

    /**
     * 종료 여부.
     *
     * @return 종료되었으면 true
     */
    public boolean isExited() {
        return exited;
    }

    /**
     * 아직 실행되지 않은 deferred action 수.
     *
     * @return 대기 중인 엔트리 수
     */
    public int pendingDeferredCount() {
        return deferredStack.size();
    }

    @Override
    public String toString() {
        return "InvocationContext{" + name + ", depth=" + depth + ", state=" + state + '}';
    }

    private T execute(Body<T> body) {
        log.debug("Entered context '{}' (depth {})", name, depth);
        T returned = null;
        try {
            returned = body.apply(this);
        } catch (Throwable t) {
            onFault(t);
        }
        drainDeferred();
        return exit(returned);
    }

    private void drainDeferred() {
        draining = true;
        try {
            int executed = deferredStack.drain(this::onFault);
            if (executed > 0) {
                log.debug("Drained {} deferred action(s) in '{}' (state: {})", executed, name, state);
            }
        } finally {
            draining = false;
        }
    }

    private void onFault(Throwable thrown) {
        if (thrown instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        Fault fault = thrown instanceof FaultSignal signal
            ? signal.fault()
            : Fault.raised(thrown, name);

        if (activeFault != null) {
            log.warn("Fault in '{}' supersedes active fault: {} (superseded: {})",
                name, fault.describe(), activeFault.describe());
            fault = fault.supersede(activeFault.passedThrough(name));
        }
        activeFault = fault;
        state = StateTransition.transition(state, ContextState.UNWINDING);
    }

    private T exit(T returned) {
        exited = true;

        if (state == ContextState.UNWINDING) {
            Fault propagated = activeFault.passedThrough(name);
            activeFault = propagated;
            if (parent == null && !returnsFault) {
                state = StateTransition.transition(state, ContextState.FATAL);
                throw fatal(propagated);
            }
            log.debug("Fault leaves '{}' toward {}", name,
                returnsFault ? "an attempt boundary" : "'" + parent.name + "'");
            throw new FaultSignal(propagated);
        }

        if (state == ContextState.RECOVERED) {
            state = StateTransition.transition(state, ContextState.NORMAL);
            log.debug("Context '{}' returns normally after recovery", name);
        }
        return resultOverridden ? resultOverride : returned;
    }

    private FatalFaultError fatal(Fault fault) {
        FatalFaultReport report = new FatalFaultReport(fault);
        FatalFaultError error = new FatalFaultError(report);
        try {
            options.fatalFaultHandler().onFatal(report);
        } catch (RuntimeException e) {
            log.error("FatalFaultHandler failed while reporting {}", report.summary(), e);
            error.addSuppressed(e);
        }
        return error;
    }

    private <R> InvocationContext<R> open(String operation, String name, Body<R> body, boolean returnsFault) {
        checkActive(operation);
        requireName(name);
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (depth >= options.maxDepth()) {
            throw raise(new DepthExceeded(name, options.maxDepth()));
        }
        InvocationContext<R> callee = new InvocationContext<>(name, this, options, returnsFault);
        child = callee;
        return callee;
    }

    private static <R> Result<R> settle(InvocationContext<R> context, Body<R> body) {
        try {
            return Result.ok(context.execute(body));
        } catch (FaultSignal signal) {
            log.debug("Attempt '{}' converts fault into an error value: {}", context.name, signal.fault().describe());
            return Result.err(new RecoveredFault(signal.fault()));
        }
    }

    private static void validateRoot(String name, ContextOptions options, Body<?> body) {
        requireName(name);
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
    }

    private void checkActive(String operation) {
        checkOwner(operation);
        if (exited) {
            throw new IllegalStateException(
                "Cannot " + operation + " in context '" + name + "': context has already exited");
        }
        if (child != null) {
            throw new IllegalStateException(
                "Cannot " + operation + " in context '" + name + "': not the innermost context (active child '"
                    + child.name + "')");
        }
    }

    private void checkOwner(String operation) {
        Thread current = Thread.currentThread();
        if (current != owner) {
            throw new IllegalStateException(
                "Cannot " + operation + " in context '" + name + "' from thread '" + current.getName()
                    + "' (owner: '" + owner.getName() + "')");
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
