package com.ryuqq.halfling.core.task;

import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.function.CheckedRunnable;
import com.ryuqq.halfling.core.launcher.ThreadPerTaskLauncher;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.result.Result;
import com.ryuqq.halfling.core.spi.TaskLauncher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 지연 평가되는 비동기 계산 노드.
 *
 * <p>Task는 다음 네 가지로 구성됩니다:</p>
 * <ul>
 *   <li>mode: 실행 방식 (SERIAL, PARALLEL)</li>
 *   <li>handle: 가장 최근에 만들어진 Result를 담는 {@link AsyncHandle}</li>
 *   <li>actions: handle이 성공으로 해소된 뒤 순서대로 적용할 함수 큐</li>
 *   <li>recovery: 실패 payload를 대체 값 또는 Task로 바꾸는 함수 (선택)</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * Task.of(thunk)          → 미실행 (handle = Success(null), actions = [thunk])
 *    │
 *    ├─ then / recover    → 새 Task (copy-on-write, 원본 불변)
 *    │
 *    ▼ run / runAsync
 * 소진(spent)             → handle = 최종 Result, actions = []
 *    │
 *    ▼ then
 * 다시 미실행             → 이미 계산된 값은 유지, 새로 붙인 suffix만 실행
 * </pre>
 *
 * <p><strong>지연성:</strong> then()은 아무것도 실행하지 않습니다.
 * 함수가 값을 반환하든 Task를 반환하든 실행 시점에 해석됩니다.</p>
 *
 * <p><strong>불변성:</strong> 모든 조합 메서드는 새 Task를 반환합니다.
 * 유일하게 변하는 것은 handle 내부의 완료 셀이며, 소유한 계산만 한 번 기록합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Task<Integer> task = Task.of(() -> 1 + 1)
 *     .then(x -> x + 1)
 *     .then(x -> x - 1);
 *
 * task.run().get();                 // 2
 *
 * Task<String> recovered = Task.of(() -> 1)
 *     .<String>then(x -> { throw new IllegalStateException("HA"); })
 *     .recover(error -> "HA");
 * recovered.run().get();            // "HA"
 * }</pre>
 *
 * @param <T> 최종 값 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class Task<T> {

    private final ExecutionMode mode;
    private final AsyncHandle<Object> handle;
    private final List<CheckedFunction<Object, Object>> actions;
    private final CheckedFunction<ErrorInfo, Object> recovery;

    Task(ExecutionMode mode,
         AsyncHandle<Object> handle,
         List<CheckedFunction<Object, Object>> actions,
         CheckedFunction<ErrorInfo, Object> recovery) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        this.mode = mode;
        this.handle = handle;
        this.actions = actions;
        this.recovery = recovery;
    }

    // ============================================================
    // 생성
    // ============================================================

    /**
     * thunk를 지연 실행하는 Task 생성.
     *
     * <p>thunk가 Task를 반환하면 실행 시 그 Task까지 이어서 실행합니다.</p>
     *
     * @param thunk 실행할 계산
     * @param <T> 값 타입
     * @return 미실행 SERIAL Task
     * @throws IllegalArgumentException thunk가 null인 경우
     */
    public static <T> Task<T> of(Callable<? extends T> thunk) {
        if (thunk == null) {
            throw new IllegalArgumentException("thunk cannot be null");
        }
        CheckedFunction<Object, Object> body = ignored -> thunk.call();
        return new Task<>(ExecutionMode.SERIAL, AsyncHandle.completed(Result.success(null)), List.of(body), null);
    }

    /**
     * 이미 성공한 Task 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return 소진된 Task
     */
    public static <T> Task<T> success(T value) {
        return fromResult(Result.success(value));
    }

    /**
     * 이미 실패한 Task 생성.
     *
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return 소진된 Task
     * @throws IllegalArgumentException message가 null인 경우
     */
    public static <T> Task<T> failure(String message) {
        return fromResult(Result.failure(message));
    }

    /**
     * 이미 실패한 Task 생성.
     *
     * @param error 실패 정보
     * @param <T> 값 타입
     * @return 소진된 Task
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <T> Task<T> failure(ErrorInfo error) {
        return fromResult(Result.failure(error));
    }

    /**
     * Result로부터 소진된 Task 생성.
     *
     * @param result 담을 Result
     * @param <T> 값 타입
     * @return 소진된 Task
     * @throws IllegalArgumentException result가 null인 경우
     */
    @SuppressWarnings("unchecked")
    public static <T> Task<T> fromResult(Result<? extends T> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return spent(AsyncHandle.completed((Result<Object>) (Result<?>) result));
    }

    static <T> Task<T> spent(AsyncHandle<Object> handle) {
        return new Task<>(ExecutionMode.SERIAL, handle, List.of(), null);
    }

    /**
     * 병렬 Task 생성 (fan-out 조합자의 기본 연산).
     *
     * <p>handle은 하위 Task 목록을, action 큐의 첫 항목은 gather 함수를 담습니다.
     * 실행 시 하위 Task들을 동시에 실행하고, 모두 성공하면 선언 순서의 값 목록에 gather를 적용합니다.</p>
     *
     * @param branches 하위 Task 목록 (선언 순서 유지)
     * @param gather 값 목록을 하나로 결합하는 함수
     * @param <R> 결합 결과 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException branches 또는 gather가 null이거나, null 원소가 있는 경우
     */
    public static <R> Task<R> fanOut(List<? extends Task<?>> branches,
                                     CheckedFunction<? super List<Object>, ? extends R> gather) {
        if (branches == null) {
            throw new IllegalArgumentException("branches cannot be null");
        }
        if (gather == null) {
            throw new IllegalArgumentException("gather cannot be null");
        }
        for (Task<?> branch : branches) {
            if (branch == null) {
                throw new IllegalArgumentException("branches cannot contain null");
            }
        }
        CheckedFunction<Object, Object> first = values -> {
            @SuppressWarnings("unchecked")
            List<Object> gathered = (List<Object>) values;
            return gather.apply(gathered);
        };
        List<Task<?>> copy = List.copyOf(branches);
        return new Task<>(ExecutionMode.PARALLEL, AsyncHandle.completed(Result.<Object>success(copy)), List.of(first), null);
    }

    // ============================================================
    // 조합
    // ============================================================

    /**
     * 결과 값에 적용할 함수를 action 큐 끝에 추가합니다.
     *
     * <p>이미 실패로 해소된 Task라면 (비블로킹으로 확인 가능한 경우에만)
     * 함수를 추가하지 않고 같은 실패를 담은 Task를 반환합니다.</p>
     *
     * <p>f가 Task를 반환하면 실행 시 그 Task를 이어서 실행합니다.
     * 타입이 드러나는 형태가 필요하면 {@link #thenCompose}를 사용합니다.</p>
     *
     * @param f 적용할 함수
     * @param <U> 결과 타입
     * @return 새 Task
     * @throws IllegalArgumentException f가 null인 경우
     */
    public <U> Task<U> then(CheckedFunction<? super T, ? extends U> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return append(f);
    }

    /**
     * Task를 반환하는 함수를 action 큐 끝에 추가합니다.
     *
     * @param f Task를 반환하는 함수
     * @param <U> 결과 타입
     * @return 새 Task
     * @throws IllegalArgumentException f가 null인 경우
     */
    public <U> Task<U> thenCompose(CheckedFunction<? super T, ? extends Task<? extends U>> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return append(f);
    }

    /**
     * 입력 값을 무시하는 부수효과를 추가합니다. 값은 그대로 전달됩니다.
     *
     * @param action 실행할 부수효과
     * @return 새 Task
     * @throws IllegalArgumentException action이 null인 경우
     */
    public Task<T> thenDo(CheckedRunnable action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        return append(value -> {
            action.run();
            return value;
        });
    }

    @SuppressWarnings("unchecked")
    private <U> Task<U> append(CheckedFunction<? super T, ?> f) {
        if (isBroken()) {
            return new Task<>(mode, handle, List.of(), recovery);
        }
        List<CheckedFunction<Object, Object>> next = new ArrayList<>(actions.size() + 1);
        next.addAll(actions);
        next.add((CheckedFunction<Object, Object>) (CheckedFunction<?, ?>) f);
        return new Task<>(mode, handle, Collections.unmodifiableList(next), recovery);
    }

    /**
     * 복구 함수를 지정합니다. action 큐는 건드리지 않습니다.
     *
     * <p>실행 중 이 노드가 실패하면 전체 계산이 {@code Task.of(() -> f(error))}로 대체됩니다.
     * 병렬 Task의 경우 f는 집계된 오류 (첫 번째 실패 + suppressed)를 받으며,
     * 복구는 항상 새 SERIAL 실행으로 진입합니다.</p>
     *
     * @param f 복구 함수 (값 또는 Task 반환)
     * @return 새 Task
     * @throws IllegalArgumentException f가 null인 경우
     */
    public Task<T> recover(CheckedFunction<? super ErrorInfo, ? extends T> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return withRecovery(f);
    }

    /**
     * Task를 반환하는 복구 함수를 지정합니다.
     *
     * @param f 복구 함수
     * @return 새 Task
     * @throws IllegalArgumentException f가 null인 경우
     */
    public Task<T> recoverWith(CheckedFunction<? super ErrorInfo, ? extends Task<? extends T>> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return withRecovery(f);
    }

    private Task<T> withRecovery(CheckedFunction<? super ErrorInfo, ?> f) {
        return new Task<>(mode, handle, actions, error -> f.apply(error));
    }

    // ============================================================
    // 실행
    // ============================================================

    /**
     * 공유 {@link ThreadPerTaskLauncher}로 실행하고 완료될 때까지 대기합니다.
     *
     * @return 최종 Result를 담은 소진된 Task
     */
    public Task<T> run() {
        return run(ThreadPerTaskLauncher.shared());
    }

    /**
     * 지정한 Launcher로 실행하고 완료될 때까지 대기합니다.
     *
     * <p>병렬 분기는 launcher로 시작되며, 직렬 부분은 호출 스레드에서 실행됩니다.</p>
     *
     * @param launcher 병렬 분기에 사용할 Launcher
     * @return 최종 Result를 담은 소진된 Task
     * @throws IllegalArgumentException launcher가 null인 경우
     */
    public Task<T> run(TaskLauncher launcher) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        Result<Object> outcome = new TaskInterpreter(launcher).run(this);
        return spent(AsyncHandle.completed(outcome));
    }

    /**
     * 공유 {@link ThreadPerTaskLauncher}로 비동기 실행을 시작합니다.
     *
     * @return 대기 중일 수 있는 소진된 Task
     */
    public Task<T> runAsync() {
        return runAsync(ThreadPerTaskLauncher.shared());
    }

    /**
     * 지정한 Launcher로 비동기 실행을 시작하고 즉시 반환합니다.
     *
     * <p>반환된 Task에 then()으로 이어 붙여도 진행 중인 실행에는 영향이 없습니다.
     * 이어 붙인 suffix는 다음 run()/runAsync()에서만 실행됩니다.</p>
     *
     * @param launcher 사용할 Launcher
     * @return 대기 중일 수 있는 소진된 Task
     * @throws IllegalArgumentException launcher가 null인 경우
     */
    public Task<T> runAsync(TaskLauncher launcher) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        TaskInterpreter interpreter = new TaskInterpreter(launcher);
        return spent(AsyncHandle.launch(launcher, () -> interpreter.run(this)));
    }

    /**
     * handle이 해소될 때까지 대기합니다. action 큐는 실행하지 않습니다.
     *
     * @return 해소된 handle을 가진 Task
     */
    public Task<T> await() {
        return new Task<>(mode, AsyncHandle.completed(handle.await()), actions, recovery);
    }

    /**
     * 최대 timeoutMs 동안 대기합니다.
     *
     * <p>시간 안에 해소되지 않으면 타임아웃 Failure를 담은 Task를 반환합니다.
     * 진행 중인 계산은 중단되지 않습니다.</p>
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @return 해소된 handle 또는 타임아웃 Failure를 가진 Task
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public Task<T> await(long timeoutMs) {
        Result<Object> fallback = Result.failure("Timed out after " + timeoutMs + " ms waiting for task");
        return new Task<>(mode, AsyncHandle.completed(handle.await(timeoutMs, fallback)), actions, recovery);
    }

    /**
     * 최대 timeoutMs 동안 대기하고, 시간 안에 해소되지 않으면 기본값을 사용합니다.
     *
     * @param timeoutMs 최대 대기 시간 (밀리초)
     * @param defaultValue 타임아웃 시 값
     * @return 해소된 handle 또는 Success(defaultValue)를 가진 Task
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public Task<T> await(long timeoutMs, T defaultValue) {
        Result<Object> fallback = Result.success(defaultValue);
        return new Task<>(mode, AsyncHandle.completed(handle.await(timeoutMs, fallback)), actions, recovery);
    }

    // ============================================================
    // 값 조회
    // ============================================================

    /**
     * handle의 Result를 조회합니다 (블로킹).
     *
     * <p><strong>주의:</strong> action 큐는 실행하지 않습니다.
     * 미실행 Task의 최종 값이 필요하면 먼저 {@link #run()}을 호출합니다.</p>
     *
     * @return handle에 담긴 Result
     */
    @SuppressWarnings("unchecked")
    public Result<T> result() {
        return (Result<T>) handle.await();
    }

    /**
     * handle의 값을 조회합니다 (블로킹).
     *
     * @return 성공 값
     * @throws com.ryuqq.halfling.core.result.TaskFailedException handle이 Failure인 경우
     */
    public T get() {
        return result().orElseThrow();
    }

    /**
     * handle의 값 또는 기본값 (블로킹).
     *
     * @param other 실패 시 반환할 값
     * @return 성공 값 또는 other
     */
    public T getOrElse(T other) {
        return result().getOrElse(other);
    }

    /**
     * handle의 현재 Result (비블로킹).
     *
     * @return 해소된 Result 또는 null (대기 중)
     */
    @SuppressWarnings("unchecked")
    public Result<T> peer() {
        return (Result<T>) handle.peek();
    }

    // ============================================================
    // 상태 (모두 비블로킹)
    // ============================================================

    /**
     * handle 해소 여부.
     *
     * @return 해소되었으면 true
     */
    public boolean isDone() {
        return handle.isDone();
    }

    /**
     * 소진 여부 (해소되었고 남은 action이 없음).
     *
     * @return 소진되었으면 true
     */
    public boolean isExecuted() {
        return isDone() && actions.isEmpty();
    }

    /**
     * handle이 Success로 해소되었는지 여부.
     *
     * @return Success로 해소되었으면 true
     */
    public boolean isFulfilled() {
        Result<Object> current = handle.peek();
        return current != null && current.isSuccess();
    }

    /**
     * handle이 Failure로 해소되었는지 여부.
     *
     * @return Failure로 해소되었으면 true
     */
    public boolean isBroken() {
        Result<Object> current = handle.peek();
        return current != null && current.isFailure();
    }

    /**
     * 실행 방식 조회.
     *
     * @return SERIAL 또는 PARALLEL
     */
    public ExecutionMode mode() {
        return mode;
    }

    AsyncHandle<Object> handle() {
        return handle;
    }

    List<CheckedFunction<Object, Object>> actions() {
        return actions;
    }

    CheckedFunction<ErrorInfo, Object> recovery() {
        return recovery;
    }

    /**
     * 남은 action 수.
     *
     * @return action 큐 길이
     */
    public int pendingActions() {
        return actions.size();
    }

    /**
     * 복구 함수 지정 여부.
     *
     * @return recovery가 있으면 true
     */
    public boolean hasRecovery() {
        return recovery != null;
    }

    @Override
    public String toString() {
        Result<Object> current = handle.peek();
        String state = current == null ? "pending" : current.toString();
        return "Task{mode=" + mode + ", state=" + state + ", pendingActions=" + actions.size()
            + ", recovery=" + (recovery != null) + "}";
    }
}
