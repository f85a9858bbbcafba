package com.ryuqq.halfling.core.comprehension;

import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.task.Task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 이름 있는 binding의 나열을 중첩된 then 호출로 풀어내는 빌더.
 *
 * <p>아래 두 Task는 같은 계산입니다:</p>
 * <pre>{@code
 * Task<Integer> sugared = TaskComprehension.create()
 *     .let("a", source)
 *     .let("b", b -> Task.of(() -> b.<Integer>get("a") + 1))
 *     .in(b -> Task.of(() -> b.<Integer>get("a") + b.<Integer>get("b")));
 *
 * Task<Integer> desugared = source.thenCompose(a ->
 *     Task.of(() -> a + 1).thenCompose(b ->
 *         Task.of(() -> a + b)));
 * }</pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>binding은 뒤에서부터 접어(right-fold) 중첩된 then이 됩니다.</li>
 *   <li>Task가 아닌 값을 반환하는 표현식은 {@code Task.of}로 감싸집니다.</li>
 *   <li>표현식은 실행 시점에 평가됩니다. 빌더는 아무것도 실행하지 않습니다.</li>
 *   <li>{@link #recover}/{@link #recoverAs}는 조합된 전체 체인에 복구 함수를 붙입니다.</li>
 * </ul>
 *
 * <p>빌더는 불변이며 각 메서드는 새 인스턴스를 반환합니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class TaskComprehension {

    private final List<Binding> bindings;
    private final CheckedFunction<ErrorInfo, Object> recovery;

    private TaskComprehension(List<Binding> bindings, CheckedFunction<ErrorInfo, Object> recovery) {
        this.bindings = bindings;
        this.recovery = recovery;
    }

    /**
     * 빈 빌더 생성.
     *
     * @return binding이 없는 TaskComprehension
     */
    public static TaskComprehension create() {
        return new TaskComprehension(List.of(), null);
    }

    /**
     * 이미 알고 있는 값을 name으로 binding합니다.
     *
     * @param name binding 이름
     * @param value binding할 값 (null 허용)
     * @return 새 TaskComprehension
     * @throws IllegalArgumentException name이 null/blank인 경우
     */
    public TaskComprehension let(String name, Object value) {
        return let(name, ignored -> value);
    }

    /**
     * Task의 결과를 name으로 binding합니다.
     *
     * @param name binding 이름
     * @param task 실행할 Task
     * @return 새 TaskComprehension
     * @throws IllegalArgumentException name이 null/blank이거나 task가 null인 경우
     */
    public TaskComprehension let(String name, Task<?> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return let(name, ignored -> task);
    }

    /**
     * 앞선 binding을 사용하는 표현식의 결과를 name으로 binding합니다.
     *
     * @param name binding 이름
     * @param expression 값 또는 Task를 반환하는 표현식
     * @return 새 TaskComprehension
     * @throws IllegalArgumentException name이 null/blank이거나 expression이 null인 경우
     */
    public TaskComprehension let(String name, CheckedFunction<Bindings, ?> expression) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (expression == null) {
            throw new IllegalArgumentException("expression cannot be null");
        }
        List<Binding> next = new ArrayList<>(bindings);
        next.add(new Binding(name, expression));
        return new TaskComprehension(Collections.unmodifiableList(next), recovery);
    }

    /**
     * 조합된 체인 전체에 복구 함수를 붙입니다.
     *
     * @param f 복구 함수 (값 또는 Task 반환)
     * @return 새 TaskComprehension
     * @throws IllegalArgumentException f가 null인 경우
     */
    public TaskComprehension recover(CheckedFunction<? super ErrorInfo, ?> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return new TaskComprehension(bindings, error -> f.apply(error));
    }

    /**
     * 실패 시 고정 값으로 복구합니다.
     *
     * @param value 복구 값
     * @return 새 TaskComprehension
     */
    public TaskComprehension recoverAs(Object value) {
        return recover(ignored -> value);
    }

    /**
     * body를 마지막으로 binding들을 중첩된 then으로 조합합니다.
     *
     * @param body 모든 binding을 받아 값 또는 Task를 반환하는 함수
     * @param <R> 결과 타입
     * @return 미실행 Task
     * @throws IllegalArgumentException body가 null인 경우
     */
    @SuppressWarnings("unchecked")
    public <R> Task<R> in(CheckedFunction<Bindings, ?> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        Task<Object> composed = nest(0, Bindings.empty(), body);
        if (recovery != null) {
            composed = composed.recover(recovery);
        }
        return (Task<R>) (Task<?>) composed;
    }

    private Task<Object> nest(int index, Bindings scope, CheckedFunction<Bindings, ?> body) {
        if (index == bindings.size()) {
            return Task.of(() -> body.apply(scope));
        }
        Binding binding = bindings.get(index);
        Task<Object> bound = Task.of(() -> binding.expression().apply(scope));
        return bound.then(value -> nest(index + 1, scope.with(binding.name(), value), body));
    }

    /**
     * binding 수.
     *
     * @return binding 수
     */
    public int size() {
        return bindings.size();
    }

    private record Binding(String name, CheckedFunction<Bindings, ?> expression) {
    }
}
