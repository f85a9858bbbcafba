package com.ryuqq.halfling.core.combinator;

import com.ryuqq.halfling.core.function.CheckedBiFunction;
import com.ryuqq.halfling.core.function.CheckedTriFunction;
import com.ryuqq.halfling.core.task.Task;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Task fan-out / fan-in 조합자.
 *
 * <p><strong>조합자:</strong></p>
 * <ul>
 *   <li>{@code mapply(f, tasks...)}: 하위 Task를 동시에 실행하고 f로 결합하는 PARALLEL Task</li>
 *   <li>{@code zip(tasks...)}: 값 목록으로 결합하는 mapply</li>
 *   <li>{@code sequencedPar(collection)}: zip 후 입력 컬렉션 모양(Set / List)으로 재포장</li>
 *   <li>{@code sequenced(collection)}: sequencedPar와 같은 모양 규칙이지만 원소를 하나씩 순서대로 실행</li>
 * </ul>
 *
 * <p>모든 조합자는 지연 평가됩니다. 반환된 Task를 run()하기 전까지 아무것도 실행되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Task<List<Integer>> all = Tasks.zip(Task.of(() -> 1), Task.of(() -> 2), Task.of(() -> 3));
 * all.run().get();   // [1, 2, 3]
 *
 * Task<Integer> sum = Tasks.mapply((Integer a, Integer b) -> a + b, Task.of(() -> 1), Task.of(() -> 2));
 * sum.run().get();   // 3
 * }</pre>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class Tasks {

    private Tasks() {
    }

    // ============================================================
    // mapply
    // ============================================================

    /**
     * 하위 Task들을 동시에 실행하고 gather로 결합합니다.
     *
     * @param gather 결합 함수
     * @param tasks 하위 Task (선언 순서 = 결과 순서)
     * @param <R> 결합 결과 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException gather/tasks가 null이거나, null Task가 있거나, arity가 맞지 않는 경우
     */
    public static <R> Task<R> mapply(Gather<? extends R> gather, Task<?>... tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        return mapply(gather, Arrays.asList(tasks));
    }

    /**
     * 하위 Task 목록을 동시에 실행하고 gather로 결합합니다.
     *
     * @param gather 결합 함수
     * @param tasks 하위 Task 목록 (선언 순서 = 결과 순서)
     * @param <R> 결합 결과 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException gather/tasks가 null이거나, null Task가 있거나, arity가 맞지 않는 경우
     */
    public static <R> Task<R> mapply(Gather<? extends R> gather, List<? extends Task<?>> tasks) {
        if (gather == null) {
            throw new IllegalArgumentException("gather cannot be null");
        }
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i) == null) {
                throw new IllegalArgumentException("All values provided to mapply must be tasks (null at index " + i + ")");
            }
        }
        int arity = gather.arity();
        if (arity != Gather.VARIADIC && arity != tasks.size()) {
            throw new IllegalArgumentException(
                String.format("gather arity must match task count (arity: %d, tasks: %d)", arity, tasks.size()));
        }
        return Task.fanOut(tasks, gather::gather);
    }

    /**
     * 두 Task를 동시에 실행하고 f로 결합합니다.
     *
     * @param f 결합 함수
     * @param first 첫 번째 Task
     * @param second 두 번째 Task
     * @param <A> 첫 번째 값 타입
     * @param <B> 두 번째 값 타입
     * @param <R> 결합 결과 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    @SuppressWarnings("unchecked")
    public static <A, B, R> Task<R> mapply(CheckedBiFunction<? super A, ? super B, ? extends R> f,
                                           Task<? extends A> first,
                                           Task<? extends B> second) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        Gather<R> gather = Gather.ofArity(2, values -> f.apply((A) values.get(0), (B) values.get(1)));
        return mapply(gather, first, second);
    }

    /**
     * 세 Task를 동시에 실행하고 f로 결합합니다.
     *
     * @param f 결합 함수
     * @param first 첫 번째 Task
     * @param second 두 번째 Task
     * @param third 세 번째 Task
     * @param <A> 첫 번째 값 타입
     * @param <B> 두 번째 값 타입
     * @param <C> 세 번째 값 타입
     * @param <R> 결합 결과 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    @SuppressWarnings("unchecked")
    public static <A, B, C, R> Task<R> mapply(CheckedTriFunction<? super A, ? super B, ? super C, ? extends R> f,
                                              Task<? extends A> first,
                                              Task<? extends B> second,
                                              Task<? extends C> third) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        Gather<R> gather = Gather.ofArity(3,
            values -> f.apply((A) values.get(0), (B) values.get(1), (C) values.get(2)));
        return mapply(gather, first, second, third);
    }

    // ============================================================
    // zip
    // ============================================================

    /**
     * 하위 Task들의 값을 선언 순서의 목록으로 결합합니다.
     *
     * @param tasks 하위 Task
     * @param <T> 값 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException tasks가 null이거나 null Task가 있는 경우
     */
    @SafeVarargs
    public static <T> Task<List<T>> zip(Task<? extends T>... tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        return zip(Arrays.asList(tasks));
    }

    /**
     * 하위 Task 목록의 값을 선언 순서의 목록으로 결합합니다.
     *
     * @param tasks 하위 Task 목록
     * @param <T> 값 타입
     * @return 미실행 PARALLEL Task
     * @throws IllegalArgumentException tasks가 null이거나 null Task가 있는 경우
     */
    @SuppressWarnings("unchecked")
    public static <T> Task<List<T>> zip(List<? extends Task<? extends T>> tasks) {
        Gather<List<T>> vector = values -> Collections.unmodifiableList(new ArrayList<>((List<T>) (List<?>) values));
        return mapply(vector, tasks);
    }

    // ============================================================
    // sequencedPar (동시 실행)
    // ============================================================

    /**
     * Task 목록을 값 목록 Task로 뒤집습니다 (원소는 동시에 실행).
     *
     * @param tasks Task 목록
     * @param <T> 값 타입
     * @return List를 결과로 가지는 Task
     */
    public static <T> Task<List<T>> sequencedPar(List<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        return zip(tasks);
    }

    /**
     * Task 집합을 값 집합 Task로 뒤집습니다 (원소는 동시에 실행).
     *
     * @param tasks Task 집합
     * @param <T> 값 타입
     * @return Set을 결과로 가지는 Task
     */
    public static <T> Task<Set<T>> sequencedPar(Set<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        List<Task<? extends T>> ordered = new ArrayList<>(tasks);
        Task<List<T>> zipped = zip(ordered);
        return zipped.then(values -> toSet(values));
    }

    /**
     * Task 컬렉션을 값 컬렉션 Task로 뒤집습니다 (원소는 동시에 실행).
     *
     * <p>Set이면 Set, 그 외에는 반복 순서의 List를 결과로 가집니다.</p>
     *
     * @param tasks Task 컬렉션
     * @param <T> 값 타입
     * @return 입력과 같은 모양의 컬렉션을 결과로 가지는 Task
     */
    public static <T> Task<Collection<T>> sequencedPar(Collection<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        List<Task<? extends T>> ordered = new ArrayList<>(tasks);
        Task<List<T>> zipped = zip(ordered);
        return zipped.then(values -> reshape(tasks, values));
    }

    // ============================================================
    // sequenced (순차 실행)
    // ============================================================

    /**
     * Task 목록을 값 목록 Task로 뒤집습니다 (원소는 하나씩 순서대로 실행).
     *
     * @param tasks Task 목록
     * @param <T> 값 타입
     * @return List를 결과로 가지는 SERIAL Task
     */
    public static <T> Task<List<T>> sequenced(List<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        return chain(tasks);
    }

    /**
     * Task 집합을 값 집합 Task로 뒤집습니다 (원소는 하나씩 반복 순서대로 실행).
     *
     * @param tasks Task 집합
     * @param <T> 값 타입
     * @return Set을 결과로 가지는 SERIAL Task
     */
    public static <T> Task<Set<T>> sequenced(Set<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        Task<List<T>> chained = chain(tasks);
        return chained.then(values -> toSet(values));
    }

    /**
     * Task 컬렉션을 값 컬렉션 Task로 뒤집습니다 (원소는 하나씩 반복 순서대로 실행).
     *
     * @param tasks Task 컬렉션
     * @param <T> 값 타입
     * @return 입력과 같은 모양의 컬렉션을 결과로 가지는 SERIAL Task
     */
    public static <T> Task<Collection<T>> sequenced(Collection<? extends Task<? extends T>> tasks) {
        requireTasks(tasks);
        Task<List<T>> chained = chain(tasks);
        return chained.then(values -> reshape(tasks, values));
    }

    /**
     * 원소 Task를 앞에서부터 하나씩 이어 붙입니다.
     *
     * <p>누적 목록은 실행할 때마다 새로 만들어지므로 반환된 Task를 여러 번 실행해도 안전합니다.</p>
     */
    private static <T> Task<List<T>> chain(Collection<? extends Task<? extends T>> tasks) {
        Task<List<T>> acc = Task.of(() -> new ArrayList<>(tasks.size()));
        for (Task<? extends T> element : tasks) {
            acc = acc.thenCompose(values -> element.then(value -> {
                values.add(value);
                return values;
            }));
        }
        return acc.then(values -> Collections.unmodifiableList(values));
    }

    private static void requireTasks(Collection<? extends Task<?>> tasks) {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        for (Task<?> task : tasks) {
            if (task == null) {
                throw new IllegalArgumentException("All values provided to sequenced must be tasks");
            }
        }
    }

    private static <T> Set<T> toSet(List<T> values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static <T> Collection<T> reshape(Collection<?> shape, List<T> values) {
        if (shape instanceof Set<?>) {
            return toSet(values);
        }
        return values;
    }
}
