package com.ryuqq.halfling.testkit.contract;

import com.ryuqq.halfling.core.combinator.Tasks;
import com.ryuqq.halfling.core.comprehension.TaskComprehension;
import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.task.Task;
import org.junit.jupiter.api.Named;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Contract: Task composition obeys the monad laws under the final extracted value.
 *
 * <p><strong>Laws:</strong></p>
 * <ul>
 *   <li>Left identity: {@code Task.of(() -> a).thenCompose(f) ≡ f(a)}</li>
 *   <li>Right identity: {@code t.thenCompose(x -> Task.of(() -> x)) ≡ t}</li>
 *   <li>Associativity: {@code t.thenCompose(f).thenCompose(g) ≡ t.thenCompose(x -> f(x).thenCompose(g))}</li>
 * </ul>
 *
 * <p>Tasks and functions include immediate, delayed, failing and parallel variants.
 * A function that throws and a function that returns a broken task are both covered.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public abstract class MonadLawContract extends AbstractTaskContractTest {

    private static Named<Task<Integer>> named(String name, Task<Integer> task) {
        return Named.of(name, task);
    }

    private static Named<CheckedFunction<Integer, Task<Integer>>> kleisli(String name,
                                                                       CheckedFunction<Integer, Task<Integer>> f) {
        return Named.of(name, f);
    }

    static Stream<Named<Task<Integer>>> tasks() {
        return Stream.of(
                named("immediate", Task.of(() -> 3)),
                named("delayed", sleepingTask(5, 4)),
                named("broken", Task.<Integer>failure("broken task")),
                named("throwing", MonadLawContract.<Integer>failingTask("task threw")),
                named("parallel", Tasks.mapply((Integer a, Integer b) -> a + b,
                        Task.of(() -> 1), sleepingTask(2, 2))));
    }

    static Stream<Named<CheckedFunction<Integer, Task<Integer>>>> functions() {
        return Stream.of(
                kleisli("plusOne", x -> Task.of(() -> x + 1)),
                kleisli("doubleLater", x -> sleepingTask(3, x * 2)),
                kleisli("throwsDirectly", x -> {
                    throw new IllegalArgumentException("function threw on " + x);
                }),
                kleisli("returnsBroken", x -> Task.failure("broken for " + x)),
                kleisli("zipsWithTen", x -> Tasks.<Integer>zip(Task.of(() -> x), Task.of(() -> 10))
                        .then(values -> values.get(0) + values.get(1))));
    }

    static Stream<Arguments> leftIdentityCases() {
        return Stream.of(-1, 0, 7).flatMap(a -> functions().map(f -> Arguments.of(a, f)));
    }

    static Stream<Arguments> associativityCases() {
        List<Arguments> cases = new ArrayList<>();
        tasks().forEach(t -> functions().forEach(f -> functions().forEach(g -> cases.add(Arguments.of(t, f, g)))));
        return cases.stream();
    }

    @ParameterizedTest(name = "a={0}, f={1}")
    @MethodSource("leftIdentityCases")
    void leftIdentity_holds(int a, CheckedFunction<Integer, Task<Integer>> f) {
        Task<Integer> left = Task.of(() -> a).thenCompose(f);
        Task<Object> right = Task.of(() -> f.apply(a));

        assertEquivalent(left, right);
    }

    @ParameterizedTest(name = "t={0}")
    @MethodSource("tasks")
    void rightIdentity_holds(Task<Integer> t) {
        Task<Integer> left = t.thenCompose(x -> Task.of(() -> x));

        assertEquivalent(left, t);
    }

    @ParameterizedTest(name = "t={0}, f={1}, g={2}")
    @MethodSource("associativityCases")
    void associativity_holds(Task<Integer> t,
                             CheckedFunction<Integer, Task<Integer>> f,
                             CheckedFunction<Integer, Task<Integer>> g) {
        Task<Integer> left = t.thenCompose(f).thenCompose(g);
        Task<Integer> right = t.thenCompose(x -> f.apply(x).thenCompose(g));

        assertEquivalent(left, right);
    }

    @Test
    void then_plainFunctionsCompose_likeNestedApplication() {
        Task<Integer> task = Task.of(() -> 1 + 1).then(x -> x + 1).then(x -> x - 1);

        assertSucceedsWith(2, task);
    }

    @Test
    void comprehension_isEquivalentTo_nestedThenCompose() {
        Task<Integer> nested = sleepingTask(2, 5)
                .thenCompose(a -> Task.of(() -> a * 2).thenCompose(b -> Task.of(() -> a + b)));
        Task<Integer> comprehended = TaskComprehension.create()
                .let("a", sleepingTask(2, 5))
                .let("b", scope -> Task.of(() -> scope.<Integer>get("a") * 2))
                .in(scope -> scope.<Integer>get("a") + scope.<Integer>get("b"));

        assertEquivalent(nested, comprehended);
        assertSucceedsWith(15, comprehended);
    }

    @Test
    void comprehension_failingBinding_isEquivalentTo_failingThen() {
        Task<Integer> nested = Task.of(() -> 1).thenCompose(a -> MonadLawContract.<Integer>failingTask("no b"));
        Task<Integer> comprehended = TaskComprehension.create()
                .let("a", Task.of(() -> 1))
                .let("b", failingTask("no b"))
                .in(scope -> scope.<Integer>get("b"));

        assertEquivalent(nested, comprehended);
    }
}
