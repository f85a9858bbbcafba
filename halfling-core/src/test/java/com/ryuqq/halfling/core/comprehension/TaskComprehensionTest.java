package com.ryuqq.halfling.core.comprehension;

import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.task.Task;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TaskComprehension 테스트.
 *
 * @author Halfling Team
 * @since 1.0.0
 */
class TaskComprehensionTest {

    private static ErrorInfo errorOf(Task<?> done) {
        return (ErrorInfo) done.result().getOrError();
    }

    @Test
    void in_바인딩을_순서대로_실행하고_본문을_계산() {
        // given
        Task<Integer> task = TaskComprehension.create()
            .let("x", Task.of(() -> 1))
            .let("y", scope -> Task.of(() -> scope.<Integer>get("x") + 1))
            .in(scope -> scope.<Integer>get("x") + scope.<Integer>get("y"));

        // when & then
        assertThat(task.run().get()).isEqualTo(3);
    }

    @Test
    void in_중첩_then과_같은_결과() {
        // given
        Task<Integer> nested = Task.of(() -> 2)
            .thenCompose(a -> Task.of(() -> a * 10).then(b -> a + b));
        Task<Integer> comprehended = TaskComprehension.create()
            .let("a", Task.of(() -> 2))
            .let("b", scope -> Task.of(() -> scope.<Integer>get("a") * 10))
            .in(scope -> scope.<Integer>get("a") + scope.<Integer>get("b"));

        // when & then
        assertThat(comprehended.run().get()).isEqualTo(nested.run().get());
    }

    @Test
    void let_Task가_아닌_값은_그대로_바인딩() {
        // given
        Task<String> task = TaskComprehension.create()
            .let("name", scope -> "halfling")
            .let("length", scope -> scope.<String>get("name").length())
            .in(scope -> scope.get("name") + ":" + scope.get("length"));

        // when & then
        assertThat(task.run().get()).isEqualTo("halfling:8");
    }

    @Test
    void let_값을_직접_바인딩() {
        // given
        Task<String> task = TaskComprehension.create()
            .let("greeting", "hello")
            .let("name", scope -> Task.of(() -> "halfling"))
            .in(scope -> scope.get("greeting") + " " + scope.get("name"));

        // when & then
        assertThat(task.run().get()).isEqualTo("hello halfling");
    }

    @Test
    void let_같은_이름은_뒤의_바인딩이_가림() {
        // given
        Task<Integer> task = TaskComprehension.create()
            .let("x", scope -> 1)
            .let("x", scope -> scope.<Integer>get("x") + 41)
            .in(scope -> scope.get("x"));

        // when & then
        assertThat(task.run().get()).isEqualTo(42);
    }

    @Test
    void names_바인딩_순서대로_이름을_노출하고_가려진_이름은_한_번만() {
        // given
        Task<List<String>> task = TaskComprehension.create()
            .let("x", 1)
            .let("y", scope -> List.copyOf(scope.names()))
            .let("x", 2)
            .in(scope -> {
                assertThat(scope.contains("y")).isTrue();
                return List.copyOf(scope.names());
            });

        // when
        Task<List<String>> done = task.run();

        // then
        assertThat(done.get()).containsExactly("x", "y");
    }

    @Test
    void names_앞선_바인딩만_보임() {
        // given
        Task<Object> task = TaskComprehension.create()
            .let("first", "a")
            .let("seen", scope -> List.copyOf(scope.names()))
            .let("second", "b")
            .in(scope -> scope.get("seen"));

        // when & then
        assertThat(task.run().get()).isEqualTo(List.of("first"));
    }

    @Test
    void in_본문이_Task를_반환하면_이어서_실행() {
        // given
        Task<Integer> task = TaskComprehension.create()
            .let("x", scope -> 20)
            .in(scope -> Task.of(() -> scope.<Integer>get("x") + 1));

        // when & then
        assertThat(task.run().get()).isEqualTo(21);
    }

    @Test
    void in_바인딩이_없으면_본문만_실행() {
        // when & then
        assertThat(TaskComprehension.create().<Integer>in(scope -> 42).run().get()).isEqualTo(42);
    }

    @Test
    void in_run_전에는_아무것도_실행하지_않음() {
        // given
        AtomicInteger evaluated = new AtomicInteger();

        // when
        Task<Integer> task = TaskComprehension.create()
            .let("x", scope -> evaluated.incrementAndGet())
            .in(scope -> evaluated.incrementAndGet());

        // then
        assertThat(evaluated).hasValue(0);
        assertThat(task.run().get()).isEqualTo(2);
    }

    @Test
    void let_실패하면_이후_바인딩과_본문은_실행하지_않음() {
        // given
        AtomicBoolean later = new AtomicBoolean();
        Task<Integer> task = TaskComprehension.create()
            .let("x", Task.failure("bad binding"))
            .let("y", scope -> {
                later.set(true);
                return 1;
            })
            .in(scope -> 0);

        // when
        Task<Integer> done = task.run();

        // then
        assertThat(done.isBroken()).isTrue();
        assertThat(errorOf(done).message()).isEqualTo("bad binding");
        assertThat(later).isFalse();
    }

    @Test
    void recover_바인딩_실패를_복구() {
        // given
        Task<Integer> task = TaskComprehension.create()
            .let("x", scope -> {
                throw new IllegalStateException("unavailable");
            })
            .recover(error -> error.message().length())
            .in(scope -> scope.get("x"));

        // when & then
        assertThat(task.run().get()).isEqualTo("java.lang.IllegalStateException: unavailable".length());
    }

    @Test
    void recoverAs_고정값으로_복구() {
        // given
        Task<Integer> task = TaskComprehension.create()
            .let("x", Task.failure("bad"))
            .recoverAs(-1)
            .in(scope -> scope.get("x"));

        // when & then
        assertThat(task.run().get()).isEqualTo(-1);
    }

    @Test
    void get_바인딩되지_않은_이름은_Failure() {
        // given
        Task<Object> task = TaskComprehension.create()
            .let("x", scope -> 1)
            .in(scope -> scope.get("missing"));

        // when
        Task<Object> done = task.run();

        // then
        assertThat(done.isBroken()).isTrue();
        assertThat(errorOf(done).message()).contains("No binding named 'missing'");
    }

    @Test
    void let_빈_이름은_예외() {
        assertThatThrownBy(() -> TaskComprehension.create().let(" ", scope -> 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("name cannot be null or blank");
    }

    @Test
    void size_바인딩_개수() {
        TaskComprehension comprehension = TaskComprehension.create().let("a", scope -> 1).let("b", scope -> 2);

        assertThat(comprehension.size()).isEqualTo(2);
    }
}
