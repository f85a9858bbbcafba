package com.ryuqq.halfling.core.launcher;

import com.ryuqq.halfling.core.task.Task;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ThreadPerTaskLauncher 테스트.
 *
 * @author Halfling Team
 * @since 1.0.0
 */
class ThreadPerTaskLauncherTest {

    @Test
    void launch_이름_붙은_새_스레드에서_실행() throws InterruptedException {
        // given
        ThreadPerTaskLauncher launcher = new ThreadPerTaskLauncher("test-task-", false);
        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        // when
        launcher.launch(() -> {
            worker.set(Thread.currentThread());
            done.countDown();
        });

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.get()).isNotSameAs(Thread.currentThread());
        assertThat(worker.get().getName()).isEqualTo("test-task-1");
        assertThat(worker.get().isDaemon()).isFalse();
        assertThat(launcher.launchedCount()).isEqualTo(1);
    }

    @Test
    void launch_기본_설정은_비데몬_스레드() throws InterruptedException {
        // given
        ThreadPerTaskLauncher launcher = new ThreadPerTaskLauncher();
        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        // when
        launcher.launch(() -> {
            worker.set(Thread.currentThread());
            done.countDown();
        });

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.get().isDaemon()).isFalse();
        assertThat(worker.get().getName()).startsWith("halfling-task-");
    }

    @Test
    void launch_데몬_옵션을_주면_데몬_스레드() throws InterruptedException {
        // given
        ThreadPerTaskLauncher launcher = new ThreadPerTaskLauncher("daemon-task-", true);
        AtomicReference<Thread> worker = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        // when
        launcher.launch(() -> {
            worker.set(Thread.currentThread());
            done.countDown();
        });

        // then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(worker.get().isDaemon()).isTrue();
    }

    @Test
    void runAsync_기본_Launcher는_비데몬_스레드에서_실행() {
        // when
        Boolean daemon = Task.of(() -> Thread.currentThread().isDaemon())
            .runAsync()
            .await()
            .result()
            .orElseThrow();

        // then
        assertThat(daemon).isFalse();
    }

    @Test
    void runAsync_main이_먼저_끝나도_작업은_완료(@TempDir Path tempDir) throws Exception {
        // given
        Path marker = tempDir.resolve("finished.txt");
        String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder builder = new ProcessBuilder(
            java, "-cp", System.getProperty("java.class.path"),
            DetachedWorkMain.class.getName(), marker.toString())
            .redirectErrorStream(true);

        // when
        Process process = builder.start();
        boolean exited = process.waitFor(30, TimeUnit.SECONDS);

        // then
        assertThat(exited).isTrue();
        assertThat(process.exitValue()).isZero();
        assertThat(marker).exists().hasContent("done");
    }

    @Test
    void launch_null_work는_예외() {
        assertThatThrownBy(() -> new ThreadPerTaskLauncher().launch(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("work cannot be null");
    }

    @Test
    void 생성자_빈_접두어는_예외() {
        assertThatThrownBy(() -> new ThreadPerTaskLauncher("", true))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shared_항상_같은_인스턴스() {
        assertThat(ThreadPerTaskLauncher.shared()).isSameAs(ThreadPerTaskLauncher.shared());
    }
}
