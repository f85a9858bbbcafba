package com.ryuqq.halfling.core.task;

import com.ryuqq.halfling.core.function.CheckedFunction;
import com.ryuqq.halfling.core.result.ErrorInfo;
import com.ryuqq.halfling.core.result.Failure;
import com.ryuqq.halfling.core.result.Result;
import com.ryuqq.halfling.core.result.Success;
import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Task 실행기 (직렬/병렬 인터프리터).
 *
 * <p><strong>직렬 알고리즘 ({@link #execute}):</strong></p>
 * <ol>
 *   <li>Failure이고 recovery가 있으면: {@code Task.of(() -> recovery(error))}를 새로 실행</li>
 *   <li>Failure이면: 그대로 반환 (남은 action 단락)</li>
 *   <li>값이 Task이면: 그 Task를 mode에 맞게 실행한 결과로 교체 후 계속</li>
 *   <li>남은 action이 없으면: 반환</li>
 *   <li>첫 action f를 꺼내 {@code attempt(f(value))} 후 계속</li>
 * </ol>
 *
 * <p><strong>병렬 알고리즘 ({@link #executeParallel}):</strong></p>
 * <ol>
 *   <li>모든 하위 Task를 선언 순서대로 runAsync</li>
 *   <li>모두 해소될 때까지 블로킹</li>
 *   <li>모두 성공: 값 목록(선언 순서)에 gather 적용 후 남은 action을 직렬로 계속</li>
 *   <li>실패 + recovery: 집계 오류로 recovery를 새 직렬 실행</li>
 *   <li>실패: 첫 번째 실패 분기의 오류 (나머지는 suppressed)</li>
 * </ol>
 *
 * <p>루프로 action을 소비하므로 action 큐 길이가 호출 스택 깊이를 늘리지 않습니다.
 * 중첩된 Task만 재귀로 실행됩니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
final class TaskInterpreter {

    private static final Logger log = LoggerFactory.getLogger(TaskInterpreter.class);

    private final TaskLauncher launcher;

    TaskInterpreter(TaskLauncher launcher) {
        if (launcher == null) {
            throw new IllegalArgumentException("launcher cannot be null");
        }
        this.launcher = launcher;
    }

    /**
     * mode에 따라 직렬 또는 병렬 인터프리터로 실행합니다.
     *
     * @param task 실행할 Task
     * @return 최종 Result
     */
    Result<Object> run(Task<?> task) {
        if (task.mode() == ExecutionMode.PARALLEL) {
            return executeParallel(task);
        }
        return execute(task);
    }

    Result<Object> execute(Task<?> task) {
        return reduce(task.handle().await(), task.actions(), task.recovery());
    }

    private Result<Object> reduce(Result<Object> initial,
                                  List<CheckedFunction<Object, Object>> actions,
                                  CheckedFunction<ErrorInfo, Object> recovery) {
        Result<Object> result = initial;
        int next = 0;
        while (true) {
            if (result instanceof Failure<Object> failure) {
                if (recovery != null) {
                    return recover(recovery, failure.error());
                }
                return result;
            }
            Object value = ((Success<Object>) result).value();
            if (value instanceof Task<?> nested) {
                result = run(nested);
                continue;
            }
            if (next >= actions.size()) {
                return result;
            }
            CheckedFunction<Object, Object> action = actions.get(next++);
            result = Result.attempt(() -> action.apply(value));
        }
    }

    private Result<Object> recover(CheckedFunction<ErrorInfo, Object> recovery, ErrorInfo error) {
        log.debug("Recovering from failure: {}", error.message());
        return execute(Task.of(() -> recovery.apply(error)));
    }

    Result<Object> executeParallel(Task<?> task) {
        Result<Object> resolved = task.handle().await();
        if (resolved.isFailure()) {
            return reduce(resolved, List.of(), task.recovery());
        }
        List<Task<?>> branches = branchesOf(resolved.orElseThrow());
        List<CheckedFunction<Object, Object>> actions = task.actions();
        if (actions.isEmpty()) {
            throw new IllegalStateException("parallel task has no gather function");
        }

        log.debug("Fanning out {} branches", branches.size());
        List<Task<?>> launched = new ArrayList<>(branches.size());
        for (Task<?> branch : branches) {
            launched.add(branch.runAsync(launcher));
        }

        List<Object> values = new ArrayList<>(launched.size());
        List<ErrorInfo> errors = new ArrayList<>();
        for (Task<?> branch : launched) {
            Result<Object> outcome = branch.handle().await();
            if (outcome instanceof Failure<Object> failure) {
                errors.add(failure.error());
            } else {
                values.add(outcome.orElseThrow());
            }
        }

        if (!errors.isEmpty()) {
            ErrorInfo first = errors.get(0).withSuppressed(errors.subList(1, errors.size()));
            log.debug("{} of {} branches failed, first: {}", errors.size(), branches.size(), first.message());
            if (task.recovery() != null) {
                return recover(task.recovery(), first);
            }
            return Result.failure(first);
        }

        CheckedFunction<Object, Object> gather = actions.get(0);
        List<Object> ordered = Collections.unmodifiableList(values);
        Result<Object> gathered = Result.attempt(() -> gather.apply(ordered));
        return reduce(gathered, actions.subList(1, actions.size()), task.recovery());
    }

    @SuppressWarnings("unchecked")
    private static List<Task<?>> branchesOf(Object value) {
        if (!(value instanceof List<?> list)) {
            throw new IllegalStateException("parallel task must hold a list of tasks (current: " + value + ")");
        }
        for (Object element : list) {
            if (!(element instanceof Task<?>)) {
                throw new IllegalStateException("parallel task holds a non-task element: " + element);
            }
        }
        return (List<Task<?>>) list;
    }
}
