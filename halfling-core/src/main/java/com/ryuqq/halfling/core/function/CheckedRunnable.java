package com.ryuqq.halfling.core.function;

/**
 * 입력과 결과가 없는 부수효과 블록.
 *
 * <p>{@code Task.thenDo}에서 사용됩니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CheckedRunnable {

    void run() throws Exception;
}
