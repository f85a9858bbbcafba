package com.ryuqq.halfling.adapter.runner;

import com.ryuqq.halfling.core.spi.TaskLauncher;

/**
 * 호출 스레드에서 바로 실행하는 TaskLauncher.
 *
 * <p>launch()는 작업이 끝난 뒤에 반환되므로 runAsync()도 동기적으로 동작하고,
 * 병렬 Task의 하위 Task는 선언 순서대로 하나씩 실행됩니다.
 * 스레드 전환 없이 결과를 재현해야 하는 테스트와 디버깅 용도입니다.</p>
 *
 * <p>하위 Task끼리 서로를 기다리는 계산 (래치, 랑데부 등)은 이 Launcher에서 끝나지 않습니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class InlineLauncher implements TaskLauncher {

    private static final InlineLauncher INSTANCE = new InlineLauncher();

    private InlineLauncher() {
    }

    public static InlineLauncher instance() {
        return INSTANCE;
    }

    @Override
    public void launch(Runnable work) {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        work.run();
    }

    @Override
    public String toString() {
        return "InlineLauncher";
    }
}
