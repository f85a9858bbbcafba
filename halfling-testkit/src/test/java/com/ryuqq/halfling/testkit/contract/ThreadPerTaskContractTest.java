package com.ryuqq.halfling.testkit.contract;

import com.ryuqq.halfling.core.launcher.ThreadPerTaskLauncher;
import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.junit.jupiter.api.Nested;

/**
 * Contract suites run against {@link ThreadPerTaskLauncher}.
 *
 * @author Halfling Team
 * @since 1.0.0
 */
class ThreadPerTaskContractTest {

    @Nested
    class Laws extends MonadLawContract {
        @Override
        protected TaskLauncher createLauncher() {
            return ThreadPerTaskLauncher.shared();
        }
    }

    @Nested
    class Parallel extends ParallelContract {
        @Override
        protected TaskLauncher createLauncher() {
            return ThreadPerTaskLauncher.shared();
        }
    }

    @Nested
    class Recovery extends RecoveryContract {
        @Override
        protected TaskLauncher createLauncher() {
            return ThreadPerTaskLauncher.shared();
        }
    }
}
