package com.ryuqq.halfling.testkit.contract;

import com.ryuqq.halfling.adapter.runner.InlineLauncher;
import com.ryuqq.halfling.core.spi.TaskLauncher;
import org.junit.jupiter.api.Nested;

/**
 * Contract suites run against {@link InlineLauncher}.
 *
 * <p>Tests that need concurrently running branches are skipped.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
class InlineContractTest {

    @Nested
    class Laws extends MonadLawContract {
        @Override
        protected TaskLauncher createLauncher() {
            return InlineLauncher.instance();
        }

        @Override
        protected boolean runsConcurrently() {
            return false;
        }
    }

    @Nested
    class Parallel extends ParallelContract {
        @Override
        protected TaskLauncher createLauncher() {
            return InlineLauncher.instance();
        }

        @Override
        protected boolean runsConcurrently() {
            return false;
        }
    }

    @Nested
    class Recovery extends RecoveryContract {
        @Override
        protected TaskLauncher createLauncher() {
            return InlineLauncher.instance();
        }

        @Override
        protected boolean runsConcurrently() {
            return false;
        }
    }
}
