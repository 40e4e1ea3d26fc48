package com.example.shifthybrid.generator;

import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.exception.GenerationCancelledException;
import com.example.shifthybrid.schedule.CancellationToken;
import com.example.shifthybrid.schedule.StageReport;
import com.example.shifthybrid.support.TestRosters;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixedPointRunnerTest {

    private final RosterContext roster = TestRosters.context(TestRosters.staff(1), TestRosters.days(1), List.of());
    private final GenerationContext context = new GenerationContext(TestRosters.schedule(roster), roster, 1L, 2);

    @Test
    void run_stopsAtFirstPassWithoutChanges() {
        CountdownStage stage = new CountdownStage(2);

        FixedPointRunner.Result result = new FixedPointRunner(5).run(List.of(stage), context, CancellationToken.none());

        assertThat(result.converged()).isTrue();
        assertThat(result.iterations()).isEqualTo(3);
        assertThat(result.reports()).extracting(StageReport::cellsChanged).containsExactly(1, 1, 0);
    }

    @Test
    void run_iterationBoundHit_reportsNotConverged() {
        FixedPointRunner.Result result = new FixedPointRunner(2)
                .run(List.of(new CountdownStage(10)), context, CancellationToken.none());

        assertThat(result.converged()).isFalse();
        assertThat(result.iterations()).isEqualTo(2);
    }

    @Test
    void run_cancelledToken_stopsBeforeNextStage() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> new FixedPointRunner(3).run(List.of(new CountdownStage(1)), context, token))
                .isInstanceOf(GenerationCancelledException.class);
    }

    private static final class CountdownStage implements GenerationStage {

        private int remaining;

        CountdownStage(int changes) {
            this.remaining = changes;
        }

        @Override
        public String name() {
            return "countdown";
        }

        @Override
        public int apply(GenerationContext context) {
            if (remaining == 0) {
                return 0;
            }
            remaining--;
            return 1;
        }
    }
}
