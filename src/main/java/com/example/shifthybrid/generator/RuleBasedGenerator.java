package com.example.shifthybrid.generator;

import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.engine.HybridDecision;
import com.example.shifthybrid.schedule.CancellationToken;
import com.example.shifthybrid.schedule.StageReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the rule stages over an already seeded schedule: staff groups, priority rules,
 * limits, priority rules again, off-day fairness and a final priority pass. The whole
 * sequence repeats until nothing changes. Predictor-direct runs skip it entirely.
 */
@Component
public class RuleBasedGenerator {

    private static final Logger logger = LoggerFactory.getLogger(RuleBasedGenerator.class);

    private final EngineSettings settings;
    private final List<GenerationStage> stages;

    public RuleBasedGenerator(EngineSettings settings) {
        this.settings = settings;
        this.stages = List.of(
                new StaffGroupStage(),
                new PriorityRuleStage("priority-rules"),
                new LimitEnforcementStage(),
                new PriorityRuleStage("priority-reapply"),
                new OffDayFairnessStage(),
                new PriorityRuleStage("priority-final"));
    }

    public List<GenerationStage> stages() {
        return stages;
    }

    public FixedPointRunner.Result generate(GenerationContext context, HybridDecision decision, CancellationToken token) {
        if (decision.tierOneOnly()) {
            logger.debug("Band {}: rule stages skipped", decision.band());
            return new FixedPointRunner.Result(List.of(), 0, true);
        }
        FixedPointRunner.Result result = new FixedPointRunner(settings.getFixedPointMaxIterations())
                .run(stages, context, token);
        logger.debug("Rule stages finished after {} pass(es), converged={}", result.iterations(), result.converged());
        return result;
    }
}
