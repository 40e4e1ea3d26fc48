package com.example.shifthybrid.schedule;

import com.example.shifthybrid.audit.AuditEvent;
import com.example.shifthybrid.audit.AuditEventPublisher;
import com.example.shifthybrid.config.EngineSettings;
import com.example.shifthybrid.constraint.ConstraintSetValidator;
import com.example.shifthybrid.constraint.ConstraintSnapshot;
import com.example.shifthybrid.constraint.RosterContext;
import com.example.shifthybrid.constraint.Violation;
import com.example.shifthybrid.engine.HybridDecision;
import com.example.shifthybrid.engine.HybridDecisionEngine;
import com.example.shifthybrid.exception.InvariantViolationException;
import com.example.shifthybrid.exception.ScheduleGenerationException;
import com.example.shifthybrid.generator.FixedPointRunner;
import com.example.shifthybrid.generator.GenerationContext;
import com.example.shifthybrid.generator.RuleBasedGenerator;
import com.example.shifthybrid.lock.LockedCells;
import com.example.shifthybrid.lock.PreGenerationLocker;
import com.example.shifthybrid.predictor.PredictionRequest;
import com.example.shifthybrid.predictor.PredictionResult;
import com.example.shifthybrid.predictor.PredictorAdapter;
import com.example.shifthybrid.repair.RepairSummary;
import com.example.shifthybrid.repair.ViolationRepairEngine;
import com.example.shifthybrid.validation.ScheduleValidator;
import com.example.shifthybrid.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one generation: validate the snapshot, lock mandated cells, ask the predictor,
 * choose a band, seed, run the rule stages, validate, repair and validate again.
 * <p>
 * Runs share nothing mutable, so any number of them may execute at once.
 */
@Service
public class ScheduleGenerationService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleGenerationService.class);

    private final ConstraintSetValidator constraintSetValidator;
    private final PreGenerationLocker locker;
    private final PredictorAdapter predictorAdapter;
    private final HybridDecisionEngine decisionEngine;
    private final RuleBasedGenerator generator;
    private final ScheduleValidator validator;
    private final ViolationRepairEngine repairEngine;
    private final AuditEventPublisher auditPublisher;
    private final EngineSettings settings;
    private final Executor scheduleExecutor;

    public ScheduleGenerationService(ConstraintSetValidator constraintSetValidator,
            PreGenerationLocker locker,
            PredictorAdapter predictorAdapter,
            HybridDecisionEngine decisionEngine,
            RuleBasedGenerator generator,
            ScheduleValidator validator,
            ViolationRepairEngine repairEngine,
            AuditEventPublisher auditPublisher,
            EngineSettings settings,
            @Qualifier("scheduleExecutor") Executor scheduleExecutor) {
        this.constraintSetValidator = constraintSetValidator;
        this.locker = locker;
        this.predictorAdapter = predictorAdapter;
        this.decisionEngine = decisionEngine;
        this.generator = generator;
        this.validator = validator;
        this.repairEngine = repairEngine;
        this.auditPublisher = auditPublisher;
        this.settings = settings;
        this.scheduleExecutor = scheduleExecutor;
    }

    public GenerationReport generate(GenerationRequest request) {
        return generate(request, CancellationToken.none());
    }

    public GenerationReport generate(GenerationRequest request, CancellationToken token) {
        String runId = UUID.randomUUID().toString();
        long seed = request.rngSeed() != null ? request.rngSeed() : settings.getDefaultSeed();
        ConstraintSnapshot snapshot = new ConstraintSnapshot(request.snapshotVersion(), request.constraints(),
                request.calendarMandates());
        logger.info("Generating schedule {}..{} for {} staff (snapshot {}, seed {})",
                request.dateRange().start(), request.dateRange().end(), request.roster().size(),
                snapshot.version(), seed);

        constraintSetValidator.validate(request.roster(), request.dateRange(), snapshot);
        LockedCells lockedCells = locker.lock(snapshot.mandates(), request.roster(), request.dateRange());
        RosterContext context = new RosterContext(request.roster(), request.dateRange(), snapshot, lockedCells);

        token.throwIfCancelled("predict");
        PredictionResult prediction = predictorAdapter.predict(
                new PredictionRequest(request.roster(), request.dateRange(), request.predictorFeatures()),
                request.predictorTimeoutMillis());
        HybridDecision decision = decisionEngine.decide(prediction);
        audit(runId, snapshot, "decision", decision.method().name(), Map.of(
                "band", decision.band().name(),
                "confidence", decision.confidence() == null ? "n/a" : decision.confidence()));

        token.throwIfCancelled("seed");
        Schedule schedule = new Schedule(context.staffIds(), context.dates(), lockedCells);
        int seeded = decisionEngine.seed(decision, prediction, schedule, context);
        List<StageReport> stageReports = new ArrayList<>();
        stageReports.add(new StageReport("seed", 1, seeded));

        GenerationContext generationContext = new GenerationContext(schedule, context, seed, settings.getWeeklyRestDays());
        FixedPointRunner.Result stages = generator.generate(generationContext, decision, token);
        stageReports.addAll(stages.reports());
        audit(runId, snapshot, "generate", stages.converged() ? "converged" : "iteration bound reached",
                Map.of("passes", stages.iterations()));

        token.throwIfCancelled("validate");
        ValidationResult preRepair = validator.validate(schedule, context);

        token.throwIfCancelled("repair");
        RepairSummary repairSummary = repairEngine.repair(schedule, context, decision.tierOneOnly());
        ValidationResult result = validator.validate(schedule, context);
        audit(runId, snapshot, "repair", repairSummary.repaired() + " repaired", Map.of(
                "before", preRepair.violations().size(),
                "after", result.violations().size()));

        verifyInvariants(schedule, lockedCells, result);

        GenerationReport report = new GenerationReport(schedule.snapshot(), decision.method(), decision.band(),
                decision.confidence(), decision.reason(), preRepair.violations(), repairSummary, result.violations(),
                result.metrics(), stageReports, stages.converged(), lockedCells.size(), snapshot.version(), seed);
        logger.info("Generated {}..{} via {} ({}): {} violation(s) before repair, {} after",
                request.dateRange().start(), request.dateRange().end(), decision.method(), decision.band(),
                preRepair.violations().size(), result.violations().size());
        return report;
    }

    @Async("scheduleExecutor")
    public CompletableFuture<GenerationReport> generateAsync(GenerationRequest request, CancellationToken token) {
        return CompletableFuture.completedFuture(generate(request, token));
    }

    /**
     * Independent runs (other periods, what-if variants) in parallel. Reports come back
     * in request order; the first failure is rethrown.
     */
    public List<GenerationReport> generateAll(List<GenerationRequest> requests) {
        List<CompletableFuture<GenerationReport>> futures = requests.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> generate(r), scheduleExecutor))
                .toList();
        List<GenerationReport> reports = new ArrayList<>();
        for (CompletableFuture<GenerationReport> future : futures) {
            try {
                reports.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof ScheduleGenerationException generationException) {
                    throw generationException;
                }
                throw new ScheduleGenerationException("Parallel generation failed", e.getCause());
            }
        }
        return reports;
    }

    private void verifyInvariants(Schedule schedule, LockedCells lockedCells, ValidationResult result) {
        for (Map.Entry<DateCell, ShiftValue> locked : lockedCells.asMap().entrySet()) {
            if (schedule.valueAt(locked.getKey()) != locked.getValue()) {
                throw new InvariantViolationException(String.valueOf(lockedCells.reason(locked.getKey())),
                        "Locked cell " + locked.getKey() + " changed", List.of(locked.getKey()));
            }
        }
        List<Violation> tierOne = result.tierOne();
        if (!tierOne.isEmpty()) {
            Violation first = tierOne.get(0);
            logger.error("{} tier-1 violation(s) survived repair, first: {}", tierOne.size(), first.message());
            throw new InvariantViolationException(first.constraintId(),
                    tierOne.size() + " tier-1 violation(s) survived repair: " + first.message(), first.cells());
        }
    }

    private void audit(String runId, ConstraintSnapshot snapshot, String stage, String detail, Map<String, Object> data) {
        auditPublisher.publish(AuditEvent.of(runId, snapshot.version(), stage, detail, new LinkedHashMap<>(data)));
    }
}
