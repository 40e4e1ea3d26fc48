package com.example.shifthybrid.predictor;

import com.example.shifthybrid.config.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the configured {@link ShiftPredictor} with a timeout. Whatever goes wrong,
 * the caller gets {@link PredictionResult#unavailable(String)} and the run carries on
 * rule-based.
 */
@Component
public class PredictorAdapter {

    private static final Logger logger = LoggerFactory.getLogger(PredictorAdapter.class);

    private final ObjectProvider<ShiftPredictor> predictorProvider;
    private final Executor predictorExecutor;
    private final EngineSettings settings;

    public PredictorAdapter(ObjectProvider<ShiftPredictor> predictorProvider,
                            @Qualifier("predictorExecutor") Executor predictorExecutor,
                            EngineSettings settings) {
        this.predictorProvider = predictorProvider;
        this.predictorExecutor = predictorExecutor;
        this.settings = settings;
    }

    public PredictionResult predict(PredictionRequest request, Long timeoutMillis) {
        ShiftPredictor predictor = predictorProvider.getIfUnique();
        if (predictor == null) {
            logger.warn("No unique ShiftPredictor bean available, generating rule-based");
            return PredictionResult.unavailable("no predictor");
        }
        long timeout = timeoutMillis != null && timeoutMillis > 0 ? timeoutMillis : settings.getPredictorTimeoutMillis();

        // cancel(true) interrupts the worker
        FutureTask<PredictionResult> task = new FutureTask<>(() -> predictor.predict(request));
        try {
            predictorExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.warn("Predictor executor is full, generating rule-based: {}", e.getMessage());
            return PredictionResult.unavailable("predictor busy");
        }
        PredictionResult result;
        try {
            result = task.get(timeout, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            logger.warn("Predictor did not answer within {} ms", timeout);
            return PredictionResult.unavailable("timeout after " + timeout + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Predictor failed: {}", cause.getMessage(), cause);
            return PredictionResult.unavailable("predictor error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            logger.warn("Interrupted while waiting for the predictor");
            return PredictionResult.unavailable("interrupted");
        }
        return sanitize(result);
    }

    private PredictionResult sanitize(PredictionResult result) {
        if (result == null) {
            logger.warn("Predictor returned nothing");
            return PredictionResult.unavailable("null result");
        }
        if (!result.available()) {
            logger.info("Predictor unavailable: {}", result.reason());
            return result;
        }
        Double confidence = result.confidence();
        if (confidence == null || confidence.isNaN() || confidence < 0 || confidence > 1) {
            logger.warn("Predictor confidence {} outside [0,1], ignoring its output", confidence);
            return PredictionResult.unavailable("malformed confidence " + confidence);
        }
        if (result.perCell().isEmpty()) {
            logger.warn("Predictor returned no cell distributions");
            return PredictionResult.unavailable("empty prediction");
        }
        boolean malformed = result.perCell().values().stream()
                .anyMatch(d -> d == null || !d.wellFormed());
        if (malformed) {
            logger.warn("Predictor returned malformed distributions, ignoring its output");
            return PredictionResult.unavailable("malformed distribution");
        }
        return result;
    }
}
