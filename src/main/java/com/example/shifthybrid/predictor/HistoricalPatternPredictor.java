package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Day-of-week frequency model over past periods: what a staff member usually works on
 * a Monday is what they are predicted to work on the next Monday.
 * <p>
 * Counts are Laplace-smoothed over the values the staff member may work. A cell's
 * confidence grows with its sample size and with how peaked the distribution is; the
 * run confidence is the mean over all cells, cells without history counting as zero.
 */
@Component
public class HistoricalPatternPredictor implements ShiftPredictor {

    private static final Logger logger = LoggerFactory.getLogger(HistoricalPatternPredictor.class);
    private static final double SMOOTHING = 1.0;
    private static final double SAMPLE_HALF_WEIGHT = 2.0;

    @Override
    public PredictionResult predict(PredictionRequest request) {
        List<Map<String, Map<LocalDate, ShiftValue>>> history = request.features().historicalPeriods();
        if (history.isEmpty()) {
            return PredictionResult.unavailable("no historical periods");
        }
        List<LocalDate> dates = request.dateRange().dates();
        Map<DateCell, ShiftDistribution> perCell = new LinkedHashMap<>();
        double confidenceSum = 0;
        for (Staff staff : request.roster()) {
            Map<DayOfWeek, EnumMap<ShiftValue, Integer>> counts = countByDayOfWeek(staff.id(), history);
            for (LocalDate date : dates) {
                EnumMap<ShiftValue, Integer> dayCounts = counts.get(date.getDayOfWeek());
                if (dayCounts == null) {
                    continue;
                }
                ShiftDistribution distribution = smooth(staff, dayCounts);
                int samples = dayCounts.values().stream().mapToInt(Integer::intValue).sum();
                double sampleFactor = samples / (samples + SAMPLE_HALF_WEIGHT);
                confidenceSum += sampleFactor * distribution.probability(distribution.argmax());
                perCell.put(DateCell.of(staff.id(), date), distribution);
            }
        }
        int cellCount = request.roster().size() * dates.size();
        if (perCell.isEmpty() || cellCount == 0) {
            return PredictionResult.unavailable("no history for the roster");
        }
        double confidence = confidenceSum / cellCount;
        logger.debug("Predicted {} of {} cells from {} periods, confidence {}", perCell.size(), cellCount,
                history.size(), String.format("%.3f", confidence));
        return PredictionResult.of(perCell, confidence);
    }

    private Map<DayOfWeek, EnumMap<ShiftValue, Integer>> countByDayOfWeek(
            String staffId, List<Map<String, Map<LocalDate, ShiftValue>>> history) {
        Map<DayOfWeek, EnumMap<ShiftValue, Integer>> counts = new EnumMap<>(DayOfWeek.class);
        for (Map<String, Map<LocalDate, ShiftValue>> period : history) {
            Map<LocalDate, ShiftValue> row = period.get(staffId);
            if (row == null) {
                continue;
            }
            row.forEach((date, value) -> {
                if (date != null && value != null) {
                    counts.computeIfAbsent(date.getDayOfWeek(), d -> new EnumMap<>(ShiftValue.class))
                            .merge(value, 1, Integer::sum);
                }
            });
        }
        return counts;
    }

    private ShiftDistribution smooth(Staff staff, EnumMap<ShiftValue, Integer> counts) {
        double total = 0;
        int eligible = 0;
        for (ShiftValue value : ShiftValue.values()) {
            if (staff.mayWork(value)) {
                total += counts.getOrDefault(value, 0);
                eligible++;
            }
        }
        Map<ShiftValue, Double> probabilities = new EnumMap<>(ShiftValue.class);
        for (ShiftValue value : ShiftValue.values()) {
            if (staff.mayWork(value)) {
                probabilities.put(value, (counts.getOrDefault(value, 0) + SMOOTHING) / (total + SMOOTHING * eligible));
            }
        }
        return new ShiftDistribution(probabilities);
    }
}
