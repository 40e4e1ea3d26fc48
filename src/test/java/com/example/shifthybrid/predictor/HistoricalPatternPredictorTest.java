package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.DateCell;
import com.example.shifthybrid.schedule.DateRange;
import com.example.shifthybrid.schedule.ShiftValue;
import com.example.shifthybrid.staff.Staff;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.example.shifthybrid.support.TestRosters.START;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HistoricalPatternPredictorTest {

    private final HistoricalPatternPredictor predictor = new HistoricalPatternPredictor();

    @Test
    void predict_noHistory_isUnavailable() {
        PredictionResult result = predictor.predict(
                new PredictionRequest(List.of(Staff.of("s1", true)), new DateRange(START, START), null));

        assertThat(result.available()).isFalse();
    }

    @Test
    void predict_repeatedWeekdayPattern_favoursThatShift() {
        LocalDate mondayLastWeek = START.minusDays(7);
        LocalDate mondayBefore = START.minusDays(14);
        PredictorFeatures features = new PredictorFeatures(List.of(
                Map.of("s1", Map.of(mondayLastWeek, ShiftValue.LATE)),
                Map.of("s1", Map.of(mondayBefore, ShiftValue.LATE))), null);

        PredictionResult result = predictor.predict(
                new PredictionRequest(List.of(Staff.of("s1", true)), new DateRange(START, START), features));

        ShiftDistribution monday = result.perCell().get(DateCell.of("s1", START));
        assertThat(result.available()).isTrue();
        assertThat(monday.argmax()).isEqualTo(ShiftValue.LATE);
        assertThat(monday.probability(ShiftValue.LATE)).isCloseTo(0.5, within(1e-9));
        assertThat(result.confidence()).isCloseTo(0.25, within(1e-9));
    }

    @Test
    void predict_ineligibleShift_getsNoProbability() {
        PredictorFeatures features = new PredictorFeatures(List.of(
                Map.of("s1", Map.of(START.minusDays(7), ShiftValue.EARLY))), null);

        PredictionResult result = predictor.predict(
                new PredictionRequest(List.of(Staff.of("s1", false)), new DateRange(START, START), features));

        ShiftDistribution monday = result.perCell().get(DateCell.of("s1", START));
        assertThat(monday.probability(ShiftValue.EARLY)).isZero();
        assertThat(monday.wellFormed()).isTrue();
    }
}
