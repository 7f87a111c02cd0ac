package org.carball.overbook.risk;

import lombok.extern.slf4j.Slf4j;
import org.carball.overbook.model.risk.BookingAttributes;
import org.carball.overbook.model.risk.RiskAssessment;
import org.carball.overbook.model.risk.RiskLevel;
import org.carball.overbook.model.schedule.Booking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class NoShowPredictionService {

    private final RiskModel riskModel;

    public NoShowPredictionService(RiskModel riskModel) {
        this.riskModel = riskModel;
    }

    /**
     * Scores every booking, keyed by booking id in booking order.
     */
    public Map<String, RiskAssessment> assessAll(List<Booking> bookings) {
        Map<String, RiskAssessment> assessments = new LinkedHashMap<>();
        for (Booking booking : bookings) {
            assessments.put(booking.id(), riskModel.predict(BookingAttributes.from(booking)));
        }
        long highRisk = assessments.values().stream()
                .filter(a -> a.riskLevel() == RiskLevel.HIGH)
                .count();
        log.info("Assessed {} bookings, {} high risk", assessments.size(), highRisk);
        return assessments;
    }

    /**
     * The probability map the optimizer consumes. Out-of-range model output is clamped to [0, 1].
     */
    public Map<String, Double> predictProbabilities(List<Booking> bookings) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (Map.Entry<String, RiskAssessment> entry : assessAll(bookings).entrySet()) {
            double p = entry.getValue().probability();
            if (p < 0.0 || p > 1.0) {
                log.warn("Risk model returned out-of-range probability {} for booking {}", p, entry.getKey());
                p = Math.max(0.0, Math.min(1.0, p));
            }
            probabilities.put(entry.getKey(), p);
        }
        return probabilities;
    }
}
