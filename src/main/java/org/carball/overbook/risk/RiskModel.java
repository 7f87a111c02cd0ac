package org.carball.overbook.risk;

import org.carball.overbook.model.risk.BookingAttributes;
import org.carball.overbook.model.risk.RiskAssessment;

/**
 * Source of no-show probabilities. Implementations must return a probability in [0, 1].
 */
@FunctionalInterface
public interface RiskModel {

    RiskAssessment predict(BookingAttributes attributes);
}
