package org.carball.overbook.optimizer;

import org.carball.overbook.config.OptimizerConfig;
import org.carball.overbook.model.schedule.TimeSlot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.carball.overbook.optimizer.SlotFixtures.slot;

public class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator(OptimizerConfig.defaults());

    @Test
    void shouldEmitAllRecommendationsInFixedOrder() {
        // Given
        List<TimeSlot> slots = List.of(slot(9, 0, "a"), slot(13, 1, "b"));
        Map<String, Double> probabilities = Map.of("x", 0.5, "y", 0.41, "z", 0.4);

        // When
        List<String> recommendations = generator.generate(slots, probabilities);

        // Then
        assertThat(recommendations).containsExactly(
                "Send additional reminders to 2 high-risk patients",
                "Consider opening 1 empty slots for same-day bookings",
                "Send morning appointment reminders by 6 PM the day before");
    }

    @Test
    void shouldEmitMorningTipOnce() {
        List<TimeSlot> slots = List.of(slot(8, 1, "a"), slot(9, 1, "b"), slot(11, 1, "c"));

        List<String> recommendations = generator.generate(slots, Map.of());

        assertThat(recommendations).containsExactly(RecommendationGenerator.MORNING_REMINDER_TIP);
    }

    @Test
    void shouldEmitNothingForFullAfternoonWithLowRisk() {
        List<TimeSlot> slots = List.of(slot(12, 1, "a"), slot(15, 2, "b"));

        assertThat(generator.generate(slots, Map.of("a-0", 0.1, "b-0", 0.4))).isEmpty();
    }

    @Test
    void shouldCountEmptySlotsAcrossProviders() {
        List<TimeSlot> slots = List.of(slot(13, 0, "a"), slot(14, 0, "b"), slot(15, 0, "c"));

        assertThat(generator.generate(slots, Map.of()))
                .containsExactly("Consider opening 3 empty slots for same-day bookings");
    }
}
