package org.carball.overbook.parser;

import org.carball.overbook.model.schedule.Booking;
import org.carball.overbook.model.schedule.ProviderCalendar;
import org.carball.overbook.model.schedule.ScheduleInput;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ScheduleInputParserTest {

    private final ScheduleInputParser parser = new ScheduleInputParser();

    @Test
    void shouldParseYamlFixture() throws Exception {
        // Given
        Path fixture = Paths.get(getClass().getResource("/fixtures/schedule.yml").toURI());

        // When
        ScheduleInput input = parser.parse(fixture);

        // Then
        assertThat(input.date()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(input.bookings()).extracting(Booking::id).containsExactly("b1", "b2", "b3", "b4");
        assertThat(input.bookings().get(0).scheduledTime()).isEqualTo(LocalDateTime.of(2025, 3, 10, 9, 0));
        assertThat(input.bookings().get(0).appointmentType()).isEqualTo("checkup");
        assertThat(input.bookings().get(1).durationMinutes()).isNull();
        assertThat(input.providerCalendars().keySet()).containsExactly("dr-lee", "dr-patel");
        assertThat(input.providerCalendars().get("dr-patel"))
                .isEqualTo(new ProviderCalendar(LocalTime.of(13, 0), LocalTime.of(15, 0), 60));
        assertThat(input.noShowProbabilities()).containsEntry("b2", 0.55);
    }

    @Test
    void shouldParseJsonContent() throws Exception {
        String json = """
            {
              "date": "2025-03-11",
              "providerCalendars": {"dr-lee": {"start": "08:00", "end": "10:00"}},
              "bookings": [{"id": "x", "providerId": "dr-lee", "scheduledTime": "2025-03-11T08:30:00", "room": "4"}]
            }
            """;

        ScheduleInput input = parser.parse(json);

        assertThat(input.bookings()).hasSize(1);
        assertThat(input.providerCalendars().get("dr-lee").slotDurationMinutes()).isNull();
        assertThat(input.providerCalendars().get("dr-lee").effectiveSlotDuration()).isEqualTo(30);
        assertThat(input.noShowProbabilities()).isEmpty();
    }

    @Test
    void shouldRequireDate() {
        assertThatThrownBy(() -> parser.parse("bookings: []\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Schedule input must specify a date");
    }

    @Test
    void shouldRejectProbabilityOutsideUnitInterval() {
        String yaml = """
            date: "2025-03-10"
            noShowProbabilities:
              b1: 1.5
            """;

        assertThatThrownBy(() -> parser.parse(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("b1")
                .hasMessageContaining("1.5");
    }

    @Test
    void shouldRejectMissingFile(@TempDir Path tempDir) {
        assertThatThrownBy(() -> parser.parse(tempDir.resolve("missing.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Schedule file not found");
    }
}
