package com.clinic.scheduling.utils;

import com.clinic.scheduling.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeParserTest {

    @Test
    void shouldParseTwentyFourHourTimes() {
        assertThat(TimeParser.parseTime("10:00", "time")).isEqualTo(LocalTime.of(10, 0));
        assertThat(TimeParser.parseTime("9:05", "time")).isEqualTo(LocalTime.of(9, 5));
        assertThat(TimeParser.parseTime("13:20:00", "time")).isEqualTo(LocalTime.of(13, 20));
    }

    @Test
    void shouldParseTwelveHourTimes() {
        assertThat(TimeParser.parseTime("10:00 AM", "time")).isEqualTo(LocalTime.of(10, 0));
        assertThat(TimeParser.parseTime("4:30pm", "time")).isEqualTo(LocalTime.of(16, 30));
        assertThat(TimeParser.parseTime("4.30 pm", "time")).isEqualTo(LocalTime.of(16, 30));
        assertThat(TimeParser.parseTime("12:15 AM", "time")).isEqualTo(LocalTime.of(0, 15));
    }

    @Test
    void shouldIgnoreTrailingRange() {
        assertThat(TimeParser.parseTime("10:00 AM to 10:30 AM", "time")).isEqualTo(LocalTime.of(10, 0));
    }

    @Test
    void shouldRejectGarbageWithFieldName() {
        assertThatThrownBy(() -> TimeParser.parseTime("noon", "startTime"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("startTime");
        assertThatThrownBy(() -> TimeParser.parseTime(" ", "endTime"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("endTime");
    }

    @Test
    void shouldParseDates() {
        assertThat(TimeParser.parseDate("2025-04-11", "date")).isEqualTo(LocalDate.of(2025, 4, 11));
        assertThatThrownBy(() -> TimeParser.parseDate("11/04/2025", "date"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldParseDateTimesWithSpaceOrT() {
        LocalDateTime expected = LocalDateTime.of(2025, 4, 12, 12, 0);
        assertThat(TimeParser.parseDateTime("2025-04-12 12:00", "appointmentDate")).isEqualTo(expected);
        assertThat(TimeParser.parseDateTime("2025-04-12T12:00:00", "appointmentDate")).isEqualTo(expected);
        assertThatThrownBy(() -> TimeParser.parseDateTime("2025-04-12", "appointmentDate"))
                .isInstanceOf(ValidationException.class);
    }
}
