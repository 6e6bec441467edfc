package com.inventoryforecast.client;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class StaticHolidayCalendarTest {

    private final StaticHolidayCalendar calendar = new StaticHolidayCalendar();

    @Test
    void movingHolidaysFallOnTheRightWeekday() {
        assertThat(calendar.isHoliday(LocalDate.of(2024, 1, 15))).isTrue();  // MLK
        assertThat(calendar.isHoliday(LocalDate.of(2024, 5, 27))).isTrue();  // Memorial Day
        assertThat(calendar.isHoliday(LocalDate.of(2024, 11, 28))).isTrue(); // Thanksgiving
        assertThat(calendar.isHoliday(LocalDate.of(2024, 11, 21))).isFalse();
    }

    @Test
    void juneteenthOnlyFrom2021() {
        assertThat(calendar.isHoliday(LocalDate.of(2020, 6, 19))).isFalse();
        assertThat(calendar.isHoliday(LocalDate.of(2021, 6, 19))).isTrue();
        assertThat(StaticHolidayCalendar.federalHolidays(2020)).hasSize(10);
        assertThat(StaticHolidayCalendar.federalHolidays(2024)).hasSize(11);
    }

    @Test
    void coversYearsFrom1986() {
        assertThat(calendar.covers(LocalDate.of(1986, 1, 1))).isTrue();
        assertThat(calendar.covers(LocalDate.of(1985, 12, 31))).isFalse();
        assertThat(calendar.isHoliday(LocalDate.of(1985, 12, 25))).isFalse();
    }
}
