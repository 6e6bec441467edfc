package com.inventoryforecast.client;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in calendar of US federal holidays, computed per year from 1986, the
 * first year all of its rules applied. Observed-day shifts for weekend holidays
 * are not applied.
 */
@Component
@ConditionalOnProperty(name = "pipeline.holidays.provider", havingValue = "static", matchIfMissing = true)
public class StaticHolidayCalendar implements HolidayCalendar {

    static final int FIRST_YEAR = 1986;

    private final Map<Integer, Set<LocalDate>> byYear = new ConcurrentHashMap<>();

    @Override
    public boolean isHoliday(LocalDate date) {
        return covers(date)
            && byYear.computeIfAbsent(date.getYear(), StaticHolidayCalendar::federalHolidays).contains(date);
    }

    @Override
    public boolean covers(LocalDate date) {
        return date.getYear() >= FIRST_YEAR;
    }

    static Set<LocalDate> federalHolidays(int year) {
        LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
        LocalDate mlk = nth(year, Month.JANUARY, DayOfWeek.MONDAY, 3);
        LocalDate presidents = nth(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3);
        LocalDate memorial = LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY));
        LocalDate independence = LocalDate.of(year, Month.JULY, 4);
        LocalDate labor = nth(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1);
        LocalDate columbus = nth(year, Month.OCTOBER, DayOfWeek.MONDAY, 2);
        LocalDate veterans = LocalDate.of(year, Month.NOVEMBER, 11);
        LocalDate thanksgiving = nth(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4);
        LocalDate christmas = LocalDate.of(year, Month.DECEMBER, 25);
        if (year >= 2021) {
            return Set.of(newYear, mlk, presidents, memorial, LocalDate.of(year, Month.JUNE, 19),
                independence, labor, columbus, veterans, thanksgiving, christmas);
        }
        return Set.of(newYear, mlk, presidents, memorial, independence, labor, columbus,
            veterans, thanksgiving, christmas);
    }

    private static LocalDate nth(int year, Month month, DayOfWeek day, int ordinal) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(ordinal, day));
    }
}
