package com.inventoryforecast.client;

import java.time.LocalDate;

/** Public holiday reference joined onto the demand series by date. */
public interface HolidayCalendar {

    boolean isHoliday(LocalDate date);

    /** Whether the reference has data for the year of {@code date}. */
    boolean covers(LocalDate date);
}
