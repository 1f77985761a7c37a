package com.longevitydigest.backend.model.dto;

import java.time.LocalDate;
import lombok.Value;

/**
 * Inclusive date range passed to source adapters
 */
@Value
public class DateWindow {
    LocalDate from;
    LocalDate to;

    public static DateWindow lastDays(int days, LocalDate today) {
        return new DateWindow(today.minusDays(days), today);
    }
}
