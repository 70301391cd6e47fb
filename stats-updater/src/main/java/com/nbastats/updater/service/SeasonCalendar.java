package com.nbastats.updater.service;

import com.nbastats.updater.config.StatsUpdaterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Season labels in the provider's "YYYY-YY" form.
 *
 * A season starts in October, so before October we are still in the season that began the
 * previous autumn. A configured override wins over the date.
 */
@Component
@RequiredArgsConstructor
public class SeasonCalendar {

    private static final int SEASON_START_MONTH = 10;

    private final StatsUpdaterProperties properties;
    private final Clock clock;

    public String currentSeason() {
        String override = properties.getIngest().getSeason();
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        LocalDate today = today();
        int startYear = today.getMonthValue() >= SEASON_START_MONTH ? today.getYear() : today.getYear() - 1;
        return label(startYear);
    }

    public String previousSeason() {
        return label(startYear(currentSeason()) - 1);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * @throws IllegalArgumentException if {@code season} is not of the form "2023-24"
     */
    public static int startYear(String season) {
        if (season == null || !season.matches("\\d{4}-\\d{2}")) {
            throw new IllegalArgumentException("Season must be YYYY-YY, got: " + season);
        }
        return Integer.parseInt(season.substring(0, 4));
    }

    public static String label(int startYear) {
        return startYear + "-" + String.format("%02d", (startYear + 1) % 100);
    }
}
