package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Game {

    public static final String STATUS_UPCOMING = "Upcoming";
    public static final String STATUS_LIVE = "Live";
    public static final String STATUS_COMPLETED = "Completed";

    private String gameId;          // 10-digit provider id, e.g. 0022300061
    private LocalDate gameDate;
    private long homeTeamId;
    private long awayTeamId;
    private Integer homeScore;
    private Integer awayScore;
    private String seasonYear;      // "2023-24"
    private String playoffRound;    // null for regular season
    private String status;
    private boolean loaded;         // player stats fully ingested
    private Instant lastUpdated;
}
