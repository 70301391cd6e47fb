package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One player's box score line for one game.
 * Natural key: (playerId, gameId, teamId).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PlayerGameStats {

    private long playerId;
    private String gameId;
    private long teamId;

    private String minutes;         // "MM:SS"
    private int points;
    private int rebounds;
    private int assists;
    private int steals;
    private int blocks;
    private int fgm;
    private int fga;
    private double fgPct;
    private int tpm;
    private int tpa;
    private double tpPct;
    private int ftm;
    private int fta;
    private double ftPct;
    private int turnovers;
    private int fouls;
    private int plusMinus;

    private Instant lastUpdated;
}
