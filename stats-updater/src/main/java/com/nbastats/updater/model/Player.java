package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Player {

    private long playerId;
    private String fullName;
    private String firstName;
    private String lastName;
    private String position;        // G, F, C, G-F, F-G, F-C, C-F or null
    private String jerseyNumber;
    private Long currentTeamId;
    private Long previousTeamId;    // set when a roster fetch moves the player
    private Instant tradedDate;
    private String headshotUrl;
    private boolean active;
    private Instant lastUpdated;
}
