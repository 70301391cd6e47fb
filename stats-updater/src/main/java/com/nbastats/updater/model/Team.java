package com.nbastats.updater.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A franchise, keyed by the provider's team id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Team {

    private long teamId;
    private String name;            // "Boston Celtics"
    private String abbreviation;    // "BOS"
    private String conference;
    private String division;
    private Integer wins;
    private Integer losses;
    private String logoUrl;
    private boolean active;
    private Instant lastUpdated;
}
