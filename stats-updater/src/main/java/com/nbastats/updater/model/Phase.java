package com.nbastats.updater.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Ingestion phases, declared in the order they must run.
 * Players reference teams; games reference teams and, through stats, players.
 */
public enum Phase {

    TEAMS("teams"),
    PLAYERS("players"),
    GAMES("games");

    private final String key;

    Phase(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Resolve a phase from its lowercase key, e.g. "players".
     *
     * @throws IllegalArgumentException for anything else
     */
    @JsonCreator
    public static Phase fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Phase must not be null");
        }
        String normalised = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(p -> p.key.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown phase '" + key + "' (expected teams, players or games)"));
    }

    public static Set<Phase> all() {
        return EnumSet.allOf(Phase.class);
    }

    public String displayName() {
        return Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }
}
