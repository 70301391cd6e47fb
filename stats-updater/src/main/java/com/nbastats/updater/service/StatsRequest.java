package com.nbastats.updater.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One call to a stats.nba.com endpoint, e.g. {@code commonteamroster?TeamID=...&Season=...}.
 */
public record StatsRequest(String endpoint, Map<String, Object> params) {

    public StatsRequest {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static StatsRequest of(String endpoint) {
        return new StatsRequest(endpoint, Map.of());
    }

    public StatsRequest with(String name, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(params);
        next.put(name, value);
        return new StatsRequest(endpoint, next);
    }

    @Override
    public String toString() {
        return endpoint + params;
    }
}
