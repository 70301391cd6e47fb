package com.nbastats.updater.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Raw DTO matching the stats.nba.com JSON envelope.
 * Every endpoint returns named result sets of positionally ordered rows.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StatsResponse {

    private String resource;

    @JsonProperty("resultSets")
    private List<ResultSet> resultSets = new ArrayList<>();

    public Optional<ResultSet> resultSet(String name) {
        if (resultSets == null) {
            return Optional.empty();
        }
        return resultSets.stream()
                .filter(rs -> name.equals(rs.getName()))
                .findFirst();
    }

    /** First result set, which is the primary one for most endpoints. */
    public Optional<ResultSet> primaryResultSet() {
        if (resultSets == null || resultSets.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(resultSets.get(0));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResultSet {
        private String name;
        private List<String> headers = new ArrayList<>();

        @JsonProperty("rowSet")
        private List<List<Object>> rowSet = new ArrayList<>();
    }
}
