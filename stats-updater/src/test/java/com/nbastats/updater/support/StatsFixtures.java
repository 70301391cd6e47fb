package com.nbastats.updater.support;

import com.nbastats.updater.model.StatsResponse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds provider payloads with values at the column positions each endpoint uses.
 */
public final class StatsFixtures {

    private StatsFixtures() {
    }

    @SafeVarargs
    public static StatsResponse response(String resultSetName, List<Object>... rows) {
        StatsResponse.ResultSet resultSet = new StatsResponse.ResultSet(
                resultSetName, new ArrayList<>(), new ArrayList<>(Arrays.asList(rows)));
        return new StatsResponse(resultSetName, new ArrayList<>(List.of(resultSet)));
    }

    public static StatsResponse responseWithRows(String resultSetName, List<List<Object>> rows) {
        StatsResponse.ResultSet resultSet = new StatsResponse.ResultSet(
                resultSetName, new ArrayList<>(), new ArrayList<>(rows));
        return new StatsResponse(resultSetName, new ArrayList<>(List.of(resultSet)));
    }

    /**
     * A row of {@code width} nulls with the given index/value pairs filled in.
     */
    public static List<Object> row(int width, Object... indexValuePairs) {
        List<Object> row = new ArrayList<>();
        for (int i = 0; i < width; i++) {
            row.add(null);
        }
        for (int i = 0; i < indexValuePairs.length; i += 2) {
            row.set((Integer) indexValuePairs[i], indexValuePairs[i + 1]);
        }
        return row;
    }

    public static List<Object> standingsRow(long teamId, String city, String name, int wins, int losses) {
        return row(15, 2, teamId, 3, city, 4, name, 6, "East", 10, "Atlantic", 13, wins, 14, losses);
    }

    public static StatsResponse teamInfo(long teamId, String city, String name, String abbreviation) {
        return response("TeamInfoCommon",
                row(11, 0, teamId, 2, city, 3, name, 4, abbreviation, 5, "East", 6, "Atlantic", 9, 1, 10, 1));
    }

    public static List<Object> rosterRow(long teamId, long playerId, String name, String number, String position) {
        return row(15, 0, teamId, 3, name, 6, number, 7, position, 14, playerId);
    }

    /**
     * The two team rows of one game. Scores of null leave the game unplayed.
     */
    public static List<List<Object>> gameLogPair(String gameId, String date,
                                                 long homeId, String homeAbbr, Integer homePts,
                                                 long awayId, String awayAbbr, Integer awayPts) {
        String homeWl = homePts == null || awayPts == null ? null : (homePts > awayPts ? "W" : "L");
        String awayWl = homeWl == null ? null : ("W".equals(homeWl) ? "L" : "W");
        return List.of(
                row(27, 0, "22023", 1, homeId, 2, homeAbbr, 4, gameId, 5, date,
                        6, homeAbbr + " vs. " + awayAbbr, 7, homeWl, 26, homePts),
                row(27, 0, "22023", 1, awayId, 2, awayAbbr, 4, gameId, 5, date,
                        6, awayAbbr + " @ " + homeAbbr, 7, awayWl, 26, awayPts));
    }

    public static List<Object> boxScoreRow(String gameId, long teamId, long playerId, String name,
                                           String minutes, int points) {
        return row(29, 0, gameId, 1, teamId, 4, playerId, 5, name, 9, minutes,
                10, 8, 11, 15, 12, 0.533, 13, 2, 14, 5, 15, 0.4, 16, 4, 17, 5, 18, 0.8,
                21, 7, 22, 5, 23, 1, 24, 0, 25, 2, 26, 3, 27, points, 28, 6);
    }
}
