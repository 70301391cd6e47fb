package com.nbastats.updater.service;

import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.PlayerGameStats;
import com.nbastats.updater.model.StatsResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns stats.nba.com result sets into typed rows.
 *
 * Rows are positional, so each endpoint's columns are addressed by fixed index.
 * A missing or malformed identifier raises {@link PermanentDataException}; optional
 * numeric columns fall back to zero.
 *
 * Endpoints:
 *   leaguestandingsv3      Standings
 *   teaminfocommon         TeamInfoCommon
 *   commonteamroster       CommonTeamRoster
 *   leaguegamelog          LeagueGameLog (team mode, two rows per game)
 *   boxscoretraditionalv2  PlayerStats
 */
@Component
@Slf4j
public class StatsPayloadParser {

    // leaguestandingsv3
    private static final int STANDINGS_TEAM_ID    = 2;
    private static final int STANDINGS_CITY       = 3;
    private static final int STANDINGS_NAME       = 4;
    private static final int STANDINGS_CONFERENCE = 6;
    private static final int STANDINGS_DIVISION   = 10;
    private static final int STANDINGS_WINS       = 13;
    private static final int STANDINGS_LOSSES     = 14;

    // teaminfocommon
    private static final int INFO_TEAM_ID      = 0;
    private static final int INFO_CITY         = 2;
    private static final int INFO_NAME         = 3;
    private static final int INFO_ABBREVIATION = 4;
    private static final int INFO_CONFERENCE   = 5;
    private static final int INFO_DIVISION     = 6;
    private static final int INFO_WINS         = 9;
    private static final int INFO_LOSSES       = 10;

    // commonteamroster
    private static final int ROSTER_TEAM_ID   = 0;
    private static final int ROSTER_PLAYER    = 3;
    private static final int ROSTER_NUM       = 6;
    private static final int ROSTER_POSITION  = 7;
    private static final int ROSTER_PLAYER_ID = 14;

    // leaguegamelog, PlayerOrTeam=T
    private static final int LOG_TEAM_ID      = 1;
    private static final int LOG_ABBREVIATION = 2;
    private static final int LOG_GAME_ID      = 4;
    private static final int LOG_GAME_DATE    = 5;
    private static final int LOG_MATCHUP      = 6;
    private static final int LOG_WL           = 7;
    private static final int LOG_PTS          = 26;

    // boxscoretraditionalv2 PlayerStats
    private static final int BOX_GAME_ID     = 0;
    private static final int BOX_TEAM_ID     = 1;
    private static final int BOX_PLAYER_ID   = 4;
    private static final int BOX_PLAYER_NAME = 5;
    private static final int BOX_MIN         = 9;
    private static final int BOX_FGM         = 10;
    private static final int BOX_FGA         = 11;
    private static final int BOX_FG_PCT      = 12;
    private static final int BOX_FG3M        = 13;
    private static final int BOX_FG3A        = 14;
    private static final int BOX_FG3_PCT     = 15;
    private static final int BOX_FTM         = 16;
    private static final int BOX_FTA         = 17;
    private static final int BOX_FT_PCT      = 18;
    private static final int BOX_REB         = 21;
    private static final int BOX_AST         = 22;
    private static final int BOX_STL         = 23;
    private static final int BOX_BLK         = 24;
    private static final int BOX_TO          = 25;
    private static final int BOX_PF          = 26;
    private static final int BOX_PTS         = 27;
    private static final int BOX_PLUS_MINUS  = 28;

    private static final Set<String> VALID_POSITIONS = Set.of("G", "F", "C", "G-F", "F-G", "F-C", "C-F");

    private static final Map<Character, String> PLAYOFF_ROUNDS = Map.of(
            '1', "First Round",
            '2', "Conference Semifinals",
            '3', "Conference Finals",
            '4', "NBA Finals");

    private static final DateTimeFormatter GAME_LOG_DATE = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMM dd, yyyy")
            .toFormatter(Locale.US);

    // ── Row types ─────────────────────────────────────────────────────────────

    public record StandingsEntry(long teamId, String name, String conference, String division,
                                 int wins, int losses) {
    }

    public record TeamInfo(long teamId, String name, String abbreviation, String conference,
                           String division, int wins, int losses) {
    }

    public record RosterEntry(long teamId, long playerId, String fullName, String jerseyNumber,
                              String position) {
    }

    /** One game assembled from the home and away rows of the league game log. */
    public record ScheduledGame(String gameId, LocalDate gameDate, long homeTeamId, long awayTeamId,
                                Integer homeScore, Integer awayScore, String status,
                                String playoffRound) {

        public boolean isCompleted() {
            return Game.STATUS_COMPLETED.equals(status);
        }
    }

    public record BoxScoreLine(String playerName, PlayerGameStats stats) {
    }

    private record GameLogRow(long teamId, String abbreviation, String gameId, LocalDate gameDate,
                              String matchup, String wl, Integer points) {

        boolean isHome() {
            return matchup.contains(" vs. ");
        }

        boolean isAway() {
            return matchup.contains(" @ ");
        }
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    public List<StandingsEntry> parseStandings(StatsResponse response) {
        List<StandingsEntry> entries = new ArrayList<>();
        for (List<Object> row : rows(response, "Standings")) {
            entries.add(new StandingsEntry(
                    requireLong(row, STANDINGS_TEAM_ID, "TeamID"),
                    joinName(safeString(row, STANDINGS_CITY), safeString(row, STANDINGS_NAME)),
                    emptyToNull(safeString(row, STANDINGS_CONFERENCE)),
                    emptyToNull(safeString(row, STANDINGS_DIVISION)),
                    safeInt(row, STANDINGS_WINS),
                    safeInt(row, STANDINGS_LOSSES)));
        }
        log.debug("Parsed {} standings rows", entries.size());
        return entries;
    }

    public TeamInfo parseTeamInfo(StatsResponse response) {
        List<List<Object>> rows = rows(response, "TeamInfoCommon");
        if (rows.isEmpty()) {
            throw new PermanentDataException("teaminfocommon returned no rows");
        }
        List<Object> row = rows.get(0);
        String abbreviation = safeString(row, INFO_ABBREVIATION);
        if (abbreviation.isBlank()) {
            throw new PermanentDataException("teaminfocommon row has no TEAM_ABBREVIATION");
        }
        return new TeamInfo(
                requireLong(row, INFO_TEAM_ID, "TEAM_ID"),
                joinName(safeString(row, INFO_CITY), safeString(row, INFO_NAME)),
                abbreviation,
                emptyToNull(safeString(row, INFO_CONFERENCE)),
                emptyToNull(safeString(row, INFO_DIVISION)),
                safeInt(row, INFO_WINS),
                safeInt(row, INFO_LOSSES));
    }

    public List<RosterEntry> parseRoster(StatsResponse response) {
        List<RosterEntry> entries = new ArrayList<>();
        for (List<Object> row : rows(response, "CommonTeamRoster")) {
            String name = safeString(row, ROSTER_PLAYER);
            if (name.isBlank()) {
                throw new PermanentDataException("Roster row has no PLAYER name");
            }
            entries.add(new RosterEntry(
                    requireLong(row, ROSTER_TEAM_ID, "TeamID"),
                    requireLong(row, ROSTER_PLAYER_ID, "PLAYER_ID"),
                    name,
                    cleanJersey(safeString(row, ROSTER_NUM)),
                    cleanPosition(safeString(row, ROSTER_POSITION))));
        }
        return entries;
    }

    /**
     * Pair the team rows of a league game log into games, in first-seen order.
     * A game whose opponent row is missing is skipped.
     *
     * @param today date used to tell upcoming games from live ones
     */
    public List<ScheduledGame> parseGameLog(StatsResponse response, LocalDate today) {
        Map<String, List<GameLogRow>> byGame = new LinkedHashMap<>();
        for (List<Object> row : rows(response, "LeagueGameLog")) {
            GameLogRow parsed = new GameLogRow(
                    requireLong(row, LOG_TEAM_ID, "TEAM_ID"),
                    safeString(row, LOG_ABBREVIATION),
                    requireGameId(row, LOG_GAME_ID),
                    parseGameDate(safeString(row, LOG_GAME_DATE)),
                    safeString(row, LOG_MATCHUP),
                    emptyToNull(safeString(row, LOG_WL)),
                    nullableInt(row, LOG_PTS));
            byGame.computeIfAbsent(parsed.gameId(), id -> new ArrayList<>()).add(parsed);
        }

        List<ScheduledGame> games = new ArrayList<>();
        int incomplete = 0;
        for (List<GameLogRow> pair : byGame.values()) {
            GameLogRow home = pair.stream().filter(GameLogRow::isHome).findFirst().orElse(null);
            GameLogRow away = pair.stream().filter(GameLogRow::isAway).findFirst().orElse(null);
            if (home == null || away == null) {
                incomplete++;
                continue;
            }
            games.add(new ScheduledGame(
                    home.gameId(),
                    home.gameDate(),
                    home.teamId(),
                    away.teamId(),
                    home.points(),
                    away.points(),
                    gameStatus(home, away, today),
                    playoffRound(home.gameId())));
        }

        log.info("Parsed game log: {} games, {} without both team rows skipped", games.size(), incomplete);
        return games;
    }

    public List<BoxScoreLine> parseBoxScore(StatsResponse response) {
        StatsResponse.ResultSet resultSet = response.resultSet("PlayerStats")
                .orElseThrow(() -> new PermanentDataException("Box score has no PlayerStats result set"));

        List<BoxScoreLine> lines = new ArrayList<>();
        for (List<Object> row : nonNullRows(resultSet)) {
            PlayerGameStats stats = PlayerGameStats.builder()
                    .gameId(requireGameId(row, BOX_GAME_ID))
                    .teamId(requireLong(row, BOX_TEAM_ID, "TEAM_ID"))
                    .playerId(requireLong(row, BOX_PLAYER_ID, "PLAYER_ID"))
                    .minutes(normaliseMinutes(get(row, BOX_MIN)))
                    .points(safeInt(row, BOX_PTS))
                    .rebounds(safeInt(row, BOX_REB))
                    .assists(safeInt(row, BOX_AST))
                    .steals(safeInt(row, BOX_STL))
                    .blocks(safeInt(row, BOX_BLK))
                    .fgm(safeInt(row, BOX_FGM))
                    .fga(safeInt(row, BOX_FGA))
                    .fgPct(safeDouble(row, BOX_FG_PCT))
                    .tpm(safeInt(row, BOX_FG3M))
                    .tpa(safeInt(row, BOX_FG3A))
                    .tpPct(safeDouble(row, BOX_FG3_PCT))
                    .ftm(safeInt(row, BOX_FTM))
                    .fta(safeInt(row, BOX_FTA))
                    .ftPct(safeDouble(row, BOX_FT_PCT))
                    .turnovers(safeInt(row, BOX_TO))
                    .fouls(safeInt(row, BOX_PF))
                    .plusMinus(safeInt(row, BOX_PLUS_MINUS))
                    .build();
            lines.add(new BoxScoreLine(safeString(row, BOX_PLAYER_NAME), stats));
        }
        return lines;
    }

    // ── Field rules ───────────────────────────────────────────────────────────

    /**
     * Playoff round from a game id: the padded id's third digit is the game type (4 = playoffs)
     * and its eighth digit is the round.
     */
    public static String playoffRound(String gameId) {
        String padded = padGameId(gameId);
        if (padded.length() < 8 || padded.charAt(2) != '4') {
            return null;
        }
        return PLAYOFF_ROUNDS.get(padded.charAt(7));
    }

    public static String padGameId(String gameId) {
        if (gameId == null) {
            return "";
        }
        String trimmed = gameId.trim();
        return trimmed.length() >= 10 ? trimmed : "0".repeat(10 - trimmed.length()) + trimmed;
    }

    public static String cleanPosition(String raw) {
        if (raw == null) return null;
        String position = raw.trim().toUpperCase(Locale.ROOT);
        return VALID_POSITIONS.contains(position) ? position : null;
    }

    public static String cleanJersey(String raw) {
        if (raw == null) return null;
        String digits = raw.replaceAll("\\D", "");
        return digits.isEmpty() ? null : digits;
    }

    /**
     * Minutes as "MM:SS". Accepts "34:12", "34.000000:12", plain decimal minutes or nothing.
     */
    public static String normaliseMinutes(Object raw) {
        if (raw == null) return "00:00";
        String value = raw.toString().trim();
        if (value.isEmpty()) return "00:00";

        int minutes;
        int seconds;
        try {
            int colon = value.indexOf(':');
            if (colon >= 0) {
                minutes = (int) Double.parseDouble(value.substring(0, colon));
                seconds = (int) Double.parseDouble(value.substring(colon + 1));
            } else {
                double decimal = Double.parseDouble(value);
                minutes = (int) decimal;
                seconds = (int) Math.round((decimal - minutes) * 60);
                if (seconds == 60) {
                    minutes++;
                    seconds = 0;
                }
            }
        } catch (NumberFormatException e) {
            return "00:00";
        }
        return String.format("%02d:%02d", Math.max(0, minutes), Math.max(0, Math.min(59, seconds)));
    }

    private static String gameStatus(GameLogRow home, GameLogRow away, LocalDate today) {
        if (home.wl() != null && away.wl() != null && home.points() != null && away.points() != null) {
            return Game.STATUS_COMPLETED;
        }
        if (home.gameDate().isAfter(today)) {
            return Game.STATUS_UPCOMING;
        }
        return Game.STATUS_LIVE;
    }

    private static LocalDate parseGameDate(String value) {
        if (value.isBlank()) {
            throw new PermanentDataException("Game log row has no GAME_DATE");
        }
        String trimmed = value.length() >= 10 && value.charAt(4) == '-' ? value.substring(0, 10) : value;
        try {
            return LocalDate.parse(trimmed);
        } catch (DateTimeParseException iso) {
            try {
                return LocalDate.parse(value, GAME_LOG_DATE);
            } catch (DateTimeParseException e) {
                throw new PermanentDataException("Unparseable GAME_DATE: " + value, e);
            }
        }
    }

    // ── Row access ────────────────────────────────────────────────────────────

    private List<List<Object>> rows(StatsResponse response, String resultSetName) {
        StatsResponse.ResultSet resultSet = response.resultSet(resultSetName)
                .or(response::primaryResultSet)
                .orElseThrow(() -> new PermanentDataException("Response has no result sets"));
        return nonNullRows(resultSet);
    }

    private List<List<Object>> nonNullRows(StatsResponse.ResultSet resultSet) {
        if (resultSet.getRowSet() == null) return List.of();
        return resultSet.getRowSet().stream().filter(r -> r != null).toList();
    }

    private static Object get(List<Object> row, int idx) {
        return idx < row.size() ? row.get(idx) : null;
    }

    private static String safeString(List<Object> row, int idx) {
        Object value = get(row, idx);
        return value == null ? "" : value.toString().trim();
    }

    private static long requireLong(List<Object> row, int idx, String column) {
        Object value = get(row, idx);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value != null) {
            try {
                return Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new PermanentDataException("Malformed " + column + ": " + value, e);
            }
        }
        throw new PermanentDataException("Missing " + column + " at column " + idx);
    }

    private static String requireGameId(List<Object> row, int idx) {
        String value = safeString(row, idx);
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            throw new PermanentDataException("Malformed GAME_ID: '" + value + "'");
        }
        return padGameId(value);
    }

    private static Integer nullableInt(List<Object> row, int idx) {
        Object value = get(row, idx);
        if (value == null || value.toString().isBlank()) return null;
        return safeInt(row, idx);
    }

    private static int safeInt(List<Object> row, int idx) {
        Object value = get(row, idx);
        if (value == null) return 0;
        if (value instanceof Number number) return number.intValue();
        String text = value.toString().trim();
        try { return Integer.parseInt(text); }
        catch (NumberFormatException e) {
            try { return (int) Double.parseDouble(text); }
            catch (NumberFormatException e2) { return 0; }
        }
    }

    private static double safeDouble(List<Object> row, int idx) {
        Object value = get(row, idx);
        if (value == null) return 0.0;
        if (value instanceof Number number) return number.doubleValue();
        try { return Double.parseDouble(value.toString().trim()); }
        catch (NumberFormatException e) { return 0.0; }
    }

    private static String joinName(String city, String name) {
        String joined = (city + " " + name).trim();
        if (joined.isEmpty()) {
            throw new PermanentDataException("Team row has neither city nor name");
        }
        return joined;
    }

    private static String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
