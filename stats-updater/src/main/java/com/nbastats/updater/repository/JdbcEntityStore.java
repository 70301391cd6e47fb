package com.nbastats.updater.repository;

import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.Player;
import com.nbastats.updater.model.PlayerGameStats;
import com.nbastats.updater.model.Team;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of {@link EntityStore}; saves are INSERT ... ON CONFLICT DO UPDATE.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcEntityStore implements EntityStore {

    private static final String PREVIOUS_SEASON_FILTER =
            "season_year < ? OR (season_year = ? AND playoff_round IS NULL)";

    private final JdbcTemplate jdbcTemplate;

    // ── Teams ────────────────────────────────────────────────────────────────

    @Override
    public Optional<Team> findTeam(long teamId) {
        return jdbcTemplate.query("SELECT * FROM teams WHERE team_id = ?", this::mapTeam, teamId)
                .stream().findFirst();
    }

    @Override
    public List<Long> findAllTeamIds() {
        return jdbcTemplate.queryForList("SELECT team_id FROM teams ORDER BY team_id", Long.class);
    }

    @Override
    public void saveTeam(Team t) {
        jdbcTemplate.update("""
                INSERT INTO teams (team_id, name, abbreviation, conference, division, wins, losses,
                                   logo_url, is_active, last_updated)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (team_id) DO UPDATE SET
                    name = EXCLUDED.name,
                    abbreviation = EXCLUDED.abbreviation,
                    conference = EXCLUDED.conference,
                    division = EXCLUDED.division,
                    wins = EXCLUDED.wins,
                    losses = EXCLUDED.losses,
                    logo_url = EXCLUDED.logo_url,
                    is_active = EXCLUDED.is_active,
                    last_updated = EXCLUDED.last_updated
                """,
                t.getTeamId(), t.getName(), t.getAbbreviation(), t.getConference(), t.getDivision(),
                t.getWins(), t.getLosses(), t.getLogoUrl(), t.isActive(), toTimestamp(t.getLastUpdated()));
    }

    // ── Players ──────────────────────────────────────────────────────────────

    @Override
    public Optional<Player> findPlayer(long playerId) {
        return jdbcTemplate.query("SELECT * FROM players WHERE player_id = ?", this::mapPlayer, playerId)
                .stream().findFirst();
    }

    @Override
    public void savePlayer(Player p) {
        jdbcTemplate.update("""
                INSERT INTO players (player_id, full_name, first_name, last_name, position, jersey_number,
                                     current_team_id, previous_team_id, traded_date, headshot_url,
                                     is_active, last_updated)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (player_id) DO UPDATE SET
                    full_name = EXCLUDED.full_name,
                    first_name = EXCLUDED.first_name,
                    last_name = EXCLUDED.last_name,
                    position = EXCLUDED.position,
                    jersey_number = EXCLUDED.jersey_number,
                    current_team_id = EXCLUDED.current_team_id,
                    previous_team_id = EXCLUDED.previous_team_id,
                    traded_date = EXCLUDED.traded_date,
                    headshot_url = EXCLUDED.headshot_url,
                    is_active = EXCLUDED.is_active,
                    last_updated = EXCLUDED.last_updated
                """,
                p.getPlayerId(), p.getFullName(), p.getFirstName(), p.getLastName(), p.getPosition(),
                p.getJerseyNumber(), p.getCurrentTeamId(), p.getPreviousTeamId(),
                toTimestamp(p.getTradedDate()), p.getHeadshotUrl(), p.isActive(),
                toTimestamp(p.getLastUpdated()));
    }

    // ── Games ────────────────────────────────────────────────────────────────

    @Override
    public Optional<Game> findGame(String gameId) {
        return jdbcTemplate.query("SELECT * FROM games WHERE game_id = ?", this::mapGame, gameId)
                .stream().findFirst();
    }

    @Override
    public void saveGame(Game g) {
        jdbcTemplate.update("""
                INSERT INTO games (game_id, game_date, home_team_id, away_team_id, home_score, away_score,
                                   season_year, playoff_round, status, is_loaded, last_updated)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (game_id) DO UPDATE SET
                    game_date = EXCLUDED.game_date,
                    home_team_id = EXCLUDED.home_team_id,
                    away_team_id = EXCLUDED.away_team_id,
                    home_score = EXCLUDED.home_score,
                    away_score = EXCLUDED.away_score,
                    season_year = EXCLUDED.season_year,
                    playoff_round = EXCLUDED.playoff_round,
                    status = EXCLUDED.status,
                    is_loaded = EXCLUDED.is_loaded,
                    last_updated = EXCLUDED.last_updated
                """,
                g.getGameId(), g.getGameDate() != null ? Date.valueOf(g.getGameDate()) : null,
                g.getHomeTeamId(), g.getAwayTeamId(), g.getHomeScore(), g.getAwayScore(),
                g.getSeasonYear(), g.getPlayoffRound(), g.getStatus(), g.isLoaded(),
                toTimestamp(g.getLastUpdated()));
    }

    @Override
    public int deleteGamesBefore(String previousSeason) {
        int stats = jdbcTemplate.update(
                "DELETE FROM player_game_stats WHERE game_id IN (SELECT game_id FROM games WHERE "
                        + PREVIOUS_SEASON_FILTER + ")",
                previousSeason, previousSeason);
        int games = jdbcTemplate.update("DELETE FROM games WHERE " + PREVIOUS_SEASON_FILTER,
                previousSeason, previousSeason);
        log.info("Deleted {} games and {} stat lines older than {}", games, stats, previousSeason);
        return games;
    }

    // ── Player game stats ────────────────────────────────────────────────────

    @Override
    public Optional<PlayerGameStats> findPlayerGameStats(long playerId, String gameId, long teamId) {
        return jdbcTemplate.query(
                "SELECT * FROM player_game_stats WHERE player_id = ? AND game_id = ? AND team_id = ?",
                this::mapStats, playerId, gameId, teamId).stream().findFirst();
    }

    @Override
    public void savePlayerGameStats(PlayerGameStats s) {
        jdbcTemplate.update("""
                INSERT INTO player_game_stats
                (player_id, game_id, team_id, minutes, points, rebounds, assists, steals, blocks,
                 fgm, fga, fg_pct, tpm, tpa, tp_pct, ftm, fta, ft_pct, turnovers, fouls, plus_minus,
                 last_updated)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (player_id, game_id, team_id) DO UPDATE SET
                    minutes = EXCLUDED.minutes,
                    points = EXCLUDED.points,
                    rebounds = EXCLUDED.rebounds,
                    assists = EXCLUDED.assists,
                    steals = EXCLUDED.steals,
                    blocks = EXCLUDED.blocks,
                    fgm = EXCLUDED.fgm,
                    fga = EXCLUDED.fga,
                    fg_pct = EXCLUDED.fg_pct,
                    tpm = EXCLUDED.tpm,
                    tpa = EXCLUDED.tpa,
                    tp_pct = EXCLUDED.tp_pct,
                    ftm = EXCLUDED.ftm,
                    fta = EXCLUDED.fta,
                    ft_pct = EXCLUDED.ft_pct,
                    turnovers = EXCLUDED.turnovers,
                    fouls = EXCLUDED.fouls,
                    plus_minus = EXCLUDED.plus_minus,
                    last_updated = EXCLUDED.last_updated
                """,
                s.getPlayerId(), s.getGameId(), s.getTeamId(), s.getMinutes(), s.getPoints(),
                s.getRebounds(), s.getAssists(), s.getSteals(), s.getBlocks(), s.getFgm(), s.getFga(),
                s.getFgPct(), s.getTpm(), s.getTpa(), s.getTpPct(), s.getFtm(), s.getFta(), s.getFtPct(),
                s.getTurnovers(), s.getFouls(), s.getPlusMinus(), toTimestamp(s.getLastUpdated()));
    }

    @Override
    public int countPlayerGameStats(String gameId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM player_game_stats WHERE game_id = ?", Integer.class, gameId);
        return count != null ? count : 0;
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    private Team mapTeam(ResultSet rs, int rowNum) throws SQLException {
        return Team.builder()
                .teamId(rs.getLong("team_id"))
                .name(rs.getString("name"))
                .abbreviation(rs.getString("abbreviation"))
                .conference(rs.getString("conference"))
                .division(rs.getString("division"))
                .wins(rs.getObject("wins", Integer.class))
                .losses(rs.getObject("losses", Integer.class))
                .logoUrl(rs.getString("logo_url"))
                .active(rs.getBoolean("is_active"))
                .lastUpdated(toInstant(rs.getTimestamp("last_updated")))
                .build();
    }

    private Player mapPlayer(ResultSet rs, int rowNum) throws SQLException {
        return Player.builder()
                .playerId(rs.getLong("player_id"))
                .fullName(rs.getString("full_name"))
                .firstName(rs.getString("first_name"))
                .lastName(rs.getString("last_name"))
                .position(rs.getString("position"))
                .jerseyNumber(rs.getString("jersey_number"))
                .currentTeamId(rs.getObject("current_team_id", Long.class))
                .previousTeamId(rs.getObject("previous_team_id", Long.class))
                .tradedDate(toInstant(rs.getTimestamp("traded_date")))
                .headshotUrl(rs.getString("headshot_url"))
                .active(rs.getBoolean("is_active"))
                .lastUpdated(toInstant(rs.getTimestamp("last_updated")))
                .build();
    }

    private Game mapGame(ResultSet rs, int rowNum) throws SQLException {
        Date gameDate = rs.getDate("game_date");
        return Game.builder()
                .gameId(rs.getString("game_id"))
                .gameDate(gameDate != null ? gameDate.toLocalDate() : null)
                .homeTeamId(rs.getLong("home_team_id"))
                .awayTeamId(rs.getLong("away_team_id"))
                .homeScore(rs.getObject("home_score", Integer.class))
                .awayScore(rs.getObject("away_score", Integer.class))
                .seasonYear(rs.getString("season_year"))
                .playoffRound(rs.getString("playoff_round"))
                .status(rs.getString("status"))
                .loaded(rs.getBoolean("is_loaded"))
                .lastUpdated(toInstant(rs.getTimestamp("last_updated")))
                .build();
    }

    private PlayerGameStats mapStats(ResultSet rs, int rowNum) throws SQLException {
        return PlayerGameStats.builder()
                .playerId(rs.getLong("player_id"))
                .gameId(rs.getString("game_id"))
                .teamId(rs.getLong("team_id"))
                .minutes(rs.getString("minutes"))
                .points(rs.getInt("points"))
                .rebounds(rs.getInt("rebounds"))
                .assists(rs.getInt("assists"))
                .steals(rs.getInt("steals"))
                .blocks(rs.getInt("blocks"))
                .fgm(rs.getInt("fgm"))
                .fga(rs.getInt("fga"))
                .fgPct(rs.getDouble("fg_pct"))
                .tpm(rs.getInt("tpm"))
                .tpa(rs.getInt("tpa"))
                .tpPct(rs.getDouble("tp_pct"))
                .ftm(rs.getInt("ftm"))
                .fta(rs.getInt("fta"))
                .ftPct(rs.getDouble("ft_pct"))
                .turnovers(rs.getInt("turnovers"))
                .fouls(rs.getInt("fouls"))
                .plusMinus(rs.getInt("plus_minus"))
                .lastUpdated(toInstant(rs.getTimestamp("last_updated")))
                .build();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
