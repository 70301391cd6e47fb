package com.nbastats.updater.service;

import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.Player;
import com.nbastats.updater.model.PlayerGameStats;
import com.nbastats.updater.model.Team;
import com.nbastats.updater.repository.EntityStore;
import com.nbastats.updater.service.StatsPayloadParser.BoxScoreLine;
import com.nbastats.updater.service.StatsPayloadParser.RosterEntry;
import com.nbastats.updater.service.StatsPayloadParser.ScheduledGame;
import com.nbastats.updater.service.StatsPayloadParser.StandingsEntry;
import com.nbastats.updater.service.StatsPayloadParser.TeamInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Writes parsed rows into the entity store.
 * Every write looks the entity up by its natural key, creates it if absent, then overwrites
 * its fields, so re-running a unit leaves the same rows behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StatsUpserter {

    static final String LOGO_URL = "https://cdn.nba.com/logos/nba/%d/global/L/logo.svg";
    static final String HEADSHOT_URL = "https://cdn.nba.com/headshots/nba/latest/1040x760/%d.png";

    private final EntityStore store;
    private final Clock clock;

    public Team upsertTeam(TeamInfo info, StandingsEntry standings) {
        Team team = store.findTeam(info.teamId()).orElseGet(() -> Team.builder().teamId(info.teamId()).build());

        team.setName(info.name());
        team.setAbbreviation(info.abbreviation());
        team.setConference(firstNonNull(info.conference(), standings != null ? standings.conference() : null));
        team.setDivision(firstNonNull(info.division(), standings != null ? standings.division() : null));
        // standings carry the live record; team info can lag a day behind
        team.setWins(standings != null ? standings.wins() : info.wins());
        team.setLosses(standings != null ? standings.losses() : info.losses());
        team.setLogoUrl(String.format(LOGO_URL, info.teamId()));
        team.setActive(true);
        team.setLastUpdated(clock.instant());

        store.saveTeam(team);
        return team;
    }

    /**
     * Upsert a roster player. A player whose stored team differs from the roster's team is
     * recorded as traded: the old team becomes {@code previousTeamId}.
     */
    public Player upsertRosterPlayer(RosterEntry entry) {
        Instant now = clock.instant();
        Player player = store.findPlayer(entry.playerId())
                .orElseGet(() -> Player.builder().playerId(entry.playerId()).build());

        Long oldTeamId = player.getCurrentTeamId();
        if (oldTeamId != null && oldTeamId != entry.teamId()) {
            log.info("Player {} ({}) moved from team {} to {}", entry.playerId(), entry.fullName(),
                    oldTeamId, entry.teamId());
            player.setPreviousTeamId(oldTeamId);
            player.setTradedDate(now);
        }

        applyName(player, entry.fullName());
        player.setPosition(entry.position());
        player.setJerseyNumber(entry.jerseyNumber());
        player.setCurrentTeamId(entry.teamId());
        player.setHeadshotUrl(String.format(HEADSHOT_URL, entry.playerId()));
        player.setActive(true);
        player.setLastUpdated(now);

        store.savePlayer(player);
        return player;
    }

    /**
     * Upsert a game from the league game log. The loaded flag is kept from the stored row.
     */
    public Game upsertGame(ScheduledGame scheduled, String season) {
        Game game = store.findGame(scheduled.gameId())
                .orElseGet(() -> Game.builder().gameId(scheduled.gameId()).build());

        game.setGameDate(scheduled.gameDate());
        game.setHomeTeamId(scheduled.homeTeamId());
        game.setAwayTeamId(scheduled.awayTeamId());
        game.setHomeScore(scheduled.homeScore());
        game.setAwayScore(scheduled.awayScore());
        game.setSeasonYear(season);
        game.setPlayoffRound(scheduled.playoffRound());
        game.setStatus(scheduled.status());
        game.setLastUpdated(clock.instant());

        store.saveGame(game);
        return game;
    }

    /**
     * Upsert one box score line, creating a minimal player first when the id is unknown.
     */
    public PlayerGameStats upsertBoxScoreLine(BoxScoreLine line) {
        PlayerGameStats parsed = line.stats();
        ensurePlayer(parsed.getPlayerId(), line.playerName(), parsed.getTeamId());

        PlayerGameStats stats = store.findPlayerGameStats(parsed.getPlayerId(), parsed.getGameId(), parsed.getTeamId())
                .orElseGet(PlayerGameStats::new);

        stats.setPlayerId(parsed.getPlayerId());
        stats.setGameId(parsed.getGameId());
        stats.setTeamId(parsed.getTeamId());
        stats.setMinutes(parsed.getMinutes());
        stats.setPoints(parsed.getPoints());
        stats.setRebounds(parsed.getRebounds());
        stats.setAssists(parsed.getAssists());
        stats.setSteals(parsed.getSteals());
        stats.setBlocks(parsed.getBlocks());
        stats.setFgm(parsed.getFgm());
        stats.setFga(parsed.getFga());
        stats.setFgPct(parsed.getFgPct());
        stats.setTpm(parsed.getTpm());
        stats.setTpa(parsed.getTpa());
        stats.setTpPct(parsed.getTpPct());
        stats.setFtm(parsed.getFtm());
        stats.setFta(parsed.getFta());
        stats.setFtPct(parsed.getFtPct());
        stats.setTurnovers(parsed.getTurnovers());
        stats.setFouls(parsed.getFouls());
        stats.setPlusMinus(parsed.getPlusMinus());
        stats.setLastUpdated(clock.instant());

        store.savePlayerGameStats(stats);
        return stats;
    }

    public void markLoaded(Game game) {
        game.setLoaded(true);
        game.setLastUpdated(clock.instant());
        store.saveGame(game);
    }

    private void ensurePlayer(long playerId, String name, long teamId) {
        if (store.findPlayer(playerId).isPresent()) {
            return;
        }
        Player player = Player.builder()
                .playerId(playerId)
                .currentTeamId(teamId)
                .headshotUrl(String.format(HEADSHOT_URL, playerId))
                .active(true)
                .lastUpdated(clock.instant())
                .build();
        applyName(player, name == null || name.isBlank() ? "Player " + playerId : name);
        store.savePlayer(player);
        log.info("Created player {} ({}) from box score", playerId, player.getFullName());
    }

    static void applyName(Player player, String fullName) {
        String name = fullName.trim();
        int space = name.indexOf(' ');
        player.setFullName(name);
        player.setFirstName(space > 0 ? name.substring(0, space) : name);
        player.setLastName(space > 0 ? name.substring(space + 1).trim() : "");
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
