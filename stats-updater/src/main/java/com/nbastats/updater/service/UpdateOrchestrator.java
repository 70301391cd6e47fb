package com.nbastats.updater.service;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.PermanentDataException;
import com.nbastats.updater.exception.TaskCancelledException;
import com.nbastats.updater.model.Game;
import com.nbastats.updater.model.Phase;
import com.nbastats.updater.repository.EntityStore;
import com.nbastats.updater.service.StatsPayloadParser.BoxScoreLine;
import com.nbastats.updater.service.StatsPayloadParser.RosterEntry;
import com.nbastats.updater.service.StatsPayloadParser.ScheduledGame;
import com.nbastats.updater.service.StatsPayloadParser.StandingsEntry;
import com.nbastats.updater.service.StatsPayloadParser.TeamInfo;
import com.nbastats.updater.task.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Runs the ingestion pipeline: teams, then players, then games.
 *
 * Each phase plans its work units up front, then runs them one at a time. Between units the
 * cancellation token is checked. A unit fetches from the provider, upserts what it got and
 * reports progress. The first failure records an error on the phase and stops the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UpdateOrchestrator {

    static final String LEAGUE_ID = "00";
    static final String REGULAR_SEASON = "Regular Season";

    private final NbaStatsClient client;
    private final StatsPayloadParser parser;
    private final StatsUpserter upserter;
    private final EntityStore store;
    private final UpdateStatusService statusService;
    private final SeasonCalendar calendar;
    private final StatsUpdaterProperties properties;

    public enum Outcome { COMPLETED, FAILED, CANCELLED }

    /** Receives per-unit progress, e.g. to mirror it onto a background task. */
    @FunctionalInterface
    public interface ProgressListener {
        ProgressListener NONE = (phase, processed, total) -> { };

        void onProgress(Phase phase, int processed, int total);
    }

    private record WorkUnit(String label, Runnable action) {
    }

    /**
     * Run {@code phases} in pipeline order, stopping at the first phase that does not complete.
     */
    public Outcome updateAll(Collection<Phase> phases, CancellationToken token, ProgressListener listener) {
        TreeSet<Phase> ordered = new TreeSet<>(phases);
        log.info("Starting update of phases {}", ordered);
        for (Phase phase : ordered) {
            Outcome outcome = runPhase(phase, token, listener);
            if (outcome != Outcome.COMPLETED) {
                log.info("Update stopped after {} phase: {}", phase.key(), outcome);
                return outcome;
            }
        }
        log.info("Update of phases {} complete.", ordered);
        return Outcome.COMPLETED;
    }

    // ── Phase driver ─────────────────────────────────────────────────────────

    private Outcome runPhase(Phase phase, CancellationToken token, ProgressListener listener) {
        statusService.initialize(phase);
        log.info("Starting {} update...", phase.key());

        try {
            token.throwIfCancellationRequested();

            List<WorkUnit> units = plan(phase);
            int total = units.size();
            log.info("{} update: {} work units", phase.displayName(), total);

            for (int i = 0; i < total; i++) {
                token.throwIfCancellationRequested();
                WorkUnit unit = units.get(i);
                log.debug("{} [{}/{}]: {}", phase.displayName(), i + 1, total, unit.label());
                unit.action().run();

                statusService.updateProgress(phase, i + 1, total);
                listener.onProgress(phase, i + 1, total);
            }

            statusService.finalize(phase);
            log.info("{} update complete.", phase.displayName());
            return Outcome.COMPLETED;

        } catch (TaskCancelledException e) {
            return cancelled(phase);
        } catch (RuntimeException e) {
            if (token.isCancellationRequested()) {
                return cancelled(phase);
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} update failed: {}", phase.displayName(), message, e);
            statusService.recordError(phase, message);
            return Outcome.FAILED;
        }
    }

    private Outcome cancelled(Phase phase) {
        statusService.markCancelled(phase);
        return Outcome.CANCELLED;
    }

    private List<WorkUnit> plan(Phase phase) {
        return switch (phase) {
            case TEAMS -> planTeams();
            case PLAYERS -> planPlayers();
            case GAMES -> planGames();
        };
    }

    // ── Teams ────────────────────────────────────────────────────────────────

    private List<WorkUnit> planTeams() {
        String season = calendar.currentSeason();
        List<StandingsEntry> standings = parser.parseStandings(client.fetch(StatsRequest.of("leaguestandingsv3")
                .with("LeagueID", LEAGUE_ID)
                .with("Season", season)
                .with("SeasonType", REGULAR_SEASON)));
        if (standings.isEmpty()) {
            throw new PermanentDataException("Standings for " + season + " list no teams");
        }

        List<WorkUnit> units = new ArrayList<>();
        for (StandingsEntry entry : standings) {
            units.add(new WorkUnit("team " + entry.teamId(), () -> {
                TeamInfo info = parser.parseTeamInfo(client.fetch(StatsRequest.of("teaminfocommon")
                        .with("TeamID", entry.teamId())
                        .with("LeagueID", LEAGUE_ID)
                        .with("Season", season)
                        .with("SeasonType", REGULAR_SEASON)));
                upserter.upsertTeam(info, entry);
            }));
        }
        return units;
    }

    // ── Players ──────────────────────────────────────────────────────────────

    private List<WorkUnit> planPlayers() {
        List<Long> teamIds = store.findAllTeamIds();
        if (teamIds.isEmpty()) {
            throw new PermanentDataException("No teams stored; run the teams update first");
        }
        String season = calendar.currentSeason();

        List<WorkUnit> units = new ArrayList<>();
        for (Long teamId : teamIds) {
            units.add(new WorkUnit("roster of team " + teamId, () -> {
                List<RosterEntry> roster = parser.parseRoster(client.fetch(StatsRequest.of("commonteamroster")
                        .with("TeamID", teamId)
                        .with("LeagueID", LEAGUE_ID)
                        .with("Season", season)));
                roster.forEach(upserter::upsertRosterPlayer);
                log.debug("Team {}: {} roster players", teamId, roster.size());
            }));
        }
        return units;
    }

    // ── Games ────────────────────────────────────────────────────────────────

    private List<WorkUnit> planGames() {
        StatsUpdaterProperties.Ingest ingest = properties.getIngest();
        String season = calendar.currentSeason();
        LocalDate today = calendar.today();

        if (ingest.isCleanupOldSeasons()) {
            int deleted = store.deleteGamesBefore(calendar.previousSeason());
            if (deleted > 0) {
                log.info("Removed {} games from seasons before {}", deleted, calendar.previousSeason());
            }
        }

        Map<String, ScheduledGame> games = new LinkedHashMap<>();
        for (String seasonType : ingest.getSeasonTypes()) {
            List<ScheduledGame> logged = parser.parseGameLog(client.fetch(StatsRequest.of("leaguegamelog")
                    .with("Counter", 0)
                    .with("Direction", "ASC")
                    .with("LeagueID", LEAGUE_ID)
                    .with("PlayerOrTeam", "T")
                    .with("Season", season)
                    .with("SeasonType", seasonType)
                    .with("Sorter", "DATE")), today);
            logged.forEach(g -> games.putIfAbsent(g.gameId(), g));
            log.info("{} {}: {} games", season, seasonType, logged.size());
        }

        List<WorkUnit> units = new ArrayList<>();
        for (ScheduledGame scheduled : games.values()) {
            units.add(new WorkUnit("game " + scheduled.gameId(), () -> processGame(scheduled, season)));
        }
        return units;
    }

    private void processGame(ScheduledGame scheduled, String season) {
        Game game = upserter.upsertGame(scheduled, season);
        if (!scheduled.isCompleted()) {
            return;
        }

        int existing = store.countPlayerGameStats(scheduled.gameId());
        if (existing >= properties.getIngest().getCompleteStatsThreshold()) {
            if (!game.isLoaded()) {
                upserter.markLoaded(game);
            }
            log.debug("Skipping box score for {}: {} stat lines already stored", scheduled.gameId(), existing);
            return;
        }

        List<BoxScoreLine> lines = parser.parseBoxScore(client.fetch(StatsRequest.of("boxscoretraditionalv2")
                .with("GameID", scheduled.gameId())
                .with("StartPeriod", 0)
                .with("EndPeriod", 10)
                .with("StartRange", 0)
                .with("EndRange", 28800)
                .with("RangeType", 0)));
        if (lines.isEmpty()) {
            log.warn("Box score for completed game {} has no player rows", scheduled.gameId());
            return;
        }
        lines.forEach(upserter::upsertBoxScoreLine);
        upserter.markLoaded(game);
        log.debug("Game {}: {} stat lines", scheduled.gameId(), lines.size());
    }
}
