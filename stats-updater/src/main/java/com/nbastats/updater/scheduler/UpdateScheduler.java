package com.nbastats.updater.scheduler;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.UpdateInProgressException;
import com.nbastats.updater.model.Phase;
import com.nbastats.updater.repository.SchemaInitializer;
import com.nbastats.updater.service.UpdateService;
import com.nbastats.updater.service.UpdateStatusService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Manages scheduled and on-startup updates.
 *
 * Default schedule: a full update daily at 06:00 UTC, a games-only update every two hours
 * through the evening when games finish, and a weekly deep update on Sunday at 04:00 UTC.
 * Override with the stats-updater.scheduling.* properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UpdateScheduler {

    private final UpdateService updateService;
    private final UpdateStatusService statusService;
    private final SchemaInitializer schemaInitializer;
    private final StatsUpdaterProperties properties;
    private final Clock clock;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Clear an updating flag left behind by a crashed process
     *  3. Optionally run a full update if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            schemaInitializer.ensureSchema();
            if (statusService.clearStaleUpdate()) {
                log.warn("Previous update did not finish; status reset");
            }
            recordNextRun();
        } catch (Exception e) {
            log.warn("Could not prepare update status (database unavailable?): {}", e.getMessage());
            return;
        }

        StatsUpdaterProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, triggering full update");
            trigger(Phase.all(), "startup");
        } else if (scheduling.isEnabled()) {
            log.info("Updater ready. Full update: {}, games update: {}, weekly update: {}",
                    scheduling.getFullUpdateCron(), scheduling.getGamesUpdateCron(),
                    scheduling.getWeeklyUpdateCron());
        } else {
            log.info("Updater ready. Scheduled updates disabled");
        }
    }

    @Scheduled(cron = "${stats-updater.scheduling.full-update-cron:0 0 6 * * *}", zone = "UTC")
    public void scheduledFullUpdate() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled full update triggered");
        trigger(Phase.all(), "scheduled full");
    }

    @Scheduled(cron = "${stats-updater.scheduling.games-update-cron:0 0 0,2,10,12,14,16,18,20,22 * * *}", zone = "UTC")
    public void scheduledGamesUpdate() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled games update triggered");
        trigger(EnumSet.of(Phase.GAMES), "scheduled games");
    }

    /**
     * Weekly deep update. The games phase drops games from seasons before the previous one
     * (ingest.cleanup-old-seasons), so a full run covers the cleanup as well.
     */
    @Scheduled(cron = "${stats-updater.scheduling.weekly-update-cron:0 0 4 * * SUN}", zone = "UTC")
    public void scheduledWeeklyUpdate() {
        if (!properties.getScheduling().isEnabled()) {
            return;
        }
        log.info("Scheduled weekly deep update triggered");
        trigger(Phase.all(), "scheduled weekly");
    }

    /**
     * Earliest next firing of any schedule, or null when scheduling is disabled.
     */
    public Instant nextRun() {
        StatsUpdaterProperties.Scheduling scheduling = properties.getScheduling();
        if (!scheduling.isEnabled()) {
            return null;
        }
        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
        return Stream.of(scheduling.getFullUpdateCron(), scheduling.getGamesUpdateCron(),
                        scheduling.getWeeklyUpdateCron())
                .map(cron -> CronExpression.parse(cron).next(now))
                .filter(next -> next != null)
                .map(ZonedDateTime::toInstant)
                .min(Instant::compareTo)
                .orElse(null);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void trigger(Set<Phase> phases, String reason) {
        try {
            String taskId = updateService.triggerUpdate(phases);
            log.info("{} update started as task {}", reason, taskId);
        } catch (UpdateInProgressException e) {
            log.info("Skipping {} update: {}", reason, e.getMessage());
        } catch (Exception e) {
            log.error("{} update could not be started: {}", reason, e.getMessage(), e);
        } finally {
            recordNextRun();
        }
    }

    private void recordNextRun() {
        try {
            statusService.recordScheduledUpdate(nextRun());
        } catch (Exception e) {
            log.warn("Could not record next scheduled update: {}", e.getMessage());
        }
    }
}
