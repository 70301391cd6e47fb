package com.nbastats.updater.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "stats-updater")
@Data
public class StatsUpdaterProperties {

    private Api api = new Api();
    private Tasks tasks = new Tasks();
    private Scheduling scheduling = new Scheduling();
    private Ingest ingest = new Ingest();

    @Data
    public static class Api {
        private String baseUrl = "https://stats.nba.com/stats";
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36";
        private String referer = "https://www.nba.com/";
        private int connectTimeoutMs = 60_000;
        private int readTimeoutMs = 120_000;
        /** Upper bound for one attempt, including the worker hand-off. */
        private long requestTimeoutMs = 180_000;
        /** Slept before the first attempt of every fetch; the provider's global budget. */
        private long minRequestDelayMs = 2_000;
        private int maxAttempts = 3;
        private long backoffBaseMs = 2_000;
        private long maxBackoffMs = 30_000;
        private long rateLimitJitterMinMs = 1_000;
        private long rateLimitJitterMaxMs = 3_000;
        private long transientJitterMaxMs = 1_000;
        private int fetchPoolSize = 2;
    }

    @Data
    public static class Tasks {
        private int maxFinishedTasks = 50;
        private long cleanupIntervalMs = 300_000;
        private long cancelTimeoutMs = 30_000;
        private int poolSize = 2;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private String fullUpdateCron = "0 0 6 * * *";
        private String gamesUpdateCron = "0 0 0,2,10,12,14,16,18,20,22 * * *";
        /** Weekly deep update: old-season cleanup followed by every phase. */
        private String weeklyUpdateCron = "0 0 4 * * SUN";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Ingest {
        /** Season override such as "2023-24"; derived from today's date when blank. */
        private String season;
        private List<String> seasonTypes = new ArrayList<>(List.of("Regular Season", "Playoffs"));
        private boolean cleanupOldSeasons = true;
        /** A completed game with at least this many stat rows is not re-fetched. */
        private int completeStatsThreshold = 20;
    }
}
