package com.nbastats.updater.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS teams
            (
                team_id             BIGINT PRIMARY KEY,
                name                VARCHAR(128) NOT NULL,
                abbreviation        VARCHAR(8)   NOT NULL,
                conference          VARCHAR(32),
                division            VARCHAR(32),
                wins                INTEGER DEFAULT 0,
                losses              INTEGER DEFAULT 0,
                logo_url            TEXT,
                is_active           BOOLEAN NOT NULL DEFAULT TRUE,
                last_updated        TIMESTAMPTZ
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS players
            (
                player_id           BIGINT PRIMARY KEY,
                full_name           VARCHAR(128),
                first_name          VARCHAR(64),
                last_name           VARCHAR(64),
                position            VARCHAR(8),
                jersey_number       VARCHAR(8),
                current_team_id     BIGINT REFERENCES teams (team_id),
                previous_team_id    BIGINT REFERENCES teams (team_id),
                traded_date         TIMESTAMPTZ,
                headshot_url        TEXT,
                is_active           BOOLEAN NOT NULL DEFAULT TRUE,
                last_updated        TIMESTAMPTZ
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS games
            (
                game_id             VARCHAR(16) PRIMARY KEY,
                game_date           DATE        NOT NULL,
                home_team_id        BIGINT      NOT NULL REFERENCES teams (team_id),
                away_team_id        BIGINT      NOT NULL REFERENCES teams (team_id),
                home_score          INTEGER,
                away_score          INTEGER,
                season_year         VARCHAR(8),
                playoff_round       VARCHAR(32),
                status              VARCHAR(16) NOT NULL,
                is_loaded           BOOLEAN     NOT NULL DEFAULT FALSE,
                last_updated        TIMESTAMPTZ
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS player_game_stats
            (
                stat_id             BIGSERIAL PRIMARY KEY,
                player_id           BIGINT      NOT NULL REFERENCES players (player_id),
                game_id             VARCHAR(16) NOT NULL REFERENCES games (game_id),
                team_id             BIGINT      NOT NULL REFERENCES teams (team_id),
                minutes             VARCHAR(8),
                points              INTEGER,
                rebounds            INTEGER,
                assists             INTEGER,
                steals              INTEGER,
                blocks              INTEGER,
                fgm                 INTEGER,
                fga                 INTEGER,
                fg_pct              DOUBLE PRECISION,
                tpm                 INTEGER,
                tpa                 INTEGER,
                tp_pct              DOUBLE PRECISION,
                ftm                 INTEGER,
                fta                 INTEGER,
                ft_pct              DOUBLE PRECISION,
                turnovers           INTEGER,
                fouls               INTEGER,
                plus_minus          INTEGER,
                last_updated        TIMESTAMPTZ,
                CONSTRAINT unique_player_game_stats UNIQUE (player_id, game_id, team_id)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS update_status
            (
                id                      INTEGER PRIMARY KEY,
                is_updating             BOOLEAN NOT NULL DEFAULT FALSE,
                cancellation_requested  BOOLEAN NOT NULL DEFAULT FALSE,
                current_phase           VARCHAR(16),
                current_detail          TEXT,
                last_error              TEXT,
                last_error_time         TIMESTAMPTZ,
                last_successful_update  TIMESTAMPTZ,
                next_scheduled_update   TIMESTAMPTZ,
                pending_phases          VARCHAR(64),
                phase_state             TEXT
            )
        """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_games_season ON games (season_year)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_stats_game ON player_game_stats (game_id)");

        log.info("Database schema ready.");
    }
}
