package com.nbastats.updater.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nbastats.updater.model.Phase;
import com.nbastats.updater.model.PhaseStatus;
import com.nbastats.updater.model.UpdateStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keeps the update status in a single row of update_status.
 * Per-phase state is stored as a JSON object keyed by phase name.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcUpdateStatusRepository implements UpdateStatusRepository {

    private static final TypeReference<Map<String, PhaseStatus>> PHASE_MAP = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public UpdateStatus read() {
        List<UpdateStatus> rows = jdbcTemplate.query(
                "SELECT * FROM update_status WHERE id = ?", this::mapRow, UpdateStatus.SINGLETON_ID);
        if (!rows.isEmpty()) {
            return rows.get(0);
        }

        log.warn("update_status row {} missing, creating it", UpdateStatus.SINGLETON_ID);
        UpdateStatus initial = UpdateStatus.initial();
        jdbcTemplate.update("""
                INSERT INTO update_status (id, is_updating, cancellation_requested, pending_phases, phase_state)
                VALUES (?, FALSE, FALSE, '', ?)
                ON CONFLICT (id) DO NOTHING
                """, UpdateStatus.SINGLETON_ID, writePhases(initial.getPhases()));

        return jdbcTemplate.query("SELECT * FROM update_status WHERE id = ?", this::mapRow, UpdateStatus.SINGLETON_ID)
                .stream()
                .findFirst()
                .orElse(initial);
    }

    @Override
    public void write(UpdateStatus status) {
        jdbcTemplate.update("""
                INSERT INTO update_status
                (id, is_updating, cancellation_requested, current_phase, current_detail, last_error,
                 last_error_time, last_successful_update, next_scheduled_update, pending_phases, phase_state)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    is_updating = EXCLUDED.is_updating,
                    cancellation_requested = EXCLUDED.cancellation_requested,
                    current_phase = EXCLUDED.current_phase,
                    current_detail = EXCLUDED.current_detail,
                    last_error = EXCLUDED.last_error,
                    last_error_time = EXCLUDED.last_error_time,
                    last_successful_update = EXCLUDED.last_successful_update,
                    next_scheduled_update = EXCLUDED.next_scheduled_update,
                    pending_phases = EXCLUDED.pending_phases,
                    phase_state = EXCLUDED.phase_state
                """,
                UpdateStatus.SINGLETON_ID,
                status.isUpdating(),
                status.isCancellationRequested(),
                status.getCurrentPhase() != null ? status.getCurrentPhase().key() : null,
                status.getCurrentDetail(),
                status.getLastError(),
                toTimestamp(status.getLastErrorTime()),
                toTimestamp(status.getLastSuccessfulUpdate()),
                toTimestamp(status.getNextScheduledUpdate()),
                status.getPendingPhases().stream().map(Phase::key).collect(Collectors.joining(",")),
                writePhases(status.getPhases()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private UpdateStatus mapRow(ResultSet rs, int rowNum) throws SQLException {
        String currentPhase = rs.getString("current_phase");
        UpdateStatus status = UpdateStatus.builder()
                .updating(rs.getBoolean("is_updating"))
                .cancellationRequested(rs.getBoolean("cancellation_requested"))
                .currentPhase(currentPhase != null ? Phase.fromKey(currentPhase) : null)
                .currentDetail(rs.getString("current_detail"))
                .lastError(rs.getString("last_error"))
                .lastErrorTime(toInstant(rs.getTimestamp("last_error_time")))
                .lastSuccessfulUpdate(toInstant(rs.getTimestamp("last_successful_update")))
                .nextScheduledUpdate(toInstant(rs.getTimestamp("next_scheduled_update")))
                .pendingPhases(readPendingPhases(rs.getString("pending_phases")))
                .build();
        readPhases(rs.getString("phase_state")).forEach((phase, state) -> status.getPhases().put(phase, state));
        return status;
    }

    private List<Phase> readPendingPhases(String csv) {
        if (csv == null || csv.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(csv.split(","))
                .map(Phase::fromKey)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private Map<Phase, PhaseStatus> readPhases(String json) {
        Map<Phase, PhaseStatus> phases = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return phases;
        }
        try {
            objectMapper.readValue(json, PHASE_MAP)
                    .forEach((key, state) -> phases.put(Phase.fromKey(key), state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt phase_state in update_status: " + e.getMessage(), e);
        }
        return phases;
    }

    private String writePhases(Map<Phase, PhaseStatus> phases) {
        Map<String, PhaseStatus> byKey = new LinkedHashMap<>();
        phases.forEach((phase, state) -> byKey.put(phase.key(), state));
        try {
            return objectMapper.writeValueAsString(byKey);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise phase state: " + e.getMessage(), e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
