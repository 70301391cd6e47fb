package com.nbastats.updater.config;

import com.nbastats.updater.exception.UpdateInProgressException;
import com.nbastats.updater.model.Phase;
import com.nbastats.updater.model.UpdateStatus;
import com.nbastats.updater.service.UpdateService;
import com.nbastats.updater.task.BackgroundTaskRunner;
import com.nbastats.updater.task.TaskSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@RestController
@RequestMapping("/admin")
@Slf4j
@RequiredArgsConstructor
public class UpdateController {

    private final UpdateService updateService;
    private final BackgroundTaskRunner taskRunner;

    // ── Update triggers ───────────────────────────────────────────────────────

    @GetMapping("/status")
    public ResponseEntity<UpdateStatus> status() {
        return ResponseEntity.ok(updateService.getStatus());
    }

    @PostMapping("/update/all")
    public ResponseEntity<Map<String, String>> updateAll() {
        return trigger(Phase.all(), "all");
    }

    @PostMapping("/update/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        UpdateStatus status = updateService.requestCancellation();
        return ResponseEntity.accepted().body(Map.of(
                "status", "cancellation requested",
                "updating", status.isUpdating()));
    }

    /**
     * POST /admin/update/players
     */
    @PostMapping("/update/{phase}")
    public ResponseEntity<Map<String, String>> updatePhase(@PathVariable String phase) {
        Phase parsed;
        try {
            parsed = Phase.fromKey(phase);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        return trigger(EnumSet.of(parsed), parsed.key());
    }

    // ── Background tasks ──────────────────────────────────────────────────────

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskSnapshot>> tasks(@RequestParam(defaultValue = "false") boolean active) {
        return ResponseEntity.ok(active ? taskRunner.getActiveTasks() : taskRunner.getAllTasks());
    }

    @GetMapping("/tasks/{id}")
    public ResponseEntity<?> task(@PathVariable String id) {
        return taskRunner.getStatus(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "Unknown task " + id)));
    }

    @DeleteMapping("/tasks/{id}")
    public ResponseEntity<Map<String, String>> cancelTask(@PathVariable String id) {
        if (!taskRunner.cancel(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "No running task " + id));
        }
        return ResponseEntity.ok(Map.of("status", "cancelled", "taskId", id));
    }

    // ── Internal ──────────────────────────────────────────────────────────────

    private ResponseEntity<Map<String, String>> trigger(Set<Phase> phases, String target) {
        try {
            String taskId = updateService.triggerUpdate(phases);
            return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", target, "taskId", taskId));
        } catch (UpdateInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Could not start {} update: {}", target, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
