package com.nbastats.updater.task;

import com.nbastats.updater.config.StatsUpdaterProperties;
import com.nbastats.updater.exception.TaskCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackgroundTaskRunnerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private StatsUpdaterProperties properties;
    private BackgroundTaskRunner runner;

    @BeforeEach
    void setUp() {
        properties = new StatsUpdaterProperties();
        properties.getTasks().setCancelTimeoutMs(5_000);
        runner = new BackgroundTaskRunner(new SimpleAsyncTaskExecutor("test-task-"), properties, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void should_CompleteTaskAndReportProgress() throws Exception {
        String id = runner.createTask("sample", "Sample work", context -> {
            context.updateProgress(50, "Halfway");
            assertThat(context.taskId()).isNotBlank();
        });

        TaskSnapshot task = runner.waitForTask(id, WAIT).orElseThrow();

        assertThat(task.state()).isEqualTo(TaskState.COMPLETED);
        assertThat(task.progress()).isEqualTo(100.0);
        assertThat(task.currentStep()).isEqualTo("Completed successfully");
        assertThat(task.name()).isEqualTo("sample");
        assertThat(task.description()).isEqualTo("Sample work");
        assertThat(task.startedAt()).isNotNull();
        assertThat(task.completedAt()).isNotNull();
        assertThat(task.errorMessage()).isNull();
    }

    @Test
    void should_FailTask_When_WorkThrows() throws Exception {
        String id = runner.createTask("broken", "Throws", context -> {
            throw new IllegalStateException("database unavailable");
        });

        TaskSnapshot task = runner.waitForTask(id, WAIT).orElseThrow();

        assertThat(task.state()).isEqualTo(TaskState.FAILED);
        assertThat(task.errorMessage()).isEqualTo("database unavailable");
        assertThat(task.currentStep()).isEqualTo("Failed: database unavailable");
    }

    @Test
    void should_CancelTask_When_WorkObservesToken() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        String id = runner.createTask("cooperative", "Polls its token", context -> {
            started.countDown();
            while (!context.cancellationToken().isCancellationRequested()) {
                Thread.sleep(5);
            }
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.requestCancellation(id)).isTrue();

        TaskSnapshot task = runner.waitForTask(id, WAIT).orElseThrow();
        assertThat(task.state()).isEqualTo(TaskState.CANCELLED);
        assertThat(task.currentStep()).isEqualTo("Task was cancelled");
    }

    @Test
    void should_CancelTask_When_WorkThrowsCancellation() throws Exception {
        String id = runner.createTask("unwinding", "Throws cancellation", context -> {
            throw new TaskCancelledException("stopped between units");
        });

        assertThat(runner.waitForTask(id, WAIT).orElseThrow().state()).isEqualTo(TaskState.CANCELLED);
    }

    @Test
    void should_InterruptAndAwaitWork_When_HardCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        String id = runner.createTask("blocking", "Sleeps", context -> {
            started.countDown();
            Thread.sleep(60_000);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(runner.cancel(id)).isTrue();

        TaskSnapshot task = runner.getStatus(id).orElseThrow();
        assertThat(task.state()).isEqualTo(TaskState.CANCELLED);
        assertThat(runner.cancel(id)).isFalse();
        assertThat(runner.requestCancellation(id)).isFalse();
    }

    @Test
    void should_CancelPendingTask_When_ItNeverStarted() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.initialize();
        BackgroundTaskRunner queued = new BackgroundTaskRunner(single, properties, Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        try {
            String blocker = queued.createTask("blocker", "Occupies the only thread",
                    context -> release.await(5, TimeUnit.SECONDS));
            String waiting = queued.createTask("waiting", "Never gets a thread", context -> { });

            assertThat(queued.getStatus(waiting).orElseThrow().state()).isEqualTo(TaskState.PENDING);
            assertThat(queued.cancel(waiting)).isTrue();
            assertThat(queued.getStatus(waiting).orElseThrow().state()).isEqualTo(TaskState.CANCELLED);
            assertThat(queued.getStatus(waiting).orElseThrow().startedAt()).isNull();

            release.countDown();
            assertThat(queued.waitForTask(blocker, WAIT).orElseThrow().state()).isEqualTo(TaskState.COMPLETED);
        } finally {
            release.countDown();
            single.shutdown();
        }
    }

    @Test
    void should_NotifyOnceBeforeWaitersWake_When_TaskFails() throws Exception {
        List<TaskSnapshot> finished = new CopyOnWriteArrayList<>();
        String id = runner.createTask("broken", "Throws", context -> {
            throw new IllegalStateException("connection refused");
        }, finished::add);

        runner.waitForTask(id, WAIT);

        assertThat(finished).singleElement().satisfies(task -> {
            assertThat(task.id()).isEqualTo(id);
            assertThat(task.state()).isEqualTo(TaskState.FAILED);
            assertThat(task.errorMessage()).isEqualTo("connection refused");
        });
    }

    @Test
    void should_NotifyCompletion_When_PendingTaskCancelled() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.initialize();
        BackgroundTaskRunner queued = new BackgroundTaskRunner(single, properties, Clock.systemUTC());
        List<TaskSnapshot> finished = new CopyOnWriteArrayList<>();
        CountDownLatch release = new CountDownLatch(1);
        try {
            queued.createTask("blocker", "Occupies the only thread", context -> release.await(5, TimeUnit.SECONDS));
            String waiting = queued.createTask("waiting", "Never gets a thread", context -> { }, finished::add);

            queued.cancel(waiting);

            assertThat(finished).singleElement()
                    .extracting(TaskSnapshot::state).isEqualTo(TaskState.CANCELLED);
        } finally {
            release.countDown();
            single.shutdown();
        }
    }

    @Test
    void should_RecordFailureAndNotify_When_ExecutorRejectsTask() {
        ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
        saturated.setCorePoolSize(1);
        saturated.setMaxPoolSize(1);
        saturated.setQueueCapacity(0);
        saturated.initialize();
        BackgroundTaskRunner bounded = new BackgroundTaskRunner(saturated, properties, Clock.systemUTC());
        List<TaskSnapshot> finished = new CopyOnWriteArrayList<>();
        CountDownLatch release = new CountDownLatch(1);
        try {
            bounded.createTask("blocker", "Occupies the only thread", context -> release.await(5, TimeUnit.SECONDS));

            assertThatThrownBy(() -> bounded.createTask("overflow", "No room", context -> { }, finished::add))
                    .isInstanceOf(TaskRejectedException.class);

            assertThat(finished).singleElement().satisfies(task -> {
                assertThat(task.state()).isEqualTo(TaskState.FAILED);
                assertThat(task.errorMessage()).startsWith("Rejected by executor");
            });
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    void should_ReturnFalse_When_TaskUnknown() throws Exception {
        assertThat(runner.cancel("missing")).isFalse();
        assertThat(runner.requestCancellation("missing")).isFalse();
        assertThat(runner.getStatus("missing")).isEmpty();
        assertThat(runner.waitForTask("missing", Duration.ofMillis(10))).isEmpty();
    }

    @Test
    void should_ListOnlyUnfinishedTasksAsActive() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        String running = runner.createTask("running", "Blocks", context -> release.await(5, TimeUnit.SECONDS));
        String done = runner.createTask("done", "Returns", context -> { });
        runner.waitForTask(done, WAIT);

        assertThat(runner.getActiveTasks()).extracting(TaskSnapshot::id).containsExactly(running);
        assertThat(runner.getAllTasks()).extracting(TaskSnapshot::id).containsExactlyInAnyOrder(running, done);

        release.countDown();
        runner.waitForTask(running, WAIT);
    }

    @Test
    void should_ReapOldestFinishedTasksBeyondRetention() throws Exception {
        properties.getTasks().setMaxFinishedTasks(2);
        BackgroundTaskRunner bounded = new BackgroundTaskRunner(
                new SimpleAsyncTaskExecutor("test-reap-"), properties, Clock.systemUTC());
        CountDownLatch release = new CountDownLatch(1);
        String running = bounded.createTask("running", "Blocks", context -> release.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 4; i++) {
            String id = bounded.createTask("quick-" + i, "Returns", context -> { });
            bounded.waitForTask(id, WAIT);
        }

        int removed = bounded.reapFinishedTasks();

        assertThat(removed).isEqualTo(2);
        assertThat(bounded.getAllTasks()).hasSize(3);
        assertThat(bounded.getStatus(running)).isPresent();
        assertThat(bounded.reapFinishedTasks()).isZero();

        release.countDown();
        bounded.waitForTask(running, WAIT);
    }
}
