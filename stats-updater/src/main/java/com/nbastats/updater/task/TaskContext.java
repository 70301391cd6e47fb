package com.nbastats.updater.task;

/**
 * What a running unit of work can see of its own task: its id, its token and a progress sink.
 */
public class TaskContext {

    private final TaskInfo info;

    TaskContext(TaskInfo info) {
        this.info = info;
    }

    public String taskId() {
        return info.getId();
    }

    public CancellationToken cancellationToken() {
        return info.getCancellationToken();
    }

    /**
     * @param progress percentage, clamped to 0..100
     * @param step     human-readable description of the current step
     */
    public void updateProgress(double progress, String step) {
        info.updateProgress(progress, step);
    }
}
