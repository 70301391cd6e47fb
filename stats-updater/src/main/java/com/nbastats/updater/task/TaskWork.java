package com.nbastats.updater.task;

/**
 * A unit of work run by {@link BackgroundTaskRunner}.
 */
@FunctionalInterface
public interface TaskWork {

    void run(TaskContext context) throws Exception;
}
