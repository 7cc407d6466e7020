package com.scheduler.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scheduler.core.model.DependencyEdge;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskRun;
import com.scheduler.core.model.WorkerRecord;
import com.scheduler.core.model.WorkerStatus;
import com.scheduler.core.repository.TaskFilter;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Public API of the task scheduler: registration, status, cancellation
 * and worker administration.
 */
public interface SchedulerService {

    /**
     * Register a task, or replace the definition of an existing one when
     * {@code overwrite} is set.
     *
     * @param request The task definition
     * @return id and uuid of the stored task, or the validation errors
     *         (nothing is stored when there are errors)
     */
    QueueResult queueTask(TaskRequest request);

    /**
     * Register a batch of ordering constraints between existing tasks of one job.
     *
     * @param jobName The job
     * @param edges The batch, stored completely or not at all
     * @throws com.scheduler.core.exception.CyclicDependencyException if the batch closes a cycle
     * @throws com.scheduler.core.exception.TaskValidationException if an edge references an unknown task
     */
    void addDependencies(String jobName, Collection<DependencyEdge> edges);

    /**
     * Get a task by id.
     *
     * @return A single-element list, or an empty list if no such task exists
     */
    List<TaskStatusView> taskStatus(long taskId, boolean includeOutput);

    /**
     * Get a task by uuid.
     */
    List<TaskStatusView> taskStatus(String uuid, boolean includeOutput);

    /**
     * Query tasks by status, group, name and due time.
     */
    List<TaskStatusView> taskStatus(TaskFilter filter, boolean includeOutput);

    /**
     * Query tasks with an arbitrary predicate, evaluated over all tasks.
     */
    List<TaskStatusView> taskStatus(Predicate<ScheduledTask> predicate, boolean includeOutput);

    /**
     * Stop a task. A running child process is killed by its worker.
     *
     * @return true if the task was stopped, false if it was already terminal
     * @throws com.scheduler.core.exception.NotFoundException if no such task exists
     */
    boolean stopTask(long taskId);

    boolean stopTask(String uuid);

    /**
     * Get the run history of a task, oldest first.
     */
    List<TaskRun> taskRuns(long taskId);

    List<WorkerRecord> listWorkers();

    /**
     * Change the administrative status of one worker.
     *
     * @return false if the worker is not registered
     */
    boolean setWorkerStatus(String workerId, WorkerStatus status);

    /**
     * Change the administrative status of every worker serving a group.
     *
     * @return Number of workers changed
     */
    int setGroupStatus(String groupName, WorkerStatus status);

    // ========== Result Types ==========

    record QueueResult(Long id, String uuid, Map<String, String> errors) {
        public QueueResult {
            errors = errors == null ? Map.of() : Map.copyOf(errors);
        }

        public static QueueResult accepted(long id, String uuid) {
            return new QueueResult(id, uuid, Map.of());
        }

        public static QueueResult rejected(String uuid, Map<String, String> errors) {
            return new QueueResult(null, uuid, errors);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }
    }

    /**
     * A task with its latest run, when output was requested.
     */
    record TaskStatusView(ScheduledTask task, TaskRun latestRun) {

        public String output() {
            return latestRun != null ? latestRun.output() : null;
        }

        public JsonNode result() {
            return latestRun != null ? latestRun.result() : null;
        }

        public String traceback() {
            return latestRun != null ? latestRun.traceback() : null;
        }
    }
}
