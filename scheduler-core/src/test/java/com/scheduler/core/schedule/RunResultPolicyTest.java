package com.scheduler.core.schedule;

import com.scheduler.core.model.RetryPolicy;
import com.scheduler.core.model.RunStatus;
import com.scheduler.core.model.ScheduledTask;
import com.scheduler.core.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunResultPolicyTest {

    private static final Instant T = Instant.parse("2024-05-01T12:00:00Z");

    private final ScheduleCalculator calculator = new ScheduleCalculator(ZoneOffset.UTC);
    private final RunResultPolicy policy = new RunResultPolicy(calculator, RetryPolicy.immediate());

    @Test
    void threeRepeatsWithoutDrift_shouldRunOnGridThenComplete() {
        ScheduledTask task = periodic().repeats(3).nextRunTime(T).build();
        List<Instant> runTimes = new ArrayList<>();

        while (task.status() == TaskStatus.QUEUED) {
            Instant started = task.nextRunTime();
            runTimes.add(started);
            RunTransition transition = policy.decide(task, RunStatus.COMPLETED, started.plusSeconds(10));
            task = transition.applyTo(task, started.plusSeconds(10));
        }

        assertEquals(List.of(T, T.plusSeconds(60), T.plusSeconds(120)), runTimes);
        assertEquals(TaskStatus.COMPLETED, task.status());
        assertEquals(3, task.timesRun());
    }

    @Test
    void unlimitedRepeats_shouldKeepRequeueing() {
        ScheduledTask task = periodic().repeats(0).nextRunTime(T).build();

        RunTransition transition = policy.decide(task, RunStatus.COMPLETED, T.plusSeconds(1));

        assertTrue(transition.isRequeued());
        assertEquals(0, transition.repeats());
        assertTrue(transition.succeeded());
    }

    @Test
    void nextRunOnStopTime_shouldStillRun() {
        ScheduledTask task = periodic().repeats(0).stopTime(T.plusSeconds(60)).nextRunTime(T).build();

        RunTransition first = policy.decide(task, RunStatus.COMPLETED, T.plusSeconds(5));
        assertEquals(TaskStatus.QUEUED, first.status());
        assertEquals(T.plusSeconds(60), first.nextRunTime());

        ScheduledTask second = first.applyTo(task, T.plusSeconds(5));
        RunTransition last = policy.decide(second, RunStatus.COMPLETED, T.plusSeconds(65));
        assertEquals(TaskStatus.COMPLETED, last.status());
    }

    @Test
    void oneShotSuccess_shouldComplete() {
        ScheduledTask task = base().nextRunTime(T).build();

        RunTransition transition = policy.decide(task, RunStatus.COMPLETED, T.plusSeconds(1));

        assertEquals(TaskStatus.COMPLETED, transition.status());
        assertEquals(1, transition.timesRun());
    }

    @Test
    void failureWithBudget_shouldRequeueAndSpendOneRetry() {
        ScheduledTask task = base().retryFailed(2).nextRunTime(T).build();

        RunTransition transition = policy.decide(task, RunStatus.FAILED, T.plusSeconds(3));

        assertEquals(TaskStatus.QUEUED, transition.status());
        assertEquals(T.plusSeconds(3), transition.nextRunTime());
        assertEquals(1, transition.retryFailed());
        assertEquals(1, transition.timesFailed());
        assertFalse(transition.succeeded());
    }

    @Test
    void timeoutWithBudget_shouldIncrementTimesFailedByOne() {
        ScheduledTask task = base().retryFailed(1).timesFailed(4).nextRunTime(T).build();

        RunTransition transition = policy.decide(task, RunStatus.TIMEOUT, T.plusSeconds(60));

        assertEquals(TaskStatus.QUEUED, transition.status());
        assertEquals(5, transition.timesFailed());
        assertEquals(0, transition.retryFailed());
    }

    @Test
    void failureWithoutBudget_shouldBeTerminal() {
        ScheduledTask task = base().nextRunTime(T).build();

        assertEquals(TaskStatus.FAILED, policy.decide(task, RunStatus.FAILED, T).status());
        assertEquals(TaskStatus.TIMEOUT, policy.decide(task, RunStatus.TIMEOUT, T).status());
    }

    @Test
    void backoffRetry_shouldDelayNextRun() {
        RetryPolicy backoff = RetryPolicy.builder()
            .mode(RetryPolicy.Mode.BACKOFF)
            .initialBackoff(Duration.ofSeconds(30))
            .jitterFactor(0.0)
            .build();
        RunResultPolicy delayed = new RunResultPolicy(calculator, backoff);
        ScheduledTask task = base().retryFailed(3).nextRunTime(T).build();

        RunTransition transition = delayed.decide(task, RunStatus.FAILED, T);

        assertEquals(T.plusSeconds(30), transition.nextRunTime());
    }

    @Test
    void nextScheduleRetry_shouldWaitForRegularFireTime() {
        RunResultPolicy nextSchedule = new RunResultPolicy(calculator, RetryPolicy.nextSchedule());
        ScheduledTask task = periodic().repeats(0).retryFailed(1).nextRunTime(T).build();

        RunTransition transition = nextSchedule.decide(task, RunStatus.FAILED, T.plusSeconds(5));

        assertEquals(T.plusSeconds(60), transition.nextRunTime());
    }

    @Test
    void retryBeyondStopTime_shouldBeTerminal() {
        RunResultPolicy nextSchedule = new RunResultPolicy(calculator, RetryPolicy.nextSchedule());
        ScheduledTask task = periodic().repeats(0).retryFailed(1)
            .stopTime(T.plusSeconds(30)).nextRunTime(T).build();

        assertEquals(TaskStatus.FAILED, nextSchedule.decide(task, RunStatus.FAILED, T.plusSeconds(5)).status());
    }

    @Test
    void stoppedResult_shouldHaveNoTransition() {
        assertThrows(IllegalArgumentException.class,
            () -> policy.decide(base().nextRunTime(T).build(), RunStatus.STOPPED, T));
    }

    private static ScheduledTask.Builder base() {
        return ScheduledTask.builder().id(1L).uuid("u").taskName("t").functionName("f");
    }

    private static ScheduledTask.Builder periodic() {
        return base().startTime(T).period(Duration.ofSeconds(60)).preventDrift(true);
    }
}
