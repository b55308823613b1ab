package net.moznion.dispatchq.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.JobStatus;
import net.moznion.dispatchq.backoff.BackoffPolicy;
import net.moznion.dispatchq.exception.BrokerUnavailableException;
import net.moznion.dispatchq.misc.MutableClock;
import net.moznion.dispatchq.queue.QueueSettings;
import net.moznion.dispatchq.queue.QueueSettingsRegistry;

public class InMemoryJobBrokerTest {
    private static final String QUEUE = "q";
    private static final long LEASE = 1_000L;

    private QueueSettingsRegistry registry;
    private MutableClock clock;
    private InMemoryJobBroker jobBroker;

    @Before
    public void setup() {
        registry = new QueueSettingsRegistry();
        registry.register(QUEUE, QueueSettings.defaults()
                                              .toBuilder()
                                              .backoff(BackoffPolicy.fixed(100))
                                              .removeOnComplete(2)
                                              .removeOnFail(2)
                                              .build());
        clock = new MutableClock(1_000_000L);
        jobBroker = new InMemoryJobBroker(registry, clock);
    }

    private String enqueue(final Object payload, final JobOptions options) {
        return jobBroker.enqueue(QUEUE, payload, registry.resolve(QUEUE, options));
    }

    private String enqueue(final Object payload) {
        return enqueue(payload, JobOptions.defaults());
    }

    @Test
    public void testDequeueClaimsJob() {
        final String id = enqueue("a");

        final Job claimed = jobBroker.dequeue(QUEUE, LEASE).get();

        assertThat(claimed.getId()).isEqualTo(id);
        assertThat(claimed.getAttempt()).isEqualTo(1);
        assertThat(claimed.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(jobBroker.getNumberOfWaitingJobs(QUEUE)).isZero();
        assertThat(jobBroker.getNumberOfActiveJobs(QUEUE)).isEqualTo(1);
        assertThat(jobBroker.dequeue(QUEUE, LEASE)).isEmpty();
        assertThat(jobBroker.dequeue("other", LEASE)).isEmpty();
    }

    @Test
    public void testLowerPriorityIsClaimedFirstThenFifo() {
        final String low1 = enqueue("low1", JobOptions.builder().priority(5).build());
        final String high1 = enqueue("high1");
        final String low2 = enqueue("low2", JobOptions.builder().priority(5).build());
        final String high2 = enqueue("high2");

        assertThat(jobBroker.dequeue(QUEUE, LEASE).get().getId()).isEqualTo(high1);
        assertThat(jobBroker.dequeue(QUEUE, LEASE).get().getId()).isEqualTo(high2);
        assertThat(jobBroker.dequeue(QUEUE, LEASE).get().getId()).isEqualTo(low1);
        assertThat(jobBroker.dequeue(QUEUE, LEASE).get().getId()).isEqualTo(low2);
    }

    @Test
    public void testDuplicatedJobIdIsIgnored() {
        final String first = enqueue("a", JobOptions.builder().jobId("dup").build());
        final String second = enqueue("b", JobOptions.builder().jobId("dup").build());

        assertThat(first).isEqualTo("dup").isEqualTo(second);
        assertThat(jobBroker.getNumberOfWaitingJobs(QUEUE)).isEqualTo(1);
        assertThat(jobBroker.getJob("dup").get().getPayload()).isEqualTo("a");
    }

    @Test
    public void testComplete() {
        enqueue("a");
        final Job claimed = jobBroker.dequeue(QUEUE, LEASE).get();

        final Job completed = jobBroker.complete(claimed);

        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(jobBroker.getNumberOfActiveJobs(QUEUE)).isZero();
        assertThat(jobBroker.getNumberOfCompletedJobs(QUEUE)).isEqualTo(1);
        // acknowledging twice keeps the first outcome
        assertThat(jobBroker.fail(claimed, "late").getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(jobBroker.getNumberOfFailedJobs(QUEUE)).isZero();
    }

    @Test
    public void testRetryBecomesVisibleAfterDelay() {
        final String id = enqueue("a");
        final Job claimed = jobBroker.dequeue(QUEUE, LEASE).get();

        final Job retrying = jobBroker.registerRetryJob(claimed, "boom", 100);

        assertThat(retrying.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(retrying.getLastError()).isEqualTo("boom");
        assertThat(jobBroker.getNumberOfRetryWaitingJobs(QUEUE)).isEqualTo(1);
        assertThat(jobBroker.getNumberOfActiveJobs(QUEUE)).isZero();

        assertThat(jobBroker.retry(QUEUE)).isZero();
        assertThat(jobBroker.dequeue(QUEUE, LEASE)).isEmpty();

        clock.advance(100);
        assertThat(jobBroker.retry(QUEUE)).isEqualTo(1);

        final Job reclaimed = jobBroker.dequeue(QUEUE, LEASE).get();
        assertThat(reclaimed.getId()).isEqualTo(id);
        assertThat(reclaimed.getAttempt()).isEqualTo(2);
    }

    @Test
    public void testRetryWithoutAttemptsLeftIsRejected() {
        enqueue("a", JobOptions.builder().maxAttempts(1).build());
        final Job claimed = jobBroker.dequeue(QUEUE, LEASE).get();

        assertThatThrownBy(() -> jobBroker.registerRetryJob(claimed, "boom", 0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testStalledJobIsRequeuedWithAttemptSpent() {
        final String id = enqueue("a");
        jobBroker.dequeue(QUEUE, LEASE);

        clock.advance(LEASE - 1);
        assertThat(jobBroker.recoverStalledJobs(QUEUE)).isEmpty();

        clock.advance(1);
        assertThat(jobBroker.recoverStalledJobs(QUEUE)).extracting(Job::getId).containsExactly(id);
        assertThat(jobBroker.getJob(id).get().getStatus()).isEqualTo(JobStatus.QUEUED);

        final Job reclaimed = jobBroker.dequeue(QUEUE, LEASE).get();
        assertThat(reclaimed.getAttempt()).isEqualTo(2);
    }

    @Test
    public void testStalledJobWithoutAttemptsLeftIsFailed() {
        final String id = enqueue("a", JobOptions.builder().maxAttempts(1).build());
        jobBroker.dequeue(QUEUE, LEASE);

        clock.advance(LEASE);
        final List<Job> recovered = jobBroker.recoverStalledJobs(QUEUE);

        assertThat(recovered).hasSize(1);
        assertThat(recovered.get(0).getId()).isEqualTo(id);
        assertThat(recovered.get(0).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(recovered.get(0).getAttempt()).isEqualTo(1);

        final Job failed = jobBroker.getJob(id).get();
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getLastError()).isEqualTo(JobBroker.STALLED_ERROR);
        assertThat(jobBroker.getNumberOfFailedJobs(QUEUE)).isEqualTo(1);
    }

    @Test
    public void testExtendLeaseKeepsJobActive() {
        final String id = enqueue("a");
        jobBroker.dequeue(QUEUE, LEASE);

        clock.advance(LEASE - 10);
        jobBroker.extendLease(QUEUE, Collections.singletonList(id), LEASE);
        clock.advance(LEASE - 10);

        assertThat(jobBroker.recoverStalledJobs(QUEUE)).isEmpty();
        assertThat(jobBroker.getNumberOfActiveJobs(QUEUE)).isEqualTo(1);
    }

    @Test
    public void testReleaseGivesAttemptBack() {
        final String id = enqueue("a");
        final Job claimed = jobBroker.dequeue(QUEUE, LEASE).get();

        final Job released = jobBroker.release(claimed);

        assertThat(released.getAttempt()).isZero();
        assertThat(jobBroker.getNumberOfActiveJobs(QUEUE)).isZero();
        assertThat(jobBroker.dequeue(QUEUE, LEASE).get().getId()).isEqualTo(id);
    }

    @Test
    public void testFinishedJobsAreTrimmed() {
        final String first = enqueue("a");
        enqueue("b");
        enqueue("c");
        for (int i = 0; i < 3; i++) {
            jobBroker.complete(jobBroker.dequeue(QUEUE, LEASE).get());
        }

        assertThat(jobBroker.getNumberOfCompletedJobs(QUEUE)).isEqualTo(2);
        assertThat(jobBroker.getJob(first)).isEqualTo(Optional.empty());
        // a trimmed id may be enqueued again
        assertThat(enqueue("d", JobOptions.builder().jobId(first).build())).isEqualTo(first);
        assertThat(jobBroker.getNumberOfWaitingJobs(QUEUE)).isEqualTo(1);
    }

    @Test
    public void testUnknownJobIsRejected() {
        final Job ghost = Job.builder().id("ghost").queueName(QUEUE).build();

        assertThatThrownBy(() -> jobBroker.complete(ghost)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testClosedBrokerIsUnavailable() {
        jobBroker.close();

        assertThatThrownBy(() -> enqueue("a")).isInstanceOf(BrokerUnavailableException.class);
        assertThatThrownBy(() -> jobBroker.dequeue(QUEUE, LEASE)).isInstanceOf(BrokerUnavailableException.class);
    }
}
