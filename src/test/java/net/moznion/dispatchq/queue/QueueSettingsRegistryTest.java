package net.moznion.dispatchq.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.backoff.BackoffPolicy;

public class QueueSettingsRegistryTest {
    @Test
    public void testBuiltinQueues() {
        final QueueSettingsRegistry registry = QueueSettingsRegistry.withBuiltinQueues();

        final QueueSettings email = registry.get(QueueNames.EMAIL);
        assertThat(email.getMaxAttempts()).isEqualTo(3);
        assertThat(email.getBackoff().delayFor(1)).isEqualTo(3_000L);
        assertThat(email.getBackoff().delayFor(2)).isEqualTo(6_000L);

        final QueueSettings plagiarism = registry.get(QueueNames.PLAGIARISM);
        assertThat(plagiarism.getMaxAttempts()).isEqualTo(3);
        assertThat(plagiarism.getBackoff().delayFor(1)).isEqualTo(5_000L);
        assertThat(plagiarism.getRemoveOnComplete()).isEqualTo(200);
        assertThat(plagiarism.getRemoveOnFail()).isEqualTo(500);

        assertThat(registry.get("unknown")).isEqualTo(QueueSettings.defaults());
    }

    @Test
    public void testResolveFillsAbsentOptions() {
        final QueueSettingsRegistry registry = QueueSettingsRegistry.withBuiltinQueues();

        final JobOptions resolved = registry.resolve(QueueNames.EMAIL, JobOptions.defaults());

        assertThat(resolved.getMaxAttempts()).isEqualTo(3);
        assertThat(resolved.getBackoff()).isEqualTo(QueueSettings.emailDispatch().getBackoff());
        assertThat(resolved.getPriority()).isZero();
        assertThat(resolved.getJobIdIfPresent()).isEmpty();
    }

    @Test
    public void testResolveKeepsGivenOptions() {
        final QueueSettingsRegistry registry = new QueueSettingsRegistry();

        final JobOptions resolved = registry.resolve("q", JobOptions.builder()
                                                                    .maxAttempts(7)
                                                                    .backoff(BackoffPolicy.fixed(10))
                                                                    .priority(4)
                                                                    .jobId("custom")
                                                                    .build());

        assertThat(resolved.getMaxAttempts()).isEqualTo(7);
        assertThat(resolved.getBackoff()).isEqualTo(BackoffPolicy.fixed(10));
        assertThat(resolved.getPriority()).isEqualTo(4);
        assertThat(resolved.getJobId()).isEqualTo("custom");
    }

    @Test
    public void testInvalidOptionsAreRejected() {
        final QueueSettingsRegistry registry = new QueueSettingsRegistry();

        assertThatThrownBy(() -> registry.resolve("q", JobOptions.builder().maxAttempts(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.resolve("q", JobOptions.builder().priority(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.resolve(
                "q", JobOptions.builder().priority(JobOptions.MAX_PRIORITY + 1).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("q", QueueSettings.defaults().toBuilder().maxAttempts(0).build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
