package net.moznion.dispatchq.backoff;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class BackoffPolicyTest {
    @Test
    public void testFixed() {
        final BackoffPolicy policy = BackoffPolicy.fixed(2_000L);

        assertThat(policy.delayFor(1)).isEqualTo(2_000L);
        assertThat(policy.delayFor(5)).isEqualTo(2_000L);
    }

    @Test
    public void testExponential() {
        final BackoffPolicy policy = BackoffPolicy.exponential(5_000L);

        assertThat(policy.delayFor(1)).isEqualTo(5_000L);
        assertThat(policy.delayFor(2)).isEqualTo(10_000L);
        assertThat(policy.delayFor(3)).isEqualTo(20_000L);
    }

    @Test
    public void testExponentialWithFactorAndCap() {
        final BackoffPolicy policy = BackoffPolicy.exponential(1_000L, 3.0).withMaxDelayMillis(5_000L);

        assertThat(policy.delayFor(1)).isEqualTo(1_000L);
        assertThat(policy.delayFor(2)).isEqualTo(3_000L);
        assertThat(policy.delayFor(3)).isEqualTo(5_000L);
        assertThat(policy.delayFor(100)).isEqualTo(5_000L);
    }

    @Test
    public void testHugeAttemptDoesNotOverflow() {
        assertThat(BackoffPolicy.exponential(1_000L).delayFor(2_000)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    public void testInvalidArguments() {
        assertThatThrownBy(() -> BackoffPolicy.fixed(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.exponential(100, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.fixed(100).delayFor(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BackoffPolicy.builder().baseDelayMillis(10).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
