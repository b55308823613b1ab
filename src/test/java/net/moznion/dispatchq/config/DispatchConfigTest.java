package net.moznion.dispatchq.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

public class DispatchConfigTest {
    @Test
    public void testDefaults() {
        final DispatchConfig config = DispatchConfig.fromEnvironment(Collections.emptyMap());

        assertThat(config.isJobsEnabled()).isTrue();
        assertThat(config.getConnectionOptions().getHost()).isEqualTo("localhost");
        assertThat(config.getConnectionOptions().getPort()).isEqualTo(6379);
        assertThat(config.getConnectionOptions().hasPassword()).isFalse();
        assertThat(config.getConnectionOptions().getNamespace()).isEqualTo("dispatchq");
        assertThat(config.getSmtpSettings().getHost()).isEqualTo("smtp.mailtrap.io");
        assertThat(config.getSmtpSettings().getPort()).isEqualTo(587);
        assertThat(config.getSmtpSettings().hasCredentials()).isFalse();
        assertThat(config.getEmailFrom()).isEqualTo("noreply@cms-buksu.edu.ph");
        assertThat(config.getEmailConcurrency()).isEqualTo(5);
    }

    @Test
    public void testOverrides() {
        final Map<String, String> env = new HashMap<>();
        env.put("JOBS_ENABLED", "false");
        env.put("REDIS_HOST", "redis.internal");
        env.put("REDIS_PORT", "6380");
        env.put("REDIS_PASSWORD", "secret");
        env.put("REDIS_NAMESPACE", "cms");
        env.put("SMTP_HOST", "smtp.example.com");
        env.put("SMTP_PORT", "465");
        env.put("SMTP_USER", "mailer");
        env.put("SMTP_PASS", "hunter2");
        env.put("EMAIL_FROM", "cms@example.com");
        env.put("EMAIL_CONCURRENCY", "8");

        final DispatchConfig config = DispatchConfig.fromEnvironment(env);

        assertThat(config.isJobsEnabled()).isFalse();
        assertThat(config.getConnectionOptions().getHost()).isEqualTo("redis.internal");
        assertThat(config.getConnectionOptions().getPort()).isEqualTo(6380);
        assertThat(config.getConnectionOptions().hasPassword()).isTrue();
        assertThat(config.getConnectionOptions().getNamespace()).isEqualTo("cms");
        assertThat(config.getSmtpSettings().isSecure()).isTrue();
        assertThat(config.getSmtpSettings().hasCredentials()).isTrue();
        assertThat(config.getEmailFrom()).isEqualTo("cms@example.com");
        assertThat(config.getEmailConcurrency()).isEqualTo(8);
        assertThat(config.toString()).doesNotContain("secret").doesNotContain("hunter2");
    }

    @Test
    public void testEmptyValuesFallBackToDefaults() {
        final DispatchConfig config = DispatchConfig.fromEnvironment(Collections.singletonMap("REDIS_PORT", " "));

        assertThat(config.getConnectionOptions().getPort()).isEqualTo(6379);
    }

    @Test
    public void testMalformedValuesNameTheVariable() {
        assertThatThrownBy(() -> DispatchConfig.fromEnvironment(Collections.singletonMap("REDIS_PORT", "abc")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("REDIS_PORT");
        assertThatThrownBy(() -> DispatchConfig.fromEnvironment(Collections.singletonMap("JOBS_ENABLED", "maybe")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JOBS_ENABLED");
    }
}
