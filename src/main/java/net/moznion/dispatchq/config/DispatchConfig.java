package net.moznion.dispatchq.config;

import java.util.Map;

import net.moznion.dispatchq.connection.ConnectionOptions;
import net.moznion.dispatchq.mail.SmtpSettings;

import lombok.Builder;
import lombok.Value;

/**
 * Settings of a dispatchq process, read once at boot.
 */
@Value
@Builder(toBuilder = true)
public class DispatchConfig {
    @Builder.Default
    boolean jobsEnabled = true;
    @Builder.Default
    ConnectionOptions connectionOptions = ConnectionOptions.builder().build();
    @Builder.Default
    SmtpSettings smtpSettings = SmtpSettings.builder().build();
    @Builder.Default
    String emailFrom = "noreply@cms-buksu.edu.ph";
    @Builder.Default
    int emailConcurrency = 5;

    public static DispatchConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Unset and empty variables fall back to the defaults.
     *
     * @throws IllegalArgumentException when a numeric variable is malformed
     */
    public static DispatchConfig fromEnvironment(final Map<String, String> env) {
        final ConnectionOptions defaultConnection = ConnectionOptions.builder().build();
        final ConnectionOptions connectionOptions =
                ConnectionOptions.builder()
                                 .host(string(env, "REDIS_HOST", defaultConnection.getHost()))
                                 .port(integer(env, "REDIS_PORT", defaultConnection.getPort()))
                                 .password(string(env, "REDIS_PASSWORD", null))
                                 .namespace(string(env, "REDIS_NAMESPACE", defaultConnection.getNamespace()))
                                 .timeoutMillis(integer(env, "REDIS_TIMEOUT_MS",
                                                        defaultConnection.getTimeoutMillis()))
                                 .poolSize(integer(env, "REDIS_POOL_SIZE", defaultConnection.getPoolSize()))
                                 .build();

        final SmtpSettings defaultSmtp = SmtpSettings.builder().build();
        final SmtpSettings smtpSettings = SmtpSettings.builder()
                                                      .host(string(env, "SMTP_HOST", defaultSmtp.getHost()))
                                                      .port(integer(env, "SMTP_PORT", defaultSmtp.getPort()))
                                                      .user(string(env, "SMTP_USER", null))
                                                      .password(string(env, "SMTP_PASS", null))
                                                      .build();

        final DispatchConfig defaults = builder().build();
        return builder().jobsEnabled(bool(env, "JOBS_ENABLED", defaults.isJobsEnabled()))
                        .connectionOptions(connectionOptions)
                        .smtpSettings(smtpSettings)
                        .emailFrom(string(env, "EMAIL_FROM", defaults.getEmailFrom()))
                        .emailConcurrency(integer(env, "EMAIL_CONCURRENCY", defaults.getEmailConcurrency()))
                        .build();
    }

    private static String string(final Map<String, String> env, final String name, final String defaultValue) {
        final String value = env.get(name);
        return value == null || value.trim().isEmpty() ? defaultValue : value.trim();
    }

    private static int integer(final Map<String, String> env, final String name, final int defaultValue) {
        final String value = string(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static boolean bool(final Map<String, String> env, final String name, final boolean defaultValue) {
        final String value = string(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be true or false: " + value);
    }
}
