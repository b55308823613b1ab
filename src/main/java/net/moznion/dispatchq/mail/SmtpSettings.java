package net.moznion.dispatchq.mail;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SmtpSettings {
    private static final int SMTPS_PORT = 465;

    @Builder.Default
    String host = "smtp.mailtrap.io";
    @Builder.Default
    int port = 587;
    String user;
    @ToString.Exclude
    String password;
    @Builder.Default
    int timeoutMillis = 10_000;
    @Builder.Default
    int poolSize = 5;

    public boolean isSecure() {
        return port == SMTPS_PORT;
    }

    public boolean hasCredentials() {
        return user != null && !user.isEmpty() && password != null && !password.isEmpty();
    }
}
