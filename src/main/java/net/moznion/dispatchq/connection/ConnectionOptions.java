package net.moznion.dispatchq.connection;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ConnectionOptions {
    @Builder.Default
    String host = "localhost";
    @Builder.Default
    int port = 6379;
    @ToString.Exclude
    String password;
    @Builder.Default
    int timeoutMillis = 5000;
    @Builder.Default
    int poolSize = 16;
    @Builder.Default
    String namespace = "dispatchq";

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }
}
