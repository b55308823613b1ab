package net.moznion.dispatchq.queue;

public final class QueueNames {
    public static final String EMAIL = "email-dispatch";
    public static final String PLAGIARISM = "plagiarism-check";

    private QueueNames() {
    }
}
