package net.moznion.dispatchq.lifecycle;

public enum LifecycleState {
    NEW,
    RUNNING,
    /**
     * The broker was unreachable at start; producers get a queue that rejects every job.
     */
    DISABLED,
    STOPPED
}
