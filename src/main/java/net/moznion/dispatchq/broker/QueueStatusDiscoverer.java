package net.moznion.dispatchq.broker;

public interface QueueStatusDiscoverer {
    long getNumberOfWaitingJobs(String queueName);

    long getNumberOfRetryWaitingJobs(String queueName);

    long getNumberOfActiveJobs(String queueName);

    long getNumberOfCompletedJobs(String queueName);

    long getNumberOfFailedJobs(String queueName);
}
