package net.moznion.dispatchq.queue;

import net.moznion.dispatchq.JobOptions;
import net.moznion.dispatchq.mail.EmailPayload;
import net.moznion.dispatchq.plagiarism.PlagiarismCheckPayload;

/**
 * Typed enqueue helpers for the built-in queues.
 */
public final class JobQueues {
    private JobQueues() {
    }

    public static String enqueueEmail(final Queue queue, final EmailPayload payload) {
        payload.validate();
        return queue.enqueue(QueueNames.EMAIL, payload);
    }

    /**
     * At most one check per submission is retained; re-enqueueing returns the existing job id.
     */
    public static String enqueuePlagiarismCheck(final Queue queue, final PlagiarismCheckPayload payload) {
        payload.validate();
        return queue.enqueue(QueueNames.PLAGIARISM,
                             payload,
                             JobOptions.builder().jobId(payload.jobId()).build());
    }
}
