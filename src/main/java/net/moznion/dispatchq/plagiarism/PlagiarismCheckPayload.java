package net.moznion.dispatchq.plagiarism;

import net.moznion.dispatchq.exception.InvalidPayloadException;
import net.moznion.dispatchq.queue.QueueNames;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the {@code plagiarism-check} queue. The check itself is supplied by the host application.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PlagiarismCheckPayload {
    private static final String JOB_ID_PREFIX = "plag-";

    private String submissionId;
    private String storageKey;
    private String fileType;
    private String projectId;
    private int chapter;

    /**
     * One check per submission.
     */
    public String jobId() {
        return JOB_ID_PREFIX + submissionId;
    }

    public void validate() {
        requireText(submissionId, "submissionId");
        requireText(storageKey, "storageKey");
        requireText(fileType, "fileType");
        requireText(projectId, "projectId");
        if (chapter < 1) {
            throw new InvalidPayloadException(QueueNames.PLAGIARISM, "'chapter' must be positive: " + chapter);
        }
    }

    private static void requireText(final String value, final String field) {
        if (value == null || value.isEmpty()) {
            throw new InvalidPayloadException(QueueNames.PLAGIARISM, '\'' + field + "' is required");
        }
    }
}
