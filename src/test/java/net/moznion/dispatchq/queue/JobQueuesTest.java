package net.moznion.dispatchq.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Before;
import org.junit.Test;

import net.moznion.dispatchq.broker.InMemoryJobBroker;
import net.moznion.dispatchq.exception.InvalidPayloadException;
import net.moznion.dispatchq.mail.EmailPayload;
import net.moznion.dispatchq.plagiarism.PlagiarismCheckPayload;

public class JobQueuesTest {
    private InMemoryJobBroker jobBroker;
    private Queue queue;

    @Before
    public void setup() {
        final QueueSettingsRegistry registry = QueueSettingsRegistry.withBuiltinQueues();
        jobBroker = new InMemoryJobBroker(registry);
        queue = new BrokerQueue(jobBroker, registry);
    }

    @Test
    public void testEnqueueEmail() {
        final String id = JobQueues.enqueueEmail(queue, EmailPayload.builder()
                                                                    .to("student@example.com")
                                                                    .subject("Submission received")
                                                                    .html("<p>Thanks</p>")
                                                                    .build());

        assertThat(jobBroker.getJob(id).get().getQueueName()).isEqualTo(QueueNames.EMAIL);
    }

    @Test
    public void testInvalidEmailIsRejectedBeforeEnqueue() {
        assertThatThrownBy(() -> JobQueues.enqueueEmail(queue, EmailPayload.builder()
                                                                           .to("student@example.com")
                                                                           .subject("no body")
                                                                           .build()))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("html");
        assertThat(jobBroker.getNumberOfWaitingJobs(QueueNames.EMAIL)).isZero();
    }

    @Test
    public void testPlagiarismCheckIsDeduplicatedPerSubmission() {
        final PlagiarismCheckPayload payload = PlagiarismCheckPayload.builder()
                                                                     .submissionId("42")
                                                                     .storageKey("uploads/42.pdf")
                                                                     .fileType("pdf")
                                                                     .projectId("p-1")
                                                                     .chapter(2)
                                                                     .build();

        final String first = JobQueues.enqueuePlagiarismCheck(queue, payload);
        final String second = JobQueues.enqueuePlagiarismCheck(queue, payload);

        assertThat(first).isEqualTo("plag-42").isEqualTo(second);
        assertThat(jobBroker.getNumberOfWaitingJobs(QueueNames.PLAGIARISM)).isEqualTo(1);
    }

    @Test
    public void testInvalidPlagiarismCheckIsRejected() {
        assertThatThrownBy(() -> JobQueues.enqueuePlagiarismCheck(queue, PlagiarismCheckPayload.builder()
                                                                                               .submissionId("1")
                                                                                               .storageKey("k")
                                                                                               .fileType("pdf")
                                                                                               .projectId("p")
                                                                                               .chapter(0)
                                                                                               .build()))
                .isInstanceOf(InvalidPayloadException.class)
                .hasMessageContaining("chapter");
    }
}
