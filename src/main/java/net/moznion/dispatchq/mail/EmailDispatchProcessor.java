package net.moznion.dispatchq.mail;

import net.moznion.dispatchq.Job;
import net.moznion.dispatchq.worker.Processor;

import lombok.extern.slf4j.Slf4j;

/**
 * Processor of the {@code email-dispatch} queue.
 */
@Slf4j
public class EmailDispatchProcessor implements Processor, AutoCloseable {
    private final MailSender mailSender;
    private final String defaultFrom;

    public EmailDispatchProcessor(final MailSender mailSender, final String defaultFrom) {
        this.mailSender = mailSender;
        this.defaultFrom = defaultFrom;
    }

    @Override
    public void process(final Job job) throws Exception {
        final EmailPayload email = job.getPayload(EmailPayload.class);
        email.validate();

        final String from = email.getFrom() == null || email.getFrom().isEmpty() ? defaultFrom : email.getFrom();
        log.info("Sending email [jobId={}, to={}, subject={}]", job.getId(), email.getTo(), email.getSubject());
        mailSender.send(from, email);
        log.info("Email sent [jobId={}, to={}]", job.getId(), email.getTo());
    }

    @Override
    public void close() {
        mailSender.close();
    }
}
