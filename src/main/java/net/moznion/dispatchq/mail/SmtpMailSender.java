package net.moznion.dispatchq.mail;

import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;

import jakarta.mail.Message.RecipientType;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

import lombok.extern.slf4j.Slf4j;

/**
 * SMTP delivery over a small pool of connected transports.
 * <p>
 * Nothing is opened until the first send. At most {@code poolSize} connections exist at a time;
 * a transport that failed a send is discarded instead of being returned to the pool.
 */
@Slf4j
public class SmtpMailSender implements MailSender {
    private final SmtpSettings settings;
    private final BlockingQueue<Transport> idleTransports;
    private final Semaphore permits;

    private volatile Session session;
    private volatile boolean closed;

    public SmtpMailSender(final SmtpSettings settings) {
        this.settings = settings;
        idleTransports = new ArrayBlockingQueue<>(settings.getPoolSize());
        permits = new Semaphore(settings.getPoolSize(), true);
        closed = false;
    }

    @Override
    public void send(final String from, final EmailPayload email) throws MessagingException, InterruptedException {
        if (closed) {
            throw new MessagingException("SMTP sender is closed");
        }

        final MimeMessage message = toMessage(session(), from, email);

        permits.acquire();
        try {
            final Transport transport = borrow();
            boolean healthy = false;
            try {
                transport.sendMessage(message, message.getAllRecipients());
                healthy = true;
            } finally {
                giveBack(transport, healthy);
            }
        } finally {
            permits.release();
        }
    }

    @Override
    public void close() {
        closed = true;
        Transport transport;
        while ((transport = idleTransports.poll()) != null) {
            closeTransport(transport);
        }
        log.info("SMTP sender closed [host={}, port={}]", settings.getHost(), settings.getPort());
    }

    MimeMessage toMessage(final Session mailSession, final String from, final EmailPayload email)
            throws MessagingException {
        final MimeMessage message = new MimeMessage(mailSession);
        message.setFrom(new InternetAddress(from));
        message.setRecipients(RecipientType.TO, InternetAddress.parse(email.getTo()));
        message.setSubject(email.getSubject(), StandardCharsets.UTF_8.name());

        if (email.getText() == null || email.getText().isEmpty()) {
            message.setContent(email.getHtml(), "text/html; charset=UTF-8");
        } else {
            final MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(email.getText(), StandardCharsets.UTF_8.name());

            final MimeBodyPart htmlPart = new MimeBodyPart();
            htmlPart.setContent(email.getHtml(), "text/html; charset=UTF-8");

            final MimeMultipart alternative = new MimeMultipart("alternative");
            alternative.addBodyPart(textPart);
            alternative.addBodyPart(htmlPart);
            message.setContent(alternative);
        }

        message.saveChanges();
        return message;
    }

    Session session() {
        Session current = session;
        if (current == null) {
            synchronized (this) {
                current = session;
                if (current == null) {
                    current = Session.getInstance(sessionProperties());
                    session = current;
                }
            }
        }
        return current;
    }

    private Properties sessionProperties() {
        final String protocol = protocol();
        final String prefix = "mail." + protocol + '.';

        final Properties properties = new Properties();
        properties.put("mail.transport.protocol", protocol);
        properties.put(prefix + "host", settings.getHost());
        properties.put(prefix + "port", String.valueOf(settings.getPort()));
        properties.put(prefix + "connectiontimeout", String.valueOf(settings.getTimeoutMillis()));
        properties.put(prefix + "timeout", String.valueOf(settings.getTimeoutMillis()));
        properties.put(prefix + "writetimeout", String.valueOf(settings.getTimeoutMillis()));
        properties.put(prefix + "auth", String.valueOf(settings.hasCredentials()));
        if (!settings.isSecure()) {
            properties.put(prefix + "starttls.enable", "true");
        }
        return properties;
    }

    private String protocol() {
        return settings.isSecure() ? "smtps" : "smtp";
    }

    private Transport borrow() throws MessagingException {
        final Transport idle = idleTransports.poll();
        if (idle != null) {
            if (idle.isConnected()) {
                return idle;
            }
            closeTransport(idle);
        }

        final Transport transport = session().getTransport(protocol());
        if (settings.hasCredentials()) {
            transport.connect(settings.getHost(), settings.getPort(), settings.getUser(), settings.getPassword());
        } else {
            transport.connect(settings.getHost(), settings.getPort(), null, null);
        }
        log.debug("SMTP connection opened [host={}, port={}]", settings.getHost(), settings.getPort());
        return transport;
    }

    private void giveBack(final Transport transport, final boolean healthy) {
        if (healthy && !closed && idleTransports.offer(transport)) {
            return;
        }
        closeTransport(transport);
    }

    private static void closeTransport(final Transport transport) {
        try {
            transport.close();
        } catch (MessagingException e) {
            log.debug("Failed to close SMTP connection [cause={}]", e.getMessage());
        }
    }
}
