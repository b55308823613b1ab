package net.moznion.dispatchq.mail;

/**
 * Delivers one email. Implementations are shared by every slot of a pool and must be thread-safe.
 */
public interface MailSender extends AutoCloseable {
    void send(String from, EmailPayload email) throws Exception;

    @Override
    void close();
}
