package net.moznion.dispatchq.mail;

import net.moznion.dispatchq.exception.InvalidPayloadException;
import net.moznion.dispatchq.queue.QueueNames;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the {@code email-dispatch} queue. {@code text} and {@code from} are optional.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class EmailPayload {
    private String to;
    private String subject;
    private String html;
    private String text;
    private String from;

    public void validate() {
        requireText(to, "to");
        requireText(subject, "subject");
        requireText(html, "html");
    }

    private static void requireText(final String value, final String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidPayloadException(QueueNames.EMAIL, '\'' + field + "' is required");
        }
    }
}
