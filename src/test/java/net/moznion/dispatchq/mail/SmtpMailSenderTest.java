package net.moznion.dispatchq.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import jakarta.mail.Message.RecipientType;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;

public class SmtpMailSenderTest {
    private static final EmailPayload EMAIL = EmailPayload.builder()
                                                          .to("student@example.com")
                                                          .subject("Submission received")
                                                          .html("<p>Thanks</p>")
                                                          .build();

    @Test
    public void testHtmlOnlyMessage() throws Exception {
        final SmtpMailSender sender = new SmtpMailSender(SmtpSettings.builder().build());

        final MimeMessage message = sender.toMessage(sender.session(), "noreply@example.com", EMAIL);

        assertThat(message.getFrom()).containsExactly(new InternetAddress("noreply@example.com"));
        assertThat(message.getRecipients(RecipientType.TO))
                .containsExactly(new InternetAddress("student@example.com"));
        assertThat(message.getSubject()).isEqualTo("Submission received");
        assertThat(message.isMimeType("text/html")).isTrue();
    }

    @Test
    public void testTextBecomesPlainAlternative() throws Exception {
        final SmtpMailSender sender = new SmtpMailSender(SmtpSettings.builder().build());
        final EmailPayload email = EMAIL.toBuilder().text("Thanks").build();

        final MimeMessage message = sender.toMessage(sender.session(), "noreply@example.com", email);

        assertThat(message.isMimeType("multipart/alternative")).isTrue();
        final MimeMultipart multipart = (MimeMultipart) message.getContent();
        assertThat(multipart.getCount()).isEqualTo(2);
        assertThat(multipart.getBodyPart(0).isMimeType("text/plain")).isTrue();
        assertThat(multipart.getBodyPart(1).isMimeType("text/html")).isTrue();
    }

    @Test
    public void testStartTlsSession() {
        final Session session = new SmtpMailSender(SmtpSettings.builder().host("mail.example.com").build())
                .session();

        assertThat(session.getProperty("mail.transport.protocol")).isEqualTo("smtp");
        assertThat(session.getProperty("mail.smtp.host")).isEqualTo("mail.example.com");
        assertThat(session.getProperty("mail.smtp.port")).isEqualTo("587");
        assertThat(session.getProperty("mail.smtp.starttls.enable")).isEqualTo("true");
        assertThat(session.getProperty("mail.smtp.auth")).isEqualTo("false");
    }

    @Test
    public void testSmtpsSessionWithCredentials() {
        final Session session = new SmtpMailSender(SmtpSettings.builder()
                                                               .port(465)
                                                               .user("user")
                                                               .password("secret")
                                                               .build())
                .session();

        assertThat(session.getProperty("mail.transport.protocol")).isEqualTo("smtps");
        assertThat(session.getProperty("mail.smtps.auth")).isEqualTo("true");
        assertThat(session.getProperty("mail.smtps.starttls.enable")).isNull();
    }

    @Test
    public void testCredentialsNeedBothUserAndPassword() {
        assertThat(SmtpSettings.builder().user("user").build().hasCredentials()).isFalse();
        assertThat(SmtpSettings.builder().user("user").password("secret").build().toString())
                .doesNotContain("secret");
    }

    @Test
    public void testClosedSenderRejectsMail() {
        final SmtpMailSender sender = new SmtpMailSender(SmtpSettings.builder().build());
        sender.close();

        assertThatThrownBy(() -> sender.send("noreply@example.com", EMAIL)).isInstanceOf(MessagingException.class);
    }
}
