package com.ryuqq.handover.adapter.mail;

import com.ryuqq.handover.core.exception.NotificationException;
import com.ryuqq.handover.core.spi.Notifier;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * {@link Notifier} that sends plain-text mail through an SMTP relay.
 *
 * <p>Any {@link MessagingException}, including an unparseable recipient address or a
 * relay that stops answering within the configured timeouts, surfaces as
 * {@link NotificationException}.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class SmtpNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(SmtpNotifier.class);

    private final SmtpConfig config;
    private final Session session;
    private final MessageTransport transport;

    public SmtpNotifier(SmtpConfig config) {
        this(config, Transport::send);
    }

    SmtpNotifier(SmtpConfig config, MessageTransport transport) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.config = config;
        this.transport = transport;
        this.session = Session.getInstance(sessionProperties(config));
    }

    @Override
    public void notify(String recipient, String subject, String body) {
        if (recipient == null || recipient.isBlank()) {
            throw new IllegalArgumentException("recipient cannot be null or blank");
        }
        try {
            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(config.fromAddress()));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(recipient));
            message.setSubject(subject, StandardCharsets.UTF_8.name());
            message.setText(body == null ? "" : body, StandardCharsets.UTF_8.name());
            message.setSentDate(new Date());
            transport.send(message);
            log.debug("Sent '{}' to {}", subject, recipient);
        } catch (MessagingException e) {
            throw new NotificationException("Failed to send '" + subject + "' to " + recipient, e);
        }
    }

    static Properties sessionProperties(SmtpConfig config) {
        Properties properties = new Properties();
        properties.put("mail.transport.protocol", "smtp");
        properties.put("mail.smtp.host", config.host());
        properties.put("mail.smtp.port", String.valueOf(config.port()));
        properties.put("mail.smtp.from", config.fromAddress());
        properties.put("mail.smtp.connectiontimeout", String.valueOf(config.connectTimeout().toMillis()));
        properties.put("mail.smtp.timeout", String.valueOf(config.readTimeout().toMillis()));
        properties.put("mail.smtp.writetimeout", String.valueOf(config.writeTimeout().toMillis()));
        return properties;
    }
}
