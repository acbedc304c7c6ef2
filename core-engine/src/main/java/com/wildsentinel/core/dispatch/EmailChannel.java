package com.wildsentinel.core.dispatch;

import com.wildsentinel.core.model.ChannelType;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;

/**
 * Plain-text email over SMTP (Jakarta Mail).
 *
 * <p>
 * Invalid or rejected recipient addresses are permanent failures; any other
 * messaging error (connection refused, timeout, transport failure) is
 * transient.
 * </p>
 *
 * @since 1.0.0
 */
public class EmailChannel implements NotificationChannel {

    private final Session session;
    private final InternetAddress from;

    public EmailChannel(Session session, String from) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        try {
            this.from = new InternetAddress(Objects.requireNonNull(from, "from must not be null"), true);
        } catch (AddressException e) {
            throw new IllegalArgumentException("Invalid sender address: " + from, e);
        }
    }

    /**
     * Build a channel for an SMTP relay.
     *
     * @param username SMTP user; {@code null} disables authentication
     * @param timeout  connect, read and write timeout for each send
     */
    public static EmailChannel smtp(String host, int port, String username, String password,
            String from, Duration timeout) {
        Properties props = new Properties();
        String millis = Long.toString(timeout.toMillis());
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", Integer.toString(port));
        props.put("mail.smtp.connectiontimeout", millis);
        props.put("mail.smtp.timeout", millis);
        props.put("mail.smtp.writetimeout", millis);
        props.put("mail.smtp.starttls.enable", "true");
        Session session;
        if (username != null && !username.isBlank()) {
            props.put("mail.smtp.auth", "true");
            session = Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(username, password);
                }
            });
        } else {
            session = Session.getInstance(props);
        }
        return new EmailChannel(session, from);
    }

    @Override
    public ChannelType type() {
        return ChannelType.EMAIL;
    }

    @Override
    public void send(Notification notification) throws DeliveryException {
        MimeMessage message;
        try {
            message = compose(notification);
        } catch (AddressException e) {
            throw new PermanentDeliveryException("Invalid recipient address: " + notification.getAddress(), e);
        } catch (MessagingException e) {
            throw new PermanentDeliveryException("Cannot compose email: " + e.getMessage(), e);
        }
        try {
            transmit(message);
        } catch (SendFailedException e) {
            throw new PermanentDeliveryException("SMTP rejected recipient " + notification.getAddress(), e);
        } catch (MessagingException e) {
            throw new TransientDeliveryException("SMTP delivery failed: " + e.getMessage(), e);
        }
    }

    MimeMessage compose(Notification notification) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(from);
        message.setRecipient(Message.RecipientType.TO, new InternetAddress(notification.getAddress(), true));
        message.setSubject(notification.title(), StandardCharsets.UTF_8.name());
        message.setText(notification.body(), StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());
        return message;
    }

    /**
     * Hand the message to the SMTP transport.
     */
    protected void transmit(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }
}
