package com.carrental.service;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

/**
 * Outgoing mail. Delivery problems are logged and reported through the return value; a booking or
 * registration never fails because the mail server is unreachable.
 */
@Service
public class EmailService {

    private static final Logger logger = LoggerFactory.getLogger(EmailService.class);

    private final JavaMailSender mailSender;

    @Value("${spring.mail.username:no-reply@carrental.local}")
    private String mailSenderUsername;

    @Value("${app.mail.enabled:true}")
    private boolean enabled;

    public EmailService(JavaMailSender mailSender) {
        this.mailSender = mailSender;
    }

    public boolean sendEmail(String to, String subject, String text) {
        if (to == null || to.isBlank()) {
            return false;
        }
        if (!enabled) {
            logger.debug("Mail disabled, skipping '{}' to {}", subject, to);
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false);
            helper.setFrom(mailSenderUsername);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(text);
            mailSender.send(message);
            logger.info("Sent '{}' to {}", subject, to);
            return true;
        } catch (MessagingException | MailException e) {
            logger.error("Failed to send '{}' to {}", subject, to, e);
            return false;
        }
    }

    public boolean sendWelcomeEmail(String to, String name) {
        return sendEmail(to, "Welcome to Car Rental",
                "Hi " + name + ",\n\nYour account is ready. You can now browse vehicles and make bookings.\n");
    }
}
