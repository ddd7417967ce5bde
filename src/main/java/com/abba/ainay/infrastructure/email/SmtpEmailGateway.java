package com.abba.ainay.infrastructure.email;

import com.abba.ainay.application.dto.ConnectionCheck;
import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationChannel;
import com.abba.ainay.domain.service.ChannelGateway;
import com.abba.ainay.infrastructure.config.EmailProperties;
import com.abba.ainay.infrastructure.config.NotificationEngineConfig;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Component
public class SmtpEmailGateway implements ChannelGateway {

    private static final Logger log = LoggerFactory.getLogger(SmtpEmailGateway.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final EmailProperties properties;
    private final Executor executor;

    public SmtpEmailGateway(ObjectProvider<JavaMailSender> mailSenderProvider,
                            EmailProperties properties,
                            @Qualifier(NotificationEngineConfig.EMAIL_EXECUTOR) Executor executor) {
        this.mailSenderProvider = mailSenderProvider;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public boolean isConfigured() {
        return properties.isEnabled() && mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public boolean canReach(Recipient recipient) {
        return recipient.hasEmail();
    }

    @Override
    public CompletableFuture<DeliveryResult> send(Recipient recipient, DoseAlert alert) {
        if (!recipient.hasEmail()) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("No email on file"));
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            return CompletableFuture.completedFuture(DeliveryResult.failed("SMTP not configured"));
        }
        return CompletableFuture.supplyAsync(() -> deliver(mailSender, recipient, alert), executor);
    }

    /**
     * Opens and closes an SMTP connection with the configured credentials.
     */
    public ConnectionCheck verifyConnection() {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (!properties.isEnabled() || mailSender == null) {
            return ConnectionCheck.failed("Email not configured");
        }
        if (!(mailSender instanceof JavaMailSenderImpl)) {
            return ConnectionCheck.failed("Mail sender does not support connection checks");
        }
        try {
            ((JavaMailSenderImpl) mailSender).testConnection();
            log.info("SMTP connection verified");
            return ConnectionCheck.ok();
        } catch (MessagingException e) {
            log.error("SMTP connection check failed: {}", e.getMessage());
            return ConnectionCheck.failed(e.getMessage());
        }
    }

    private DeliveryResult deliver(JavaMailSender mailSender, Recipient recipient, DoseAlert alert) {
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.getFromAddress(), properties.getFromName());
            helper.setTo(recipient.email());
            helper.setSubject(subject(alert));
            helper.setText(body(recipient, alert));
            mailSender.send(message);
            log.info("Email sent to {} about {}", recipient.email(), alert.medicationName());
            return DeliveryResult.delivered(message.getMessageID());
        } catch (MailException | MessagingException | UnsupportedEncodingException e) {
            log.error("Error sending email to {}: {}", recipient.email(), e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }

    String subject(DoseAlert alert) {
        if (alert.kind() == DoseAlert.Kind.UPCOMING_DOSE) {
            return "Medication Reminder: " + alert.medicationName() + " at " + alert.scheduledTime();
        }
        return "Missed Medication Alert: " + alert.patientName() + " - " + alert.medicationName();
    }

    String body(Recipient recipient, DoseAlert alert) {
        if (alert.kind() == DoseAlert.Kind.UPCOMING_DOSE) {
            return """
                    Hi %s,

                    Time to take your medication %s.

                    Medicine: %s
                    Dosage: %s
                    Scheduled: %s
                    """.formatted(recipient.name(), alert.relativeTimeText(), alert.medicationName(),
                    alert.dosage(), alert.scheduledTime());
        }
        return """
                Hi %s,

                %s has not taken %s (%s) scheduled at %s (%s).

                Please check on %s and remind them to take their medication.
                """.formatted(recipient.name(), alert.patientName(), alert.medicationName(), alert.dosage(),
                alert.scheduledTime(), alert.relativeTimeText(), alert.patientName());
    }
}
