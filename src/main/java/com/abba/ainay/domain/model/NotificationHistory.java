package com.abba.ainay.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "notification_history")
@CompoundIndex(name = "medication_sent_idx", def = "{'medicationId': 1, 'sentAt': -1}")
@Data
public class NotificationHistory {

    @Id
    private String id;

    @Indexed
    private String patientId;
    private String companionId;
    private String medicationId;

    private NotificationType type;
    private NotificationChannel channel;
    private String recipientEmail;
    private String message;
    private String scheduledTime;

    @Indexed
    private Instant sentAt = Instant.now();
    private NotificationStatus status = NotificationStatus.SENT;
}
