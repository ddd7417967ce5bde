package com.abba.ainay.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "medications")
@CompoundIndex(name = "active_taken_idx", def = "{'active': 1, 'taken': 1}")
@Data
public class Medication {

    @Id
    private String id;

    @Indexed
    private String userId;

    private String name;
    private String dosage;
    private String time;
    private String startTime;
    private String frequency;
    private boolean taken;
    private Instant takenAt;
    private boolean active = true;
    private Instant updatedAt = Instant.now();

    public String scheduleText() {
        if (time != null && !time.isBlank()) {
            return time;
        }
        return startTime;
    }
}
