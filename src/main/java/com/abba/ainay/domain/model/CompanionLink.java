package com.abba.ainay.domain.model;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "patient_companions")
@CompoundIndex(name = "patient_status_idx", def = "{'patientId': 1, 'status': 1}")
@Data
public class CompanionLink {

    @Id
    private String id;

    private String patientId;
    private String companionId;
    private CompanionLinkStatus status = CompanionLinkStatus.PENDING;
    private Instant createdAt = Instant.now();
}
