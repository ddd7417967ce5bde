package com.abba.ainay.domain.repository;

import com.abba.ainay.domain.model.CompanionLink;
import com.abba.ainay.domain.model.CompanionLinkStatus;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface CompanionLinkRepository extends MongoRepository<CompanionLink, String> {

    List<CompanionLink> findByPatientIdInAndStatus(Collection<String> patientIds, CompanionLinkStatus status);
}
