package com.abba.ainay.domain.repository;

import com.abba.ainay.domain.model.Medication;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface MedicationRepository extends MongoRepository<Medication, String> {

    List<Medication> findByActiveTrueAndTakenFalse();

    List<Medication> findByUserIdInAndActiveTrueAndTakenFalse(Collection<String> userIds);
}
