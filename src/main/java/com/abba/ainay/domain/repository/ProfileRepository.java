package com.abba.ainay.domain.repository;

import com.abba.ainay.domain.model.Profile;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;

public interface ProfileRepository extends MongoRepository<Profile, String> {

    @Query("{ 'role': 'PATIENT', $or: [ { 'emailRemindersEnabled': true }, { 'telegramChatId': { $ne: null } } ] }")
    List<Profile> findPatientsWithRemindersEnabled();
}
