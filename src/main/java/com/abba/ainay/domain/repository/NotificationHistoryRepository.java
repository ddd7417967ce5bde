package com.abba.ainay.domain.repository;

import com.abba.ainay.domain.model.NotificationHistory;
import com.abba.ainay.domain.model.NotificationType;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface NotificationHistoryRepository extends MongoRepository<NotificationHistory, String> {

    @Query(value = "{ 'medicationId': { $in: ?0 }, 'type': { $in: ?1 }, 'sentAt': { $gte: ?2, $lte: ?3 } }",
            fields = "{ 'medicationId': 1, 'companionId': 1, 'type': 1 }")
    List<NotificationHistory> findSentBetween(Collection<String> medicationIds,
                                              Collection<NotificationType> types,
                                              Instant from,
                                              Instant to);

    long countBySentAtGreaterThanEqual(Instant from);
}
