package com.abba.ainay.domain.repository;

import com.abba.ainay.domain.model.PushSubscription;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PushSubscriptionRepository extends MongoRepository<PushSubscription, String> {

    List<PushSubscription> findByUserIdIn(Collection<String> userIds);

    Optional<PushSubscription> findByUserIdAndToken(String userId, String token);

    long deleteByUserIdAndToken(String userId, String token);

    long countByUserId(String userId);
}
