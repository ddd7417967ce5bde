package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.CompanionLink;
import com.abba.ainay.domain.model.CompanionLinkStatus;
import com.abba.ainay.domain.model.Profile;
import com.abba.ainay.domain.model.PushSubscription;
import com.abba.ainay.domain.repository.CompanionLinkRepository;
import com.abba.ainay.domain.repository.ProfileRepository;
import com.abba.ainay.domain.repository.PushSubscriptionRepository;
import com.abba.ainay.domain.service.CompanionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Batch-loads accepted companions for a set of patients: one link query, one profile query and
 * one push-token query regardless of how many patients are asked for. A failing link query
 * propagates; failing profile or token queries degrade to placeholder contacts.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompanionServiceImpl implements CompanionService {

    static final String FALLBACK_COMPANION_NAME = "Companion";

    private final CompanionLinkRepository companionLinkRepository;
    private final ProfileRepository profileRepository;
    private final PushSubscriptionRepository pushSubscriptionRepository;

    @Override
    public Map<String, List<Recipient>> resolveRecipients(Collection<String> patientIds) {
        if (patientIds == null || patientIds.isEmpty()) {
            return Map.of();
        }

        List<CompanionLink> links = companionLinkRepository.findByPatientIdInAndStatus(patientIds, CompanionLinkStatus.ACCEPTED);
        if (links.isEmpty()) {
            return Map.of();
        }

        List<String> companionIds = links.stream()
                .map(CompanionLink::getCompanionId)
                .distinct()
                .toList();
        Map<String, Profile> profiles = loadProfiles(companionIds);
        Map<String, List<String>> tokens = loadPushTokens(companionIds);

        Map<String, List<Recipient>> recipientsByPatient = new LinkedHashMap<>();
        for (CompanionLink link : links) {
            Profile profile = profiles.get(link.getCompanionId());
            Recipient recipient = new Recipient(
                    link.getCompanionId(),
                    profile == null || profile.getName() == null || profile.getName().isBlank()
                            ? FALLBACK_COMPANION_NAME : profile.getName(),
                    profile == null ? null : profile.getEmail(),
                    profile == null ? null : profile.getTelegramChatId(),
                    tokens.getOrDefault(link.getCompanionId(), List.of()));
            recipientsByPatient.computeIfAbsent(link.getPatientId(), ignored -> new ArrayList<>()).add(recipient);
        }
        return recipientsByPatient;
    }

    private Map<String, Profile> loadProfiles(List<String> companionIds) {
        try {
            return profileRepository.findAllById(companionIds).stream()
                    .collect(Collectors.toMap(Profile::getId, Function.identity(), (left, right) -> left));
        } catch (DataAccessException e) {
            log.warn("Could not load companion profiles, using placeholders: {}", e.getMessage());
            return Map.of();
        }
    }

    private Map<String, List<String>> loadPushTokens(List<String> companionIds) {
        try {
            return pushSubscriptionRepository.findByUserIdIn(companionIds).stream()
                    .collect(Collectors.groupingBy(
                            PushSubscription::getUserId,
                            LinkedHashMap::new,
                            Collectors.mapping(PushSubscription::getToken, Collectors.toList())));
        } catch (DataAccessException e) {
            log.warn("Could not load push subscriptions, push will be skipped this run: {}", e.getMessage());
            return Map.of();
        }
    }
}
