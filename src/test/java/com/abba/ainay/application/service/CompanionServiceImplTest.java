package com.abba.ainay.application.service;

import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.CompanionLink;
import com.abba.ainay.domain.model.CompanionLinkStatus;
import com.abba.ainay.domain.model.Profile;
import com.abba.ainay.domain.model.ProfileRole;
import com.abba.ainay.domain.model.PushSubscription;
import com.abba.ainay.domain.repository.CompanionLinkRepository;
import com.abba.ainay.domain.repository.ProfileRepository;
import com.abba.ainay.domain.repository.PushSubscriptionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CompanionServiceImpl")
class CompanionServiceImplTest {

    @Mock
    private CompanionLinkRepository companionLinkRepository;
    @Mock
    private ProfileRepository profileRepository;
    @Mock
    private PushSubscriptionRepository pushSubscriptionRepository;

    @InjectMocks
    private CompanionServiceImpl service;

    @Test
    @DisplayName("groups accepted companions by patient with their contacts")
    void groupsByPatient() {
        when(companionLinkRepository.findByPatientIdInAndStatus(anyCollection(), eq(CompanionLinkStatus.ACCEPTED)))
                .thenReturn(List.of(link("p-1", "c-1"), link("p-1", "c-2"), link("p-2", "c-1")));
        when(profileRepository.findAllById(anyIterable())).thenReturn(List.of(
                profile("c-1", "Ana", "ana@example.com", "555"),
                profile("c-2", "Beto", null, null)));
        when(pushSubscriptionRepository.findByUserIdIn(anyCollection())).thenReturn(List.of(
                subscription("c-2", "tok-1"), subscription("c-2", "tok-2")));

        Map<String, List<Recipient>> recipients = service.resolveRecipients(List.of("p-1", "p-2"));

        assertThat(recipients.get("p-1")).extracting(Recipient::id).containsExactly("c-1", "c-2");
        assertThat(recipients.get("p-2")).singleElement().satisfies(recipient -> {
            assertThat(recipient.name()).isEqualTo("Ana");
            assertThat(recipient.hasEmail()).isTrue();
            assertThat(recipient.hasTelegram()).isTrue();
            assertThat(recipient.hasPush()).isFalse();
        });
        assertThat(recipients.get("p-1").get(1).pushTokens()).containsExactly("tok-1", "tok-2");
        verify(profileRepository, times(1)).findAllById(anyIterable());
        verify(pushSubscriptionRepository, times(1)).findByUserIdIn(anyCollection());
    }

    @Test
    @DisplayName("profile failures fall back to placeholder names")
    void profileFailureFallsBack() {
        when(companionLinkRepository.findByPatientIdInAndStatus(anyCollection(), eq(CompanionLinkStatus.ACCEPTED)))
                .thenReturn(List.of(link("p-1", "c-1")));
        when(profileRepository.findAllById(anyIterable())).thenThrow(new DataAccessResourceFailureException("down"));
        when(pushSubscriptionRepository.findByUserIdIn(anyCollection())).thenReturn(List.of(subscription("c-1", "tok")));

        Recipient recipient = service.resolveRecipients(List.of("p-1")).get("p-1").get(0);

        assertThat(recipient.name()).isEqualTo(CompanionServiceImpl.FALLBACK_COMPANION_NAME);
        assertThat(recipient.hasEmail()).isFalse();
        assertThat(recipient.hasPush()).isTrue();
    }

    @Test
    @DisplayName("link query failures propagate")
    void linkFailurePropagates() {
        when(companionLinkRepository.findByPatientIdInAndStatus(anyCollection(), eq(CompanionLinkStatus.ACCEPTED)))
                .thenThrow(new DataAccessResourceFailureException("down"));

        assertThatThrownBy(() -> service.resolveRecipients(List.of("p-1")))
                .isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("no patients means no queries")
    void emptyInput() {
        assertThat(service.resolveRecipients(List.of())).isEmpty();
        verifyNoInteractions(companionLinkRepository, profileRepository, pushSubscriptionRepository);
    }

    private static CompanionLink link(String patientId, String companionId) {
        CompanionLink link = new CompanionLink();
        link.setPatientId(patientId);
        link.setCompanionId(companionId);
        link.setStatus(CompanionLinkStatus.ACCEPTED);
        return link;
    }

    private static Profile profile(String id, String name, String email, String chatId) {
        Profile profile = new Profile();
        profile.setId(id);
        profile.setName(name);
        profile.setEmail(email);
        profile.setTelegramChatId(chatId);
        profile.setRole(ProfileRole.COMPANION);
        return profile;
    }

    private static PushSubscription subscription(String userId, String token) {
        PushSubscription subscription = new PushSubscription();
        subscription.setUserId(userId);
        subscription.setToken(token);
        return subscription;
    }
}
