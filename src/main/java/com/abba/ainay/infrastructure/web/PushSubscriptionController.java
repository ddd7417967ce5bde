package com.abba.ainay.infrastructure.web;

import com.abba.ainay.application.dto.PushSubscriptionResult;
import com.abba.ainay.application.dto.TestSendResult;
import com.abba.ainay.domain.service.PushSubscriptionService;
import com.abba.ainay.domain.service.TestNotificationService;
import com.abba.ainay.infrastructure.push.FirebasePushGateway;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/push")
public class PushSubscriptionController {

    private static final Logger log = LoggerFactory.getLogger(PushSubscriptionController.class);

    private final PushSubscriptionService pushSubscriptionService;
    private final FirebasePushGateway pushGateway;
    private final TestNotificationService testNotificationService;

    public PushSubscriptionController(PushSubscriptionService pushSubscriptionService,
                                      FirebasePushGateway pushGateway,
                                      TestNotificationService testNotificationService) {
        this.pushSubscriptionService = pushSubscriptionService;
        this.pushGateway = pushGateway;
        this.testNotificationService = testNotificationService;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return Map.of("configured", pushGateway.isConfigured());
    }

    @PostMapping("/subscribe")
    public ResponseEntity<PushSubscriptionResult> subscribe(@Valid @RequestBody SubscriptionRequest request) {
        if (!pushGateway.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        log.info("Subscribing user {} to push", request.userId());
        return ResponseEntity.ok(pushSubscriptionService.subscribe(request.userId(), request.token()));
    }

    @PostMapping("/unsubscribe")
    public Map<String, Object> unsubscribe(@Valid @RequestBody SubscriptionRequest request) {
        log.info("Unsubscribing user {} from push", request.userId());
        return Map.of("success", pushSubscriptionService.unsubscribe(request.userId(), request.token()));
    }

    @PostMapping("/test")
    public ResponseEntity<TestSendResult> sendTest(@Valid @RequestBody TestPushRequest request) {
        if (!pushGateway.isConfigured()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new TestSendResult(false, null, "Push notifications not configured"));
        }
        log.info("Sending test push to user {}", request.userId());
        return ResponseEntity.ok(TestSendResult.from(testNotificationService.sendTestPush(request.userId())));
    }

    public record SubscriptionRequest(@NotBlank String userId, @NotBlank String token) {
    }

    public record TestPushRequest(@NotBlank String userId) {
    }
}
