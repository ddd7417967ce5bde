package com.abba.ainay.domain.service;

import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;

/**
 * Sends a fixed sample alert through one channel so an operator can check it end to end.
 */
public interface TestNotificationService {

    DeliveryResult sendTestEmail(String email, String name);

    DeliveryResult sendTestPush(String userId);
}
