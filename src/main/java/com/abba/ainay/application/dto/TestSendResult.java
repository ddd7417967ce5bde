package com.abba.ainay.application.dto;

import com.abba.ainay.domain.service.ChannelGateway.DeliveryResult;

public record TestSendResult(
        boolean success,
        String messageId,
        String error
) {

    public static TestSendResult from(DeliveryResult result) {
        return new TestSendResult(result.success(), result.messageId(), result.error());
    }
}
