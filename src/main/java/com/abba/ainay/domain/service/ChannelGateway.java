package com.abba.ainay.domain.service;

import com.abba.ainay.application.dto.DoseAlert;
import com.abba.ainay.application.dto.Recipient;
import com.abba.ainay.domain.model.NotificationChannel;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * One delivery mechanism. Implementations own their client lifecycle and never throw from
 * {@link #send}: every failure, including a missing contact, completes the future with a failed
 * {@link DeliveryResult}.
 */
public interface ChannelGateway {

    NotificationChannel channel();

    /**
     * Whether credentials are present. An unconfigured channel is skipped for every recipient.
     */
    boolean isConfigured();

    /**
     * Whether the recipient has the contact field this channel needs.
     */
    boolean canReach(Recipient recipient);

    CompletableFuture<DeliveryResult> send(Recipient recipient, DoseAlert alert);

    /**
     * Indexes gateways by channel. Two gateways for one channel is a wiring error.
     */
    static Map<NotificationChannel, ChannelGateway> byChannel(Collection<? extends ChannelGateway> gateways) {
        Map<NotificationChannel, ChannelGateway> byChannel = new EnumMap<>(NotificationChannel.class);
        for (ChannelGateway gateway : gateways) {
            ChannelGateway previous = byChannel.putIfAbsent(gateway.channel(), gateway);
            if (previous != null) {
                throw new IllegalStateException("Duplicate gateway for channel " + gateway.channel());
            }
        }
        return byChannel;
    }

    /**
     * @param staleAddresses addresses the provider reported as permanently gone; the caller
     *                       deregisters them
     */
    record DeliveryResult(
            boolean success,
            String messageId,
            List<String> staleAddresses,
            String error
    ) {

        public DeliveryResult {
            staleAddresses = staleAddresses == null ? List.of() : List.copyOf(staleAddresses);
        }

        public static DeliveryResult delivered(String messageId) {
            return new DeliveryResult(true, messageId, List.of(), null);
        }

        public static DeliveryResult failed(String error) {
            return new DeliveryResult(false, null, List.of(), error);
        }

        public boolean permanentFailure() {
            return !staleAddresses.isEmpty();
        }
    }
}
