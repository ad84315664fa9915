package com.caffe.emergency.service;

import com.caffe.emergency.model.Alert;
import com.caffe.emergency.model.ChannelConfig;
import com.caffe.emergency.model.NotificationChannel;
import com.caffe.emergency.model.Recipient;
import com.caffe.emergency.service.notify.AlertMessage;
import com.caffe.emergency.service.notify.DeliveryResult;
import com.caffe.emergency.service.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Fans an alert out to every recipient on every channel. Each channel/recipient delivery
 * runs as its own task on the notification executor; a failure is logged, optionally
 * retried on the channel's fallback chain, and never affects the other deliveries.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final Notifier notifier;
    private final RecipientResolver recipientResolver;
    private final ChannelRegistry channelRegistry;
    private final EscalationPolicy escalationPolicy;
    private final AlertMessageFactory messageFactory;
    private final DeliveryStatistics deliveryStatistics;
    private final Executor executor;

    public NotificationDispatcher(Notifier notifier,
                                  RecipientResolver recipientResolver,
                                  ChannelRegistry channelRegistry,
                                  EscalationPolicy escalationPolicy,
                                  AlertMessageFactory messageFactory,
                                  DeliveryStatistics deliveryStatistics,
                                  @Qualifier("notificationExecutor") Executor executor) {
        this.notifier = notifier;
        this.recipientResolver = recipientResolver;
        this.channelRegistry = channelRegistry;
        this.escalationPolicy = escalationPolicy;
        this.messageFactory = messageFactory;
        this.deliveryStatistics = deliveryStatistics;
        this.executor = executor;
    }

    /**
     * Sends a newly created alert on its own channels to its own (or dynamically resolved) recipients.
     */
    public CompletableFuture<DispatchReport> dispatch(Alert alert) {
        AlertMessage message = messageFactory.alertMessage(alert);
        return fanOut(alert, alert.getChannels(), message, channel -> recipientResolver.resolve(alert, channel));
    }

    /**
     * Sends an escalated alert to the fixed escalation contacts on the escalation channels.
     */
    public CompletableFuture<DispatchReport> dispatchEscalation(Alert alert) {
        AlertMessage message = messageFactory.escalationMessage(alert);
        List<NotificationChannel> channels = escalationPolicy.escalationChannels(alert.getSeverity());
        return fanOut(alert, channels, message, channel -> escalationPolicy.escalationRecipients(alert.getSeverity()));
    }

    private CompletableFuture<DispatchReport> fanOut(Alert alert,
                                                     Collection<NotificationChannel> channels,
                                                     AlertMessage message,
                                                     Function<NotificationChannel, List<Recipient>> recipientsFor) {
        if (channels == null || channels.isEmpty()) {
            log.warn("Alert {} has no notification channels, nothing to send", alert.getId());
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }
        try {
            return CompletableFuture
                    .supplyAsync(() -> submitDeliveries(alert, channels, message, recipientsFor), executor)
                    .thenCompose(deliveries -> CompletableFuture
                            .allOf(deliveries.toArray(new CompletableFuture[0]))
                            .thenApply(ignored -> DispatchReport.of(deliveries.stream()
                                    .map(CompletableFuture::join)
                                    .collect(Collectors.toList()))))
                    .whenComplete((report, error) -> {
                        if (error != null) {
                            log.error("❌ {} fan-out for alert {} failed", message.getKind(), alert.getId(), error);
                        } else {
                            log.info("📨 {} fan-out for alert {} finished: {}", message.getKind(), alert.getId(), report);
                        }
                    });
        } catch (RejectedExecutionException e) {
            log.error("❌ Notification executor saturated, {} fan-out for alert {} dropped",
                    message.getKind(), alert.getId(), e);
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }
    }

    private List<CompletableFuture<DispatchReport.Outcome>> submitDeliveries(
            Alert alert,
            Collection<NotificationChannel> channels,
            AlertMessage message,
            Function<NotificationChannel, List<Recipient>> recipientsFor) {

        Set<NotificationChannel> requested = EnumSet.copyOf(channels);
        List<CompletableFuture<DispatchReport.Outcome>> deliveries = new ArrayList<>();

        for (NotificationChannel channel : channelRegistry.inPriorityOrder(channels)) {
            List<Recipient> recipients;
            try {
                recipients = recipientsFor.apply(channel);
            } catch (RuntimeException e) {
                log.warn("Could not resolve {} recipients for alert {}: {}", channel.getValue(), alert.getId(), e.getMessage());
                continue;
            }
            for (Recipient recipient : recipients) {
                deliveries.add(submit(() -> deliver(channel, recipient, requested, message)));
            }
        }
        return deliveries;
    }

    private CompletableFuture<DispatchReport.Outcome> submit(Supplier<DispatchReport.Outcome> delivery) {
        try {
            return CompletableFuture.supplyAsync(delivery, executor)
                    .exceptionally(e -> {
                        log.warn("Delivery task failed: {}", e.getMessage());
                        return DispatchReport.Outcome.FAILED;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Delivery task rejected by saturated executor");
            return CompletableFuture.completedFuture(DispatchReport.Outcome.FAILED);
        }
    }

    private DispatchReport.Outcome deliver(NotificationChannel channel,
                                           Recipient recipient,
                                           Set<NotificationChannel> requested,
                                           AlertMessage message) {
        if (channel.addressOf(recipient).isEmpty()) {
            log.debug("Recipient {} has no {} address, skipped for alert {}",
                    recipient.getName(), channel.getValue(), message.getAlertId());
            return DispatchReport.Outcome.SKIPPED;
        }

        List<NotificationChannel> attemptOrder = new ArrayList<>();
        attemptOrder.add(channel);
        attemptOrder.addAll(channelRegistry.fallbackChain(channel, requested));

        boolean attempted = false;
        for (NotificationChannel candidate : attemptOrder) {
            ChannelConfig config = channelRegistry.config(candidate);
            if (!config.isEnabled()) {
                log.debug("Channel {} disabled, falling back for recipient {}", candidate.getValue(), recipient.getName());
                continue;
            }
            Optional<String> address = candidate.addressOf(recipient);
            if (address.isEmpty()) {
                continue;
            }
            attempted = true;
            if (send(candidate, recipient, address.get(), message)) {
                if (candidate != channel) {
                    log.info("Alert {} reached {} via fallback {} -> {}",
                            message.getAlertId(), recipient.getName(), channel.getValue(), candidate.getValue());
                }
                return DispatchReport.Outcome.DELIVERED;
            }
        }
        // Nothing enabled to try: the recipient was never contacted
        return attempted ? DispatchReport.Outcome.FAILED : DispatchReport.Outcome.SKIPPED;
    }

    private boolean send(NotificationChannel channel, Recipient recipient, String address, AlertMessage message) {
        DeliveryResult result;
        try {
            result = notifier.sendChannel(channel, address, message);
        } catch (RuntimeException e) {
            result = DeliveryResult.failed(e.getMessage());
        }
        deliveryStatistics.recordAttempt(channel, recipient, result.isDelivered());
        if (!result.isDelivered()) {
            log.warn("⚠️ {} delivery of alert {} to {} failed: {}",
                    channel.getValue(), message.getAlertId(), recipient.getName(), result.getError());
        }
        return result.isDelivered();
    }
}
