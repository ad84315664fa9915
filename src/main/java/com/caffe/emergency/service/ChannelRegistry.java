package com.caffe.emergency.service;

import com.caffe.emergency.config.EmergencyProperties;
import com.caffe.emergency.model.ChannelConfig;
import com.caffe.emergency.model.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Channel table: enablement, dispatch priority and fallback links.
 */
@Component
@Slf4j
public class ChannelRegistry {

    private final Map<NotificationChannel, ChannelConfig> configs = new EnumMap<>(NotificationChannel.class);

    public ChannelRegistry(EmergencyProperties properties) {
        for (ChannelConfig config : properties.getChannels()) {
            configs.put(config.getChannel(), config);
        }
        for (NotificationChannel channel : NotificationChannel.values()) {
            if (!configs.containsKey(channel)) {
                log.warn("No configuration for channel {}, treating it as disabled", channel.getValue());
                configs.put(channel, ChannelConfig.builder()
                        .id(channel.getValue())
                        .name(channel.getValue())
                        .channel(channel)
                        .enabled(false)
                        .priority(Integer.MAX_VALUE)
                        .build());
            }
        }
    }

    public ChannelConfig config(NotificationChannel channel) {
        return configs.get(channel);
    }

    public List<ChannelConfig> listChannels() {
        return configs.values().stream()
                .sorted(Comparator.comparingInt(ChannelConfig::getPriority))
                .collect(Collectors.toList());
    }

    public Set<NotificationChannel> enabledChannels() {
        return configs.values().stream()
                .filter(ChannelConfig::isEnabled)
                .map(ChannelConfig::getChannel)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(NotificationChannel.class)));
    }

    public List<NotificationChannel> inPriorityOrder(Collection<NotificationChannel> channels) {
        return channels.stream()
                .distinct()
                .sorted(Comparator.comparingInt(channel -> config(channel).getPriority()))
                .collect(Collectors.toList());
    }

    /**
     * Fallback links after {@code channel}, in order. The chain ends at a cycle or at a
     * channel already in {@code requested}, since that channel is dispatched on its own.
     */
    public List<NotificationChannel> fallbackChain(NotificationChannel channel, Set<NotificationChannel> requested) {
        List<NotificationChannel> chain = new ArrayList<>();
        Set<NotificationChannel> seen = EnumSet.of(channel);
        NotificationChannel next = config(channel).getFallback();
        while (next != null && seen.add(next) && !requested.contains(next)) {
            chain.add(next);
            next = config(next).getFallback();
        }
        return chain;
    }
}
