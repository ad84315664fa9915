package com.caffe.emergency.service;

import com.caffe.emergency.config.EmergencyProperties;
import com.caffe.emergency.model.*;
import com.caffe.emergency.service.directory.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Resolves who receives an alert on a given channel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecipientResolver {

    private final UserDirectory userDirectory;
    private final ChannelRegistry channelRegistry;
    private final EmergencyProperties properties;

    /**
     * Explicit recipients when the alert has any. Otherwise every active user holding one of
     * the dynamic roles, narrowed to the alert's parish for parish-scoped channels. If nobody
     * in the parish qualifies the unscoped set is used.
     */
    public List<Recipient> resolve(Alert alert, NotificationChannel channel) {
        if (alert.hasExplicitRecipients()) {
            return alert.getRecipients();
        }

        Map<Long, User> candidates = new LinkedHashMap<>();
        for (UserRole role : properties.getDynamicRoles()) {
            for (User user : userDirectory.usersByRole(role)) {
                if (user.isActive()) {
                    candidates.putIfAbsent(user.getId(), user);
                }
            }
        }

        String parish = alert.getParish();
        if (channelRegistry.config(channel).isParishScoped() && parish != null) {
            Set<Long> inParish = userDirectory.usersByParish(parish).stream()
                    .map(User::getId)
                    .collect(Collectors.toSet());
            List<User> narrowed = candidates.values().stream()
                    .filter(user -> inParish.contains(user.getId()))
                    .collect(Collectors.toList());
            if (!narrowed.isEmpty()) {
                return toRecipients(narrowed);
            }
            log.debug("No {} recipients in parish {} for alert {}, using all roles",
                    channel.getValue(), parish, alert.getId());
        }
        return toRecipients(candidates.values());
    }

    private List<Recipient> toRecipients(Collection<User> users) {
        return users.stream().map(User::toRecipient).collect(Collectors.toList());
    }
}
