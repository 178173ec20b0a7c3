package com.example.notice.admin.delivery;

import com.example.notice.shared.config.AppProperties;
import com.example.notice.shared.exception.ChannelDeliveryException;
import com.example.notice.shared.model.InboxNotification;
import com.example.notice.shared.model.Recipient;
import com.example.notice.shared.repository.InboxNotificationRepository;
import com.example.notice.shared.util.Constants;
import com.example.notice.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class InAppDeliverer {

    private final InboxNotificationRepository inboxNotificationRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    /**
     * Writes one inbox row per recipient in fixed-size batches.
     *
     * @return number of rows actually created
     * @throws ChannelDeliveryException if rows were offered and none could be written
     */
    public int createInAppNotifications(List<Recipient> recipients, BroadcastContent content) {
        if (recipients.isEmpty()) {
            return 0;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("broadcastId", String.valueOf(content.getBroadcastId()));
        metadata.put("broadcastType", content.getType());
        String metadataJson = JsonUtils.toJson(metadata);
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<InboxNotification> rows = recipients.stream()
                .map(recipient -> InboxNotification.builder()
                        .userId(recipient.getUserId())
                        .companyId(recipient.getCompanyId())
                        .type(Constants.InboxType.BROADCAST.name())
                        .title(content.getTitle())
                        .description(content.getMessage())
                        .link(Constants.INBOX_LINK)
                        .targetMode(content.getTargetMode().name())
                        .createdBy(content.getCreatedBy())
                        .metadata(metadataJson)
                        .createdAt(now)
                        .build())
                .toList();

        int batchSize = appProperties.getDelivery().getInAppBatchSize();
        int created = 0;
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<InboxNotification> batch = rows.subList(from, Math.min(from + batchSize, rows.size()));
            created += inboxNotificationRepository.insertUnordered(content.getBroadcastId(), batch);
        }

        if (created == 0) {
            throw new ChannelDeliveryException(Constants.Channel.IN_APP,
                    "none of " + rows.size() + " inbox rows could be created");
        }
        if (created < rows.size()) {
            log.warn("Broadcast {}: created {} of {} inbox rows", content.getBroadcastId(), created, rows.size());
        }
        return created;
    }
}
