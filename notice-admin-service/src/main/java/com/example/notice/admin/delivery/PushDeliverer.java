package com.example.notice.admin.delivery;

import com.example.notice.shared.exception.ChannelDeliveryException;
import com.example.notice.shared.model.DeliveryReport;
import com.example.notice.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class PushDeliverer {

    private final PushGateway pushGateway;

    /**
     * One topic message for the whole audience. Any failure fails the channel.
     */
    public DeliveryReport.Push sendPush(BroadcastContent content) {
        try {
            String topic = PushTopics.forTarget(content.getTargetMode(), content.getOrganizationId());

            Map<String, String> data = new LinkedHashMap<>();
            data.put("type", Constants.InboxType.BROADCAST.name());
            data.put("broadcastType", content.getType());
            data.put("targetMode", content.getTargetMode().name());
            data.put("broadcastId", String.valueOf(content.getBroadcastId()));
            data.put("organizationId", content.getOrganizationId() == null ? "" : content.getOrganizationId());

            String messageId = pushGateway.sendToTopic(topic, PushMessage.builder()
                    .title(content.getTitle())
                    .body(content.getMessage())
                    .data(data)
                    .build());
            log.info("Broadcast {}: push sent to topic {} as {}", content.getBroadcastId(), topic, messageId);
            return new DeliveryReport.Push(topic, messageId);
        } catch (RuntimeException e) {
            throw new ChannelDeliveryException(Constants.Channel.PUSH, e.getMessage(), e);
        }
    }
}
