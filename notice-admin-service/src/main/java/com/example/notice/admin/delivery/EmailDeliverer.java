package com.example.notice.admin.delivery;

import com.example.notice.shared.concurrent.BoundedConcurrencyExecutor;
import com.example.notice.shared.exception.ChannelDeliveryException;
import com.example.notice.shared.model.DeliveryReport;
import com.example.notice.shared.model.Recipient;
import com.example.notice.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
@RequiredArgsConstructor
public class EmailDeliverer {

    private final EmailTransport emailTransport;
    private final BoundedConcurrencyExecutor emailFanOutExecutor;

    /**
     * Sends one mail per recipient that has an address. A failed recipient is counted and skipped.
     *
     * @throws ChannelDeliveryException if the dispatch as a whole could not run
     */
    public DeliveryReport.Email sendEmails(List<Recipient> recipients, BroadcastContent content) {
        List<Recipient> addressed = recipients.stream().filter(Recipient::hasEmail).toList();
        AtomicInteger sent = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        try {
            emailFanOutExecutor.forEach(addressed, recipient -> {
                try {
                    emailTransport.send(recipient.getEmail(), content.getTitle(),
                            Constants.EMAIL_TEMPLATE_BROADCAST, templateData(recipient, content));
                    sent.incrementAndGet();
                } catch (RuntimeException e) {
                    failed.incrementAndGet();
                    log.warn("Broadcast {}: email to {} failed: {}",
                            content.getBroadcastId(), recipient.getEmail(), e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            throw new ChannelDeliveryException(Constants.Channel.EMAIL, e.getMessage(), e);
        }

        log.info("Broadcast {}: emails attempted={}, sent={}, failed={}",
                content.getBroadcastId(), addressed.size(), sent.get(), failed.get());
        return new DeliveryReport.Email(addressed.size(), sent.get(), failed.get());
    }

    private static Map<String, String> templateData(Recipient recipient, BroadcastContent content) {
        String recipientName = recipient.getName() != null && !recipient.getName().isBlank()
                ? recipient.getName()
                : recipient.getEmail();
        return Map.of(
                "title", content.getTitle(),
                "message", content.getMessage(),
                "type", content.getType(),
                "recipientName", recipientName);
    }
}
