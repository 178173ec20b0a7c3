package com.example.notice.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-channel delivery statistics of a broadcast, stored as JSON on the broadcast row.
 * A channel that was not requested, or whose call failed as a whole, has no entry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryReport {
    private InApp inApp;
    private Email email;
    private Push push;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InApp {
        private int created;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Email {
        private int attempted;
        private int sent;
        private int failed;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Push {
        private String topic;
        private String messageId;
    }
}
