package com.example.notice.shared.model;

import lombok.Builder;
import lombok.Value;

/**
 * One resolved principal a broadcast is delivered to. Built fresh for every delivery run.
 */
@Value
@Builder
public class Recipient {
    String userId;
    String email;
    String name;
    String companyId;

    public boolean hasEmail() {
        return email != null && !email.isBlank();
    }
}
