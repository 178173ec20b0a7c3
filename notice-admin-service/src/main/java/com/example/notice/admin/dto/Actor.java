package com.example.notice.admin.dto;

import lombok.Value;

/**
 * The authenticated principal behind an admin call, as asserted by the gateway.
 */
@Value
public class Actor {
    String id;
    String role;
}
