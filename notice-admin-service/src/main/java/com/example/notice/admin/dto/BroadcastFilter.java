package com.example.notice.admin.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Listing criteria. Null filters match everything; paging values are normalized by the query service.
 */
@Value
@Builder
public class BroadcastFilter {
    String status;
    String targetMode;
    String organizationId;
    Integer page;
    Integer limit;
}
