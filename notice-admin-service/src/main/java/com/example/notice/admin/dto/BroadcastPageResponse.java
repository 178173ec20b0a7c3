package com.example.notice.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastPageResponse {
    private List<BroadcastResponse> items;
    private int page;
    private int limit;
    private long total;
    private int totalPages;
}
