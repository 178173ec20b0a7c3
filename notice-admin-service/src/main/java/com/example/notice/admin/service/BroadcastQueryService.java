package com.example.notice.admin.service;

import com.example.notice.admin.dto.BroadcastFilter;
import com.example.notice.admin.dto.BroadcastPageResponse;
import com.example.notice.admin.dto.BroadcastResponse;
import com.example.notice.admin.mapper.AdminBroadcastMapper;
import com.example.notice.shared.exception.ResourceNotFoundException;
import com.example.notice.shared.repository.BroadcastRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class BroadcastQueryService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final BroadcastRepository broadcastRepository;
    private final AdminBroadcastMapper adminBroadcastMapper;

    public BroadcastResponse getBroadcast(Long id) {
        return broadcastRepository.findById(id)
                .map(adminBroadcastMapper::toBroadcastResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Broadcast not found with ID: " + id));
    }

    /**
     * Newest first. Page defaults to 1; limit defaults to 20 and is clamped to 1..100.
     */
    public BroadcastPageResponse listBroadcasts(BroadcastFilter filter) {
        int page = filter.getPage() == null || filter.getPage() < 1 ? 1 : filter.getPage();
        int limit = filter.getLimit() == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, filter.getLimit()));
        String status = normalizeEnumFilter(filter.getStatus());
        String targetMode = normalizeEnumFilter(filter.getTargetMode());
        String organizationId = blankToNull(filter.getOrganizationId());

        long total = broadcastRepository.countMatching(status, targetMode, organizationId);
        List<BroadcastResponse> items = broadcastRepository
                .search(status, targetMode, organizationId, limit, (long) (page - 1) * limit)
                .stream()
                .map(adminBroadcastMapper::toBroadcastResponse)
                .toList();

        return BroadcastPageResponse.builder()
                .items(items)
                .page(page)
                .limit(limit)
                .total(total)
                .totalPages((int) ((total + limit - 1) / limit))
                .build();
    }

    private static String normalizeEnumFilter(String value) {
        String trimmed = blankToNull(value);
        return trimmed == null ? null : trimmed.toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
