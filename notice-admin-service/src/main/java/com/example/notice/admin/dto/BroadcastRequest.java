package com.example.notice.admin.dto;

import com.example.notice.shared.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Body of a create-broadcast call. Organization id and non-empty channels are checked by the
 * orchestrator, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BroadcastRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @NotBlank(message = "Message is required")
    @Size(max = 10000, message = "Message must be at most 10000 characters")
    private String message;

    @NotNull(message = "Type is required")
    private Constants.BroadcastType type;

    @NotNull(message = "Target mode is required")
    private Constants.TargetMode targetMode;

    private String organizationId; // required when targetMode is COMPANY

    private List<Constants.Channel> channels;

    private OffsetDateTime scheduledAt; // absent or past means send now
}
