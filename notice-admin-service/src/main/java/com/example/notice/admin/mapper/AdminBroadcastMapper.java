package com.example.notice.admin.mapper;

import com.example.notice.admin.dto.BroadcastRequest;
import com.example.notice.admin.dto.BroadcastResponse;
import com.example.notice.shared.model.BroadcastRecord;
import com.example.notice.shared.model.DeliveryReport;
import com.example.notice.shared.util.Constants;
import com.example.notice.shared.util.JsonUtils;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.time.OffsetDateTime;
import java.util.Set;

@Mapper(componentModel = "spring", imports = { JsonUtils.class, DeliveryReport.class })
public interface AdminBroadcastMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "title", source = "request.title")
    @Mapping(target = "message", source = "request.message")
    @Mapping(target = "type", source = "request.type")
    @Mapping(target = "targetMode", source = "request.targetMode")
    @Mapping(target = "organizationId", source = "request.organizationId")
    @Mapping(target = "scheduledAt", source = "request.scheduledAt")
    @Mapping(target = "channels", expression = "java(JsonUtils.toJsonArray(channels))")
    @Mapping(target = "status", source = "status")
    @Mapping(target = "createdBy", source = "createdBy")
    @Mapping(target = "createdAt", source = "now")
    @Mapping(target = "updatedAt", source = "now")
    @Mapping(target = "sentAt", ignore = true)
    @Mapping(target = "delivery", ignore = true)
    @Mapping(target = "lastError", ignore = true)
    @Mapping(target = "lockedAt", ignore = true)
    @Mapping(target = "lockOwner", ignore = true)
    BroadcastRecord toBroadcastRecord(BroadcastRequest request, Set<Constants.Channel> channels,
                                      String status, String createdBy, OffsetDateTime now);

    @Mapping(target = "channels", expression = "java(JsonUtils.parseJsonArray(broadcast.getChannels()))")
    @Mapping(target = "delivery", expression = "java(JsonUtils.fromJson(broadcast.getDelivery(), DeliveryReport.class))")
    BroadcastResponse toBroadcastResponse(BroadcastRecord broadcast);
}
