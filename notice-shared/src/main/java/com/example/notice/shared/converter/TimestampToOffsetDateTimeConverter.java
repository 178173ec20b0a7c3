package com.example.notice.shared.converter;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Reads {@code TIMESTAMP WITH TIME ZONE} columns that the driver hands back as {@link Timestamp}.
 */
@ReadingConverter
public class TimestampToOffsetDateTimeConverter implements Converter<Timestamp, OffsetDateTime> {

    @Override
    public OffsetDateTime convert(Timestamp source) {
        return source == null ? null : source.toInstant().atOffset(ZoneOffset.UTC);
    }
}
