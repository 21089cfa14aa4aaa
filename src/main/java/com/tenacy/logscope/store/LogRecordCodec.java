package com.tenacy.logscope.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenacy.logscope.domain.LogRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link LogRecord}와 저장소 행({@link LogRow}) 사이의 변환.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LogRecordCodec {

    private final ObjectMapper objectMapper;

    public LogRow toRow(LogRecord record) {
        return LogRow.builder()
                .id(record.getId())
                .timestamp(record.getTimestamp())
                .message(record.getMessage())
                .level(record.getLevel())
                .service(record.getService())
                .data(record.getAttributes().toString())
                .build();
    }

    public LogRecord toRecord(LogRow row) {
        return LogRecord.builder()
                .id(row.getId())
                .timestamp(row.getTimestamp())
                .message(row.getMessage())
                .level(row.getLevel())
                .service(row.getService())
                .attributes(readAttributes(row))
                .build();
    }

    private ObjectNode readAttributes(LogRow row) {
        String data = row.getData();
        if (data == null || data.isBlank()) {
            return objectMapper.createObjectNode();
        }

        try {
            JsonNode node = objectMapper.readTree(data);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            log.warn("로그 {}의 속성 데이터가 객체 형식이 아님, 무시함", row.getId());
        } catch (JsonProcessingException e) {
            log.warn("로그 {}의 속성 데이터 파싱 실패: {}", row.getId(), e.getMessage());
        }
        return objectMapper.createObjectNode();
    }
}
