package com.tenacy.logscope.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenacy.logscope.domain.LogRecord;
import com.tenacy.logscope.store.LogStore;
import io.micrometer.core.instrument.Counter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class LogIngestService {

    private final LogRecordNormalizer normalizer;
    private final LogStore logStore;
    private final ObjectMapper objectMapper;
    private final Counter ingestedLogsCounter;

    /**
     * 단일 객체 또는 객체 배열을 정규화하여 저장한다.
     *
     * @param headerService 전송 계층의 서비스 이름 (service.name 헤더)
     */
    public List<LogRecord> ingest(JsonNode body, String headerService) {
        if (body == null || body.isMissingNode()) {
            return Collections.emptyList();
        }

        if (body instanceof ArrayNode array) {
            List<LogRecord> records = new ArrayList<>(array.size());
            array.forEach(element -> records.add(normalizer.normalize(element, headerService)));

            logStore.insertAll(records);
            ingestedLogsCounter.increment(records.size());
            log.debug("로그 {}건 일괄 수집 완료", records.size());
            return records;
        }

        LogRecord record = normalizer.normalize(body, headerService);
        logStore.insert(record);
        ingestedLogsCounter.increment();
        log.debug("로그 수집 완료: {}", record.getId());
        return List.of(record);
    }

    /**
     * 한 줄의 로그 텍스트를 수집한다. JSON 객체가 아니면 줄 전체를 message로 사용한다.
     */
    public LogRecord ingestLine(String line, String service) {
        JsonNode payload = parseLine(line);
        List<LogRecord> records = ingest(payload, service);
        return records.get(0);
    }

    private JsonNode parseLine(String line) {
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.put(LogRecord.MESSAGE, line);

        if (line == null || line.isBlank()) {
            return fallback;
        }

        try {
            JsonNode node = objectMapper.readTree(line);
            return node instanceof ObjectNode ? node : fallback;
        } catch (JsonProcessingException e) {
            log.debug("JSON이 아닌 로그 라인, 텍스트로 수집: {}", e.getOriginalMessage());
            return fallback;
        }
    }
}
