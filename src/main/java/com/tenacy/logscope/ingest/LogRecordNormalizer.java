package com.tenacy.logscope.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tenacy.logscope.domain.LogRecord;
import com.tenacy.logscope.search.FieldValues;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * 임의 형태의 로그 페이로드를 {@link LogRecord}로 정규화한다. 어떤 입력에도 예외를 던지지 않는다.
 */
@Component
public class LogRecordNormalizer {

    static final List<String> MESSAGE_ALIASES = List.of("message", "msg", "body");
    static final List<String> LEVEL_ALIASES = List.of("level", "severity");
    static final List<String> SERVICE_ALIASES = List.of("service", "serviceName", "service_name");

    static final String DEFAULT_LEVEL = "info";
    static final String DEFAULT_SERVICE = "system";

    // attributes로 옮기지 않는 필드
    private static final Set<String> RESERVED_FIELDS = Set.of(
            LogRecord.ID, LogRecord.TIMESTAMP, LogRecord.MESSAGE, LogRecord.LEVEL, LogRecord.SERVICE);

    private final Clock clock;

    public LogRecordNormalizer() {
        this(Clock.systemUTC());
    }

    public LogRecordNormalizer(Clock clock) {
        this.clock = clock;
    }

    public LogRecord normalize(JsonNode payload) {
        return normalize(payload, null);
    }

    /**
     * @param payload        수신한 로그 페이로드. 객체가 아니면 message 하나만 가진 객체로 감싼다.
     * @param headerService  전송 계층에서 전달된 서비스 이름 (있으면 페이로드 값보다 우선)
     */
    public LogRecord normalize(JsonNode payload, String headerService) {
        ObjectNode source = asObject(payload);

        String message = firstPresent(source, MESSAGE_ALIASES);
        if (message == null) {
            message = source.toString();
        }

        String level = firstPresent(source, LEVEL_ALIASES);

        String service = StringUtils.hasText(headerService)
                ? headerService
                : firstPresent(source, SERVICE_ALIASES);

        ObjectNode attributes = JsonNodeFactory.instance.objectNode();
        source.fields().forEachRemaining(entry -> {
            if (!RESERVED_FIELDS.contains(entry.getKey())) {
                attributes.set(entry.getKey(), entry.getValue().deepCopy());
            }
        });

        return LogRecord.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(TimestampNormalizer.normalize(source.get(LogRecord.TIMESTAMP), clock.instant()))
                .message(message)
                .level(level != null ? level : DEFAULT_LEVEL)
                .service(service != null ? service : DEFAULT_SERVICE)
                .attributes(attributes)
                .build();
    }

    private static ObjectNode asObject(JsonNode payload) {
        if (payload instanceof ObjectNode objectNode) {
            return objectNode;
        }

        ObjectNode wrapped = JsonNodeFactory.instance.objectNode();
        if (TimestampNormalizer.isPresent(payload)) {
            wrapped.put(LogRecord.MESSAGE, FieldValues.stringify(payload));
        }
        return wrapped;
    }

    private static String firstPresent(ObjectNode source, List<String> aliases) {
        for (String alias : aliases) {
            JsonNode value = source.get(alias);
            if (TimestampNormalizer.isPresent(value)) {
                return FieldValues.stringify(value);
            }
        }
        return null;
    }
}
