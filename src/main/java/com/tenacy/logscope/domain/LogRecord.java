package com.tenacy.logscope.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.Builder;
import lombok.Value;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 저장/검색의 기본 단위가 되는 정규화된 로그 레코드.
 * <p>
 * 핵심 필드(id, timestamp, message, level, service) 외의 값은 모두 {@code attributes}에 JSON 트리로 보관된다.
 * 직렬화 시 attributes는 최상위 필드로 펼쳐진다.
 */
@Value
@Builder(toBuilder = true)
public class LogRecord {

    public static final String ID = "id";
    public static final String TIMESTAMP = "timestamp";
    public static final String MESSAGE = "message";
    public static final String LEVEL = "level";
    public static final String SERVICE = "service";

    String id;
    String timestamp;
    String message;
    String level;
    String service;

    @JsonIgnore
    ObjectNode attributes;

    @JsonIgnore
    public ObjectNode getAttributes() {
        return attributes != null ? attributes : JsonNodeFactory.instance.objectNode();
    }

    @JsonAnyGetter
    public Map<String, JsonNode> attributeMap() {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        getAttributes().fields().forEachRemaining(entry -> values.put(entry.getKey(), entry.getValue()));
        return values;
    }

    /**
     * 이름으로 필드 값을 찾는다. 핵심 필드를 먼저 확인하고 없으면 attributes를 본다.
     */
    public Optional<JsonNode> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }

        String coreValue = coreField(key);
        if (coreValue != null) {
            return Optional.of(TextNode.valueOf(coreValue));
        }

        return Optional.ofNullable(getAttributes().get(key));
    }

    /**
     * 핵심 필드와 attributes를 합친 전체 필드 목록 (선언 순서 유지).
     */
    public Map<String, JsonNode> fields() {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        putIfPresent(values, ID, id);
        putIfPresent(values, TIMESTAMP, timestamp);
        putIfPresent(values, MESSAGE, message);
        putIfPresent(values, LEVEL, level);
        putIfPresent(values, SERVICE, service);

        Iterator<Map.Entry<String, JsonNode>> it = getAttributes().fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            values.putIfAbsent(entry.getKey(), entry.getValue());
        }
        return values;
    }

    private String coreField(String key) {
        return switch (key) {
            case ID -> id;
            case TIMESTAMP -> timestamp;
            case MESSAGE -> message;
            case LEVEL -> level;
            case SERVICE -> service;
            default -> null;
        };
    }

    private static void putIfPresent(Map<String, JsonNode> values, String key, String value) {
        if (value != null) {
            values.put(key, TextNode.valueOf(value));
        }
    }
}
