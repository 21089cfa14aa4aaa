package com.tenacy.logscope.ingest;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * 다양한 형태의 타임스탬프를 밀리초 정밀도의 ISO-8601 UTC 문자열로 맞춘다.
 * <ul>
 *   <li>숫자: epoch 밀리초</li>
 *   <li>'-'를 포함한 문자열: 이미 ISO 형식으로 보고 그대로 사용</li>
 *   <li>그 외 문자열: epoch 밀리초 숫자 문자열</li>
 *   <li>없음: 현재 시각</li>
 * </ul>
 * 해석할 수 없는 숫자 문자열은 {@link #INVALID_TIMESTAMP}가 되며, 문자열 정렬 시 모든 정상 값보다 뒤에 온다.
 */
public final class TimestampNormalizer {

    public static final String INVALID_TIMESTAMP = "Invalid Date";

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    // ECMAScript Date 범위 (±100,000,000일)
    private static final double MAX_EPOCH_MILLIS = 8.64e15;

    private TimestampNormalizer() {
    }

    public static String normalize(JsonNode value, Instant now) {
        if (!isPresent(value)) {
            return format(now);
        }

        if (value.isNumber()) {
            return fromEpochMillis(value.asDouble());
        }

        if (value.isTextual()) {
            String text = value.asText();
            if (text.contains("-")) {
                return text;
            }
            return fromEpochMillis(parseNumber(text));
        }

        return format(now);
    }

    public static String format(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    private static String fromEpochMillis(double millis) {
        if (Double.isNaN(millis) || Double.isInfinite(millis) || Math.abs(millis) > MAX_EPOCH_MILLIS) {
            return INVALID_TIMESTAMP;
        }

        try {
            return format(Instant.ofEpochMilli((long) millis));
        } catch (DateTimeException e) {
            return INVALID_TIMESTAMP;
        }
    }

    private static double parseNumber(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isNumber()) {
            return value.asDouble() != 0;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return true;
    }
}
