package com.tenacy.logscope.search;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * 검색 비교를 위한 필드 값 문자열 변환.
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * 문자열은 그대로, 숫자/불리언은 텍스트로, 객체/배열은 JSON 직렬화 형태로 변환한다.
     */
    public static String stringify(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null";
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    public static boolean equalsIgnoreCase(JsonNode value, String expected) {
        return stringify(value).equalsIgnoreCase(expected);
    }

    public static boolean containsIgnoreCase(JsonNode value, String fragment) {
        return containsIgnoreCase(stringify(value), fragment);
    }

    public static boolean containsIgnoreCase(String text, String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return true;
        }
        return text.toLowerCase(Locale.ROOT).contains(fragment.toLowerCase(Locale.ROOT));
    }
}
