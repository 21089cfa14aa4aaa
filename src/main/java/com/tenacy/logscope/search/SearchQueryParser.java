package com.tenacy.logscope.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 검색 쿼리 문자열을 {@link SearchTerm} 목록으로 변환한다.
 *
 * <h2>지원 문법</h2>
 * <pre>
 * level:error            정확 일치
 * service:"api gateway"  따옴표로 감싼 정확 일치
 * service:*gateway*      부분 문자열 일치
 * -level:debug           부정
 * "payment failed"       전체 필드 대상 텍스트 검색
 * timeout                전체 필드 대상 텍스트 검색
 * </pre>
 *
 * 모든 항은 AND로 결합된다. 잘못된 입력에도 예외를 던지지 않고 가능한 만큼 TEXT 항으로 해석한다.
 * 닫는 별표가 없는 {@code key:*value}는 별표를 포함한 값 전체에 대한 정확 일치로 처리된다.
 */
@Component
@Slf4j
public class SearchQueryParser {

    private static final char SPACE = ' ';
    private static final char QUOTE = '"';
    private static final char COLON = ':';
    private static final char ASTERISK = '*';
    private static final char MINUS = '-';

    public List<SearchTerm> parse(String query) {
        if (query == null || query.isBlank()) {
            return Collections.emptyList();
        }

        List<SearchTerm> terms = new ArrayList<>();
        int length = query.length();
        int pos = 0;

        while (pos < length) {
            pos = skipSpaces(query, pos);
            if (pos >= length) {
                break;
            }

            boolean negate = query.charAt(pos) == MINUS;
            if (negate) {
                pos++;
            }

            int colon = findKeySeparator(query, pos);
            if (colon >= 0) {
                String key = query.substring(pos, colon).trim();
                pos = parseKeyedValue(query, colon + 1, key, negate, terms);
            } else {
                pos = parseText(query, pos, negate, terms);
            }
        }

        log.debug("검색 쿼리 파싱 완료: '{}' -> {}", query, terms);
        return terms;
    }

    /**
     * 따옴표 밖에 있고 공백보다 앞선 첫 번째 콜론 위치. 없으면 -1.
     */
    private int findKeySeparator(String query, int from) {
        boolean quoted = false;
        for (int i = from; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == QUOTE) {
                quoted = !quoted;
            } else if (!quoted && c == COLON) {
                return i;
            } else if (!quoted && c == SPACE) {
                return -1;
            }
        }
        return -1;
    }

    private int parseKeyedValue(String query, int start, String key, boolean negate, List<SearchTerm> terms) {
        int length = query.length();

        if (start < length && query.charAt(start) == QUOTE) {
            int end = indexOfOrEnd(query, QUOTE, start + 1);
            terms.add(SearchTerm.keyValue(key, query.substring(start + 1, end), negate));
            return end < length ? end + 1 : end;
        }

        if (start < length && query.charAt(start) == ASTERISK) {
            int valueStart = start + 1;
            int end = valueStart;
            while (end < length && query.charAt(end) != SPACE && query.charAt(end) != ASTERISK) {
                end++;
            }

            if (end < length && query.charAt(end) == ASTERISK) {
                terms.add(SearchTerm.wildcard(key, query.substring(valueStart, end), negate));
                return end + 1;
            }

            // 닫는 별표 없음: 여는 별표를 리터럴로 포함한 정확 일치
            terms.add(SearchTerm.keyValue(key, query.substring(start, end), negate));
            return end;
        }

        int end = indexOfOrEnd(query, SPACE, start);
        terms.add(SearchTerm.keyValue(key, query.substring(start, end), negate));
        return end;
    }

    private int parseText(String query, int start, boolean negate, List<SearchTerm> terms) {
        int length = query.length();

        if (start < length && query.charAt(start) == QUOTE) {
            int end = indexOfOrEnd(query, QUOTE, start + 1);
            terms.add(SearchTerm.text(query.substring(start + 1, end), negate));
            return end < length ? end + 1 : end;
        }

        int end = indexOfOrEnd(query, SPACE, start);
        terms.add(SearchTerm.text(query.substring(start, end), negate));
        return end;
    }

    private static int skipSpaces(String query, int pos) {
        while (pos < query.length() && query.charAt(pos) == SPACE) {
            pos++;
        }
        return pos;
    }

    private static int indexOfOrEnd(String query, char target, int from) {
        int index = query.indexOf(target, from);
        return index >= 0 ? index : query.length();
    }
}
