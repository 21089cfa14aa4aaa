package com.tenacy.logscope.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.logscope.domain.LogRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 파싱된 검색 항을 로그 레코드에 적용한다. 상태가 없으므로 여러 스레드에서 동시에 사용해도 된다.
 */
@Component
public class SearchTermMatcher {

    /**
     * 모든 항이 (부정 적용 후) 참이면 일치. 빈 목록은 항상 일치한다.
     */
    public boolean matches(LogRecord record, List<SearchTerm> terms) {
        if (terms == null || terms.isEmpty()) {
            return true;
        }

        for (SearchTerm term : terms) {
            if (!matches(record, term)) {
                return false;
            }
        }
        return true;
    }

    public boolean matches(LogRecord record, SearchTerm term) {
        boolean matched = switch (term.getType()) {
            case KEY_VALUE -> record.lookup(term.getKey())
                    .map(value -> FieldValues.equalsIgnoreCase(value, term.getValue()))
                    .orElse(false);
            case WILDCARD -> record.lookup(term.getKey())
                    .map(value -> FieldValues.containsIgnoreCase(value, term.getValue()))
                    .orElse(false);
            case TEXT -> anyFieldContains(record, term.getValue());
        };

        return term.isNegate() != matched;
    }

    public List<LogRecord> filter(List<LogRecord> records, List<SearchTerm> terms) {
        if (terms == null || terms.isEmpty()) {
            return records;
        }

        return records.stream()
                .filter(record -> matches(record, terms))
                .collect(Collectors.toList());
    }

    private boolean anyFieldContains(LogRecord record, String fragment) {
        for (JsonNode field : record.fields().values()) {
            // null 값은 텍스트 검색 대상이 아님
            if (field.isNull()) {
                continue;
            }
            if (FieldValues.containsIgnoreCase(field, fragment)) {
                return true;
            }
        }
        return false;
    }
}
