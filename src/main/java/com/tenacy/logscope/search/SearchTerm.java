package com.tenacy.logscope.search;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class SearchTerm {
    SearchTermType type;
    String key;
    String value;
    boolean negate;

    public static SearchTerm text(String value, boolean negate) {
        return new SearchTerm(SearchTermType.TEXT, null, value, negate);
    }

    public static SearchTerm keyValue(String key, String value, boolean negate) {
        return new SearchTerm(SearchTermType.KEY_VALUE, key, value, negate);
    }

    public static SearchTerm wildcard(String key, String value, boolean negate) {
        return new SearchTerm(SearchTermType.WILDCARD, key, value, negate);
    }
}
