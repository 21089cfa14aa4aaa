package com.tenacy.logscope.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

public class SearchQueryParserTest {

    private final SearchQueryParser parser = new SearchQueryParser();

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    @DisplayName("빈 쿼리 - 빈 목록 반환")
    void parse_BlankQuery_ShouldReturnEmpty(String query) {
        assertThat(parser.parse(query)).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("따옴표 값 - 정확 일치 항으로 파싱")
    void parse_QuotedKeyValue() {
        // when
        List<SearchTerm> terms = parser.parse("level:\"error\"");

        // then
        assertThat(terms).containsExactly(SearchTerm.keyValue("level", "error", false));
    }

    @Test
    @DisplayName("따옴표 값 - 공백 포함 값 유지")
    void parse_QuotedValueWithSpaces() {
        List<SearchTerm> terms = parser.parse("service:\"api gateway\" level:warn");

        assertThat(terms).containsExactly(
                SearchTerm.keyValue("service", "api gateway", false),
                SearchTerm.keyValue("level", "warn", false));
    }

    @Test
    @DisplayName("와일드카드 - 별표 사이의 값으로 부분 일치 항 생성")
    void parse_Wildcard() {
        List<SearchTerm> terms = parser.parse("service:*gateway*");

        assertThat(terms).containsExactly(SearchTerm.wildcard("service", "gateway", false));
    }

    @Test
    @DisplayName("와일드카드 - 닫는 별표가 없으면 별표를 포함한 정확 일치")
    void parse_UnclosedWildcard_ShouldFallBackToKeyValue() {
        List<SearchTerm> terms = parser.parse("service:*gate other");

        assertThat(terms).containsExactly(
                SearchTerm.keyValue("service", "*gate", false),
                SearchTerm.text("other", false));
    }

    @Test
    @DisplayName("부정 - 키 값 항에 부정 플래그 설정")
    void parse_NegatedKeyValue() {
        List<SearchTerm> terms = parser.parse("-level:debug");

        assertThat(terms).containsExactly(SearchTerm.keyValue("level", "debug", true));
    }

    @Test
    @DisplayName("텍스트 - 따옴표 구문은 하나의 텍스트 항")
    void parse_QuotedText() {
        List<SearchTerm> terms = parser.parse("\"payment failed\"");

        assertThat(terms).containsExactly(SearchTerm.text("payment failed", false));
    }

    @Test
    @DisplayName("텍스트 - 공백으로 구분된 단어는 각각의 항")
    void parse_PlainWords() {
        List<SearchTerm> terms = parser.parse("  timeout   -retry ");

        assertThat(terms).containsExactly(
                SearchTerm.text("timeout", false),
                SearchTerm.text("retry", true));
    }

    @Test
    @DisplayName("따옴표 안의 콜론은 키 구분자로 보지 않음")
    void parse_ColonInsideQuotes_ShouldBeText() {
        List<SearchTerm> terms = parser.parse("\"host:8080\"");

        assertThat(terms).containsExactly(SearchTerm.text("host:8080", false));
    }

    @Test
    @DisplayName("복합 쿼리 - 순서대로 모든 항 파싱")
    void parse_MixedQuery() {
        List<SearchTerm> terms = parser.parse("level:error service:*pay* -env:\"staging\" \"card declined\"");

        assertThat(terms).containsExactly(
                SearchTerm.keyValue("level", "error", false),
                SearchTerm.wildcard("service", "pay", false),
                SearchTerm.keyValue("env", "staging", true),
                SearchTerm.text("card declined", false));
    }

    @Test
    @DisplayName("닫히지 않은 따옴표 - 문자열 끝까지 값으로 사용")
    void parse_UnterminatedQuote() {
        assertThat(parser.parse("message:\"broken pipe"))
                .containsExactly(SearchTerm.keyValue("message", "broken pipe", false));
        assertThat(parser.parse("\"broken pipe"))
                .containsExactly(SearchTerm.text("broken pipe", false));
    }

    @Test
    @DisplayName("키 앞뒤 공백 없이 원래 대소문자 유지")
    void parse_PreservesValueCase() {
        List<SearchTerm> terms = parser.parse("Service:API-Gateway");

        assertThat(terms).containsExactly(SearchTerm.keyValue("Service", "API-Gateway", false));
    }

    @ParameterizedTest
    @ValueSource(strings = {"-", ":", "::", "\"", "a:\"", "*:*", "-\"", "key:*", "- -", "\":\""})
    @DisplayName("잘못된 쿼리 - 예외 없이 파싱")
    void parse_MalformedInput_ShouldNotThrow(String query) {
        assertDoesNotThrow(() -> parser.parse(query));
    }
}
