package com.tenacy.logscope.query;

import com.tenacy.logscope.search.SearchQueryParser;
import com.tenacy.logscope.search.SearchTerm;
import com.tenacy.logscope.store.StorePredicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

public class QueryPlannerTest {

    private final QueryPlanner planner = new QueryPlanner(new SearchQueryParser());

    @ParameterizedTest
    @ValueSource(strings = {"timeout", "payment failed", "api gateway 502", "user@example.com", "a.b/c"})
    @DisplayName("고급 문법이 없는 쿼리는 단순 쿼리로 분류")
    void isAdvancedQuery_PlainText(String query) {
        assertThat(QueryPlanner.isAdvancedQuery(query)).isFalse();
        assertThat(planner.plan(LogQueryCriteria.builder().query(query).build())).isInstanceOf(SimplePlan.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"level:error", "-debug", "service:*api*", "\"exact phrase\"", "api-gateway"})
    @DisplayName(": - * \" 중 하나라도 있으면 고급 쿼리")
    void isAdvancedQuery_SpecialCharacters(String query) {
        assertThat(QueryPlanner.isAdvancedQuery(query)).isTrue();
    }

    @Test
    @DisplayName("단순 쿼리 - 키워드와 페이지네이션을 저장소에 위임")
    void plan_SimpleQuery_ShouldPushDown() {
        // given
        LogQueryCriteria criteria = LogQueryCriteria.builder()
                .query("timeout")
                .level("error")
                .service("api")
                .startDate("2024-01-01T00:00:00.000Z")
                .endDate("2024-12-31T23:59:59.999Z")
                .limit(50)
                .offset(100)
                .build();

        // when
        QueryPlan plan = planner.plan(criteria);

        // then
        assertThat(plan).isInstanceOf(SimplePlan.class);
        assertThat(plan.getPredicate()).isEqualTo(StorePredicate.builder()
                .keyword("timeout")
                .level("error")
                .service("api")
                .startDate("2024-01-01T00:00:00.000Z")
                .endDate("2024-12-31T23:59:59.999Z")
                .build());
        assertThat(plan.getLimit()).isEqualTo(50);
        assertThat(plan.getOffset()).isEqualTo(100);
    }

    @Test
    @DisplayName("쿼리 없음 - 빈 문자열 조건은 무시")
    void plan_NoQuery_ShouldIgnoreBlankFields() {
        QueryPlan plan = planner.plan(LogQueryCriteria.builder().query("  ").level("").service(null).build());

        assertThat(plan).isInstanceOf(SimplePlan.class);
        assertThat(plan.getPredicate()).isEqualTo(StorePredicate.all());
        assertThat(plan.getLimit()).isNull();
    }

    @Test
    @DisplayName("고급 쿼리 - 키워드 없이 후보를 넓혀 스캔")
    void plan_AdvancedQuery_ShouldScan() {
        // given
        LogQueryCriteria criteria = LogQueryCriteria.builder()
                .query("level:error -service:db")
                .service("api")
                .limit(20)
                .offset(40)
                .build();

        // when
        QueryPlan plan = planner.plan(criteria);

        // then
        assertThat(plan).isInstanceOf(ScanPlan.class);
        ScanPlan scanPlan = (ScanPlan) plan;
        assertThat(scanPlan.getPredicate().getKeyword()).isNull();
        assertThat(scanPlan.getPredicate().getService()).isEqualTo("api");
        assertThat(scanPlan.getCandidateBudget()).isEqualTo(QueryPlanner.DEFAULT_SCAN_CANDIDATE_FLOOR);
        assertThat(scanPlan.getTerms()).containsExactly(
                SearchTerm.keyValue("level", "error", false),
                SearchTerm.keyValue("service", "db", true));
        assertThat(scanPlan.getLimit()).isEqualTo(20);
        assertThat(scanPlan.getOffset()).isEqualTo(40);
    }

    @Test
    @DisplayName("후보 수 - 요청 limit이 하한보다 크면 limit 사용")
    void candidateBudget_ShouldUseLargerOfLimitAndFloor() {
        assertThat(planner.candidateBudget(null)).isEqualTo(5000);
        assertThat(planner.candidateBudget(10)).isEqualTo(5000);
        assertThat(planner.candidateBudget(12000)).isEqualTo(12000);
    }
}
