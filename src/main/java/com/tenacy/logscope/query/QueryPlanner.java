package com.tenacy.logscope.query;

import com.tenacy.logscope.search.SearchQueryParser;
import com.tenacy.logscope.search.SearchTerm;
import com.tenacy.logscope.store.StorePredicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 조회 조건을 보고 저장소 위임({@link SimplePlan})과 스캔 후 필터링({@link ScanPlan}) 중 하나를 고른다.
 * 쿼리 문자열에 {@code : - * "} 중 하나라도 있으면 고급 쿼리로 보고 스캔 계획을 만든다.
 */
@Component
@Slf4j
public class QueryPlanner {

    private static final Pattern ADVANCED_SYNTAX = Pattern.compile("[:\\-*\"]");

    public static final int DEFAULT_SCAN_CANDIDATE_FLOOR = 5000;

    private final SearchQueryParser searchQueryParser;

    @Value("${logscope.query.scan-candidate-floor:5000}")
    private int scanCandidateFloor = DEFAULT_SCAN_CANDIDATE_FLOOR;

    public QueryPlanner(SearchQueryParser searchQueryParser) {
        this.searchQueryParser = searchQueryParser;
    }

    public static boolean isAdvancedQuery(String query) {
        return query != null && ADVANCED_SYNTAX.matcher(query).find();
    }

    public QueryPlan plan(LogQueryCriteria criteria) {
        String query = textOrNull(criteria.getQuery());
        Integer limit = positiveOrNull(criteria.getLimit());
        Integer offset = positiveOrNull(criteria.getOffset());

        StorePredicate predicate = StorePredicate.builder()
                .level(textOrNull(criteria.getLevel()))
                .service(textOrNull(criteria.getService()))
                .startDate(textOrNull(criteria.getStartDate()))
                .endDate(textOrNull(criteria.getEndDate()))
                .build();

        if (query == null || !isAdvancedQuery(query)) {
            QueryPlan plan = new SimplePlan(predicate.toBuilder().keyword(query).build(), limit, offset);
            log.debug("단순 조회 계획 선택: {}", plan);
            return plan;
        }

        List<SearchTerm> terms = searchQueryParser.parse(query);
        QueryPlan plan = new ScanPlan(predicate, terms, candidateBudget(limit), limit, offset);
        log.debug("스캔 조회 계획 선택: {}", plan);
        return plan;
    }

    /**
     * 후보 행 수. 요청 limit과 하한값 중 큰 값.
     */
    public int candidateBudget(Integer limit) {
        return Math.max(limit != null ? limit : 0, scanCandidateFloor);
    }

    private static String textOrNull(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }
}
