package com.tenacy.logscope.query;

import com.tenacy.logscope.domain.LogRecord;
import com.tenacy.logscope.search.SearchTermMatcher;
import com.tenacy.logscope.store.LogColumn;
import com.tenacy.logscope.store.LogRecordCodec;
import com.tenacy.logscope.store.LogStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 로그 조회/개수/삭제를 조정한다.
 * <p>
 * 단순 쿼리는 저장소에 그대로 위임하고, 고급 쿼리는 후보 행을 가져와 메모리에서 필터링한 뒤 페이지를 자른다.
 * 저장소 오류는 재시도 없이 {@link com.tenacy.logscope.store.StoreUnavailableException}으로 전달된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LogQueryService {

    private final LogStore logStore;
    private final LogRecordCodec codec;
    private final QueryPlanner queryPlanner;
    private final SearchTermMatcher searchTermMatcher;
    private final Counter simpleQueryCounter;
    private final Counter scanQueryCounter;
    private final Timer scanQueryTimer;

    public LogQueryResult query(LogQueryCriteria criteria) {
        QueryPlan plan = queryPlanner.plan(criteria);

        List<LogRecord> logs;
        long total;

        if (plan instanceof ScanPlan scanPlan) {
            List<LogRecord> matched = scan(scanPlan);
            logs = paginate(matched, scanPlan.getOffset(), scanPlan.getLimit());
            // 개수 조회와 후보 범위가 같으면 필터링 결과를 그대로 사용
            total = scanPlan.getCandidateBudget() == queryPlanner.candidateBudget(null)
                    ? matched.size()
                    : count(criteria);
        } else {
            logs = fetch(plan);
            total = logStore.count(plan.getPredicate());
        }

        return LogQueryResult.builder()
                .logs(logs)
                .total(total)
                .levels(levels())
                .services(services())
                .build();
    }

    /**
     * 조건에 맞는 전체 개수. 고급 쿼리는 페이지 없이 필터링한 결과의 크기로 계산한다.
     */
    public long count(LogQueryCriteria criteria) {
        LogQueryCriteria unpaged = criteria.toBuilder().limit(null).offset(null).build();
        QueryPlan plan = queryPlanner.plan(unpaged);

        if (plan instanceof ScanPlan scanPlan) {
            return scan(scanPlan).size();
        }
        return logStore.count(plan.getPredicate());
    }

    public int delete(LogDeleteCriteria criteria) {
        String service = StringUtils.hasText(criteria.getService()) ? criteria.getService() : null;
        String endDate = StringUtils.hasText(criteria.getEndDate()) ? criteria.getEndDate() : null;
        return logStore.delete(service, endDate);
    }

    public List<String> levels() {
        return logStore.distinctValues(LogColumn.LEVEL);
    }

    public List<String> services() {
        return logStore.distinctValues(LogColumn.SERVICE);
    }

    private List<LogRecord> fetch(QueryPlan plan) {
        simpleQueryCounter.increment();

        return logStore.select(plan.getPredicate(), plan.getLimit(), plan.getOffset()).stream()
                .map(codec::toRecord)
                .collect(Collectors.toList());
    }

    private List<LogRecord> scan(ScanPlan plan) {
        scanQueryCounter.increment();

        return scanQueryTimer.record(() -> {
            List<LogRecord> candidates = logStore.select(plan.getPredicate(), plan.getCandidateBudget(), null).stream()
                    .map(codec::toRecord)
                    .collect(Collectors.toList());

            List<LogRecord> matched = searchTermMatcher.filter(candidates, plan.getTerms());
            log.debug("고급 쿼리 필터링: 후보 {}건 중 {}건 일치", candidates.size(), matched.size());
            return matched;
        });
    }

    private static List<LogRecord> paginate(List<LogRecord> records, Integer offset, Integer limit) {
        int from = offset != null ? Math.min(offset, records.size()) : 0;
        int to = limit != null ? (int) Math.min((long) from + limit, records.size()) : records.size();

        if (from >= to) {
            return Collections.emptyList();
        }
        return new ArrayList<>(records.subList(from, to));
    }
}
