package com.tenacy.logscope.query;

import com.tenacy.logscope.search.SearchTerm;
import com.tenacy.logscope.store.StorePredicate;
import lombok.Value;

import java.util.List;

/**
 * 저장소에서는 level/service/시간 범위만 거르고 최대 {@code candidateBudget}개 후보를 가져온 뒤,
 * 검색 항으로 필터링하고 메모리에서 offset, limit 순으로 자른다. 저장소 offset은 사용하지 않는다.
 */
@Value
public class ScanPlan implements QueryPlan {
    StorePredicate predicate;
    List<SearchTerm> terms;
    int candidateBudget;
    Integer limit;
    Integer offset;
}
