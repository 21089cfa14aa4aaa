package com.tenacy.logscope.query;

import com.tenacy.logscope.store.StorePredicate;
import lombok.Value;

/**
 * 모든 조건과 페이지네이션을 저장소에서 처리한다.
 */
@Value
public class SimplePlan implements QueryPlan {
    StorePredicate predicate;
    Integer limit;
    Integer offset;
}
