package com.tenacy.logscope.query;

import com.tenacy.logscope.store.StorePredicate;

/**
 * 조회 실행 계획. 저장소에 모든 조건을 맡기는 {@link SimplePlan}과
 * 후보를 넓게 가져와 메모리에서 거르는 {@link ScanPlan} 두 가지가 있다.
 */
public interface QueryPlan {

    StorePredicate getPredicate();

    Integer getLimit();

    Integer getOffset();
}
