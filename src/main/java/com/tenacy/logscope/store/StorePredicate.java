package com.tenacy.logscope.store;

import lombok.Builder;
import lombok.Value;

/**
 * 저장소에서 직접 실행되는 조건. null인 항목은 적용하지 않는다.
 * 시간 범위는 정규화된 타임스탬프 문자열 비교이며 양 끝을 포함한다.
 */
@Value
@Builder(toBuilder = true)
public class StorePredicate {
    String level;
    String service;
    String startDate;
    String endDate;
    /** message, service, level, attributes 중 하나라도 포함하면 일치하는 부분 문자열 */
    String keyword;

    public static StorePredicate all() {
        return StorePredicate.builder().build();
    }
}
