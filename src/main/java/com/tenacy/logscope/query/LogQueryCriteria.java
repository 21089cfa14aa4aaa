package com.tenacy.logscope.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 로그 조회 조건. 빈 문자열은 조건 없음으로 취급한다.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LogQueryCriteria {
    private String query;
    private String level;
    private String service;
    private String startDate;
    private String endDate;
    private Integer limit;
    private Integer offset;
}
