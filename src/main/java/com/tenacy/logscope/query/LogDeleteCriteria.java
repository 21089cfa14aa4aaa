package com.tenacy.logscope.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogDeleteCriteria {
    private String service;
    /** 이 시각 이전(미포함)의 로그만 삭제 */
    private String endDate;
}
