package com.tenacy.logscope.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * logs 테이블의 한 행. attributes는 JSON 문자열(data 컬럼)로 저장된다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogRow {
    private String id;
    private String timestamp;
    private String message;
    private String level;
    private String service;
    private String data;
}
