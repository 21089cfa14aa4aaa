package com.tenacy.logscope.store;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 패싯 조회가 가능한 컬럼.
 */
@Getter
@RequiredArgsConstructor
public enum LogColumn {
    LEVEL("log_level"),
    SERVICE("service");

    private final String columnName;
}
