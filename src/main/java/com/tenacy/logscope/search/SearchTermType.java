package com.tenacy.logscope.search;

public enum SearchTermType {
    /** 키 없이 모든 필드를 대상으로 하는 부분 문자열 검색 */
    TEXT,
    /** key:value, key:"value" 형태의 정확 일치 */
    KEY_VALUE,
    /** key:*value* 형태의 부분 문자열 일치 */
    WILDCARD
}
