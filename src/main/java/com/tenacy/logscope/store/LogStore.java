package com.tenacy.logscope.store;

import com.tenacy.logscope.domain.LogRecord;

import java.util.List;

/**
 * 로그 저장소 경계. 모든 메서드는 실패 시 {@link StoreUnavailableException}을 던진다.
 * 조회 결과는 항상 타임스탬프 내림차순(최신순)이다.
 */
public interface LogStore {

    void insert(LogRecord record);

    /**
     * 전부 저장되거나 하나도 저장되지 않는다.
     */
    void insertAll(List<LogRecord> records);

    /**
     * @param limit  null이면 제한 없음
     * @param offset limit이 있을 때만 적용된다
     */
    List<LogRow> select(StorePredicate predicate, Integer limit, Integer offset);

    long count(StorePredicate predicate);

    /**
     * null을 제외한 고유 값 목록 (오름차순).
     */
    List<String> distinctValues(LogColumn column);

    /**
     * @param service null이면 서비스 조건 없음
     * @param before  null이 아니면 이 시각보다 이전(미포함) 레코드만 삭제
     * @return 삭제된 행 수
     */
    int delete(String service, String before);
}
