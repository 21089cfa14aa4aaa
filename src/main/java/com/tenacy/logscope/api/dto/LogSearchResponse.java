package com.tenacy.logscope.api.dto;

import com.tenacy.logscope.domain.LogRecord;
import com.tenacy.logscope.query.LogQueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogSearchResponse {
    private List<LogRecord> logs;
    private long total;
    private List<String> levels;
    private List<String> services;

    public static LogSearchResponse of(LogQueryResult result) {
        return LogSearchResponse.builder()
                .logs(result.getLogs())
                .total(result.getTotal())
                .levels(result.getLevels())
                .services(result.getServices())
                .build();
    }
}
