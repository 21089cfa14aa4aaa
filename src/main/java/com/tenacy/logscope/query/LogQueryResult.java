package com.tenacy.logscope.query;

import com.tenacy.logscope.domain.LogRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogQueryResult {
    private List<LogRecord> logs;
    private long total;
    private List<String> levels;
    private List<String> services;
}
