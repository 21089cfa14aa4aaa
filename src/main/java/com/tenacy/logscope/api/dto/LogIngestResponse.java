package com.tenacy.logscope.api.dto;

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
public class LogIngestResponse {
    private boolean success;
    private int count;
    private List<LogRecord> logs;
}
