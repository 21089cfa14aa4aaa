package com.tenacy.logscope.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogStatsResponse {
    private long totalLogs;
    private List<String> levels;
    private List<String> services;
}
