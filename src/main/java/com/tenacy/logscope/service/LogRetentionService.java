package com.tenacy.logscope.service;

import com.tenacy.logscope.ingest.TimestampNormalizer;
import com.tenacy.logscope.query.LogDeleteCriteria;
import com.tenacy.logscope.query.LogQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
@RequiredArgsConstructor
@Slf4j
public class LogRetentionService {

    private final LogQueryService logQueryService;

    @Value("${logscope.cleanup.retention-days:30}")
    private int retentionDays;

    private Clock clock = Clock.systemUTC();

    @Scheduled(cron = "${logscope.cleanup.cron:0 0 2 * * ?}") // 기본값: 매일 새벽 2시
    public void cleanupOldLogs() {
        if (retentionDays <= 0) {
            log.debug("보관 기간이 설정되지 않아 로그 정리를 건너뜀");
            return;
        }

        Instant threshold = clock.instant().minus(Duration.ofDays(retentionDays));
        int deletedCount = logQueryService.delete(LogDeleteCriteria.builder()
                .endDate(TimestampNormalizer.format(threshold))
                .build());

        log.info("Cleaned up {} log entries older than {} days", deletedCount, retentionDays);
    }
}
