package com.tenacy.logscope.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.tenacy.logscope.api.dto.LogCountResponse;
import com.tenacy.logscope.api.dto.LogIngestResponse;
import com.tenacy.logscope.api.dto.LogSearchResponse;
import com.tenacy.logscope.api.dto.LogStatsResponse;
import com.tenacy.logscope.api.dto.SimpleMessageResponse;
import com.tenacy.logscope.domain.LogRecord;
import com.tenacy.logscope.ingest.LogIngestService;
import com.tenacy.logscope.query.LogDeleteCriteria;
import com.tenacy.logscope.query.LogQueryCriteria;
import com.tenacy.logscope.query.LogQueryService;
import com.tenacy.logscope.store.LogStore;
import com.tenacy.logscope.store.StorePredicate;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/logs")
@RequiredArgsConstructor
public class LogController {

    public static final String SERVICE_NAME_HEADER = "service.name";

    private final LogIngestService logIngestService;
    private final LogQueryService logQueryService;
    private final LogStore logStore;

    @Value("${logscope.query.default-limit:100}")
    private int defaultLimit;

    @PostMapping
    public ResponseEntity<LogIngestResponse> ingest(
            @RequestBody JsonNode body,
            @RequestHeader(value = SERVICE_NAME_HEADER, required = false) String serviceName) {

        List<LogRecord> records = logIngestService.ingest(body, serviceName);

        return ResponseEntity.ok(LogIngestResponse.builder()
                .success(true)
                .count(records.size())
                .logs(records)
                .build());
    }

    @GetMapping
    public ResponseEntity<LogSearchResponse> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {

        LogQueryCriteria criteria = LogQueryCriteria.builder()
                .query(query)
                .level(level)
                .service(service)
                .startDate(startDate)
                .endDate(endDate)
                .limit(limit != null ? limit : defaultLimit)
                .offset(offset)
                .build();

        return ResponseEntity.ok(LogSearchResponse.of(logQueryService.query(criteria)));
    }

    @GetMapping("/count")
    public ResponseEntity<LogCountResponse> count(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate) {

        LogQueryCriteria criteria = LogQueryCriteria.builder()
                .query(query)
                .level(level)
                .service(service)
                .startDate(startDate)
                .endDate(endDate)
                .build();

        return ResponseEntity.ok(new LogCountResponse(logQueryService.count(criteria)));
    }

    @GetMapping("/levels")
    public ResponseEntity<List<String>> levels() {
        return ResponseEntity.ok(logQueryService.levels());
    }

    @GetMapping("/services")
    public ResponseEntity<List<String>> services() {
        return ResponseEntity.ok(logQueryService.services());
    }

    @GetMapping("/stats")
    public ResponseEntity<LogStatsResponse> stats() {
        return ResponseEntity.ok(LogStatsResponse.builder()
                .totalLogs(logStore.count(StorePredicate.all()))
                .levels(logQueryService.levels())
                .services(logQueryService.services())
                .build());
    }

    @DeleteMapping
    public ResponseEntity<SimpleMessageResponse> clear(
            @RequestParam(required = false) String service,
            @RequestParam(required = false) String endDate) {

        int deleted = logQueryService.delete(LogDeleteCriteria.builder()
                .service(service)
                .endDate(endDate)
                .build());

        return ResponseEntity.ok(SimpleMessageResponse.builder()
                .success(true)
                .message(deleted + " logs cleared")
                .build());
    }
}
