package com.tenacy.logscope.store;

import com.tenacy.logscope.domain.LogRecord;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * JDBC 기반 {@link LogStore}. 단일 logs 테이블을 사용한다.
 */
@Repository
@Slf4j
public class JdbcLogStore implements LogStore {

    private static final String SELECT_COLUMNS =
            "SELECT id, logged_at, message, log_level, service, data FROM logs";

    private static final String INSERT_SQL =
            "INSERT INTO logs (id, logged_at, message, log_level, service, data) VALUES (?, ?, ?, ?, ?, ?)";

    private static final RowMapper<LogRow> ROW_MAPPER = (rs, rowNum) -> LogRow.builder()
            .id(rs.getString("id"))
            .timestamp(rs.getString("logged_at"))
            .message(rs.getString("message"))
            .level(rs.getString("log_level"))
            .service(rs.getString("service"))
            .data(rs.getString("data"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final LogRecordCodec codec;
    private final MeterRegistry meterRegistry;

    @Value("${logscope.jdbc.batch-size:500}")
    private int jdbcBatchSize = 500;

    public JdbcLogStore(JdbcTemplate jdbcTemplate, LogRecordCodec codec, MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void insert(LogRecord record) {
        LogRow row = codec.toRow(record);
        execute("로그 저장", () -> jdbcTemplate.update(INSERT_SQL,
                row.getId(), row.getTimestamp(), row.getMessage(), row.getLevel(), row.getService(), row.getData()));
    }

    @Override
    @Transactional
    public void insertAll(List<LogRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }

        List<LogRow> rows = records.stream().map(codec::toRow).collect(Collectors.toList());
        int batchSize = jdbcBatchSize > 0 ? jdbcBatchSize : rows.size();

        execute("로그 일괄 저장", () -> {
            for (int from = 0; from < rows.size(); from += batchSize) {
                List<LogRow> chunk = rows.subList(from, Math.min(from + batchSize, rows.size()));
                jdbcTemplate.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        LogRow row = chunk.get(i);
                        ps.setString(1, row.getId());
                        ps.setString(2, row.getTimestamp());
                        ps.setString(3, row.getMessage());
                        ps.setString(4, row.getLevel());
                        ps.setString(5, row.getService());
                        ps.setString(6, row.getData());
                    }

                    @Override
                    public int getBatchSize() {
                        return chunk.size();
                    }
                });
            }
            log.debug("{}개 로그 일괄 저장 완료", rows.size());
            return rows.size();
        });
    }

    @Override
    public List<LogRow> select(StorePredicate predicate, Integer limit, Integer offset) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS);
        appendWhere(sql, params, predicate);
        sql.append(" ORDER BY logged_at DESC");

        if (limit != null && limit > 0) {
            sql.append(" LIMIT ?");
            params.add(limit);

            if (offset != null && offset > 0) {
                sql.append(" OFFSET ?");
                params.add(offset);
            }
        }

        return execute("로그 조회", () -> jdbcTemplate.query(sql.toString(), ROW_MAPPER, params.toArray()));
    }

    @Override
    public long count(StorePredicate predicate) {
        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM logs");
        appendWhere(sql, params, predicate);

        Long count = execute("로그 개수 조회",
                () -> jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray()));
        return count != null ? count : 0L;
    }

    @Override
    public List<String> distinctValues(LogColumn column) {
        String columnName = column.getColumnName();
        String sql = "SELECT DISTINCT " + columnName + " FROM logs WHERE " + columnName
                + " IS NOT NULL ORDER BY " + columnName;

        return execute("고유 값 조회", () -> jdbcTemplate.queryForList(sql, String.class));
    }

    @Override
    public int delete(String service, String before) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (service != null) {
            conditions.add("service = ?");
            params.add(service);
        }
        if (before != null) {
            conditions.add("logged_at < ?");
            params.add(before);
        }

        String sql = "DELETE FROM logs" + (conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions));

        int deleted = execute("로그 삭제", () -> jdbcTemplate.update(sql, params.toArray()));
        log.info("로그 {}건 삭제 (service={}, before={})", deleted, service, before);
        return deleted;
    }

    private static void appendWhere(StringBuilder sql, List<Object> params, StorePredicate predicate) {
        List<String> conditions = new ArrayList<>();

        if (predicate.getLevel() != null) {
            conditions.add("log_level = ?");
            params.add(predicate.getLevel());
        }
        if (predicate.getService() != null) {
            conditions.add("service = ?");
            params.add(predicate.getService());
        }
        if (predicate.getStartDate() != null) {
            conditions.add("logged_at >= ?");
            params.add(predicate.getStartDate());
        }
        if (predicate.getEndDate() != null) {
            conditions.add("logged_at <= ?");
            params.add(predicate.getEndDate());
        }
        if (predicate.getKeyword() != null) {
            conditions.add("(LOWER(message) LIKE ? OR LOWER(service) LIKE ? "
                    + "OR LOWER(log_level) LIKE ? OR LOWER(data) LIKE ?)");
            String pattern = "%" + escapeLike(predicate.getKeyword().toLowerCase(Locale.ROOT)) + "%";
            for (int i = 0; i < 4; i++) {
                params.add(pattern);
            }
        }

        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            meterRegistry.counter("logscope.store.errors", "operation", operation).increment();
            log.error("{} 중 저장소 오류 발생: {}", operation, e.getMessage(), e);
            throw new StoreUnavailableException(operation + " 실패", e);
        }
    }
}
