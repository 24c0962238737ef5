package com.erpdashboard.backend.modules.sequence.infrastructure.persistence;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.erpdashboard.backend.modules.sequence.domain.SequenceCounter;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.stereotype.Repository;

/**
 * {@code sequence_counter} 테이블 JDBC 접근. 증가는 PostgreSQL {@code INSERT ... ON CONFLICT DO UPDATE} 한 문장으로
 * 처리되어 생성과 증가가 같은 행 잠금 안에서 일어난다.
 */
@Repository
public class SequenceCounterStore {

    private static final String INCREMENT_SQL = """
            INSERT INTO sequence_counter AS sc (counter_key, sequence, created_at, updated_at)
            VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (counter_key) DO UPDATE
            SET sequence = sc.sequence + 1,
                updated_at = CURRENT_TIMESTAMP
            RETURNING sequence
            """;

    private static final String INITIALIZE_SQL = """
            INSERT INTO sequence_counter (counter_key, sequence, created_at, updated_at)
            VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            ON CONFLICT (counter_key) DO NOTHING
            """;

    private static final String FIND_SQL = """
            SELECT counter_key, sequence, updated_at
            FROM sequence_counter
            WHERE counter_key = ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public SequenceCounterStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * 카운터를 1 증가시키고 새 값을 반환한다. 없으면 {@code initialValue + 1}로 만든다.
     * 양수 타임아웃은 JDBC statement timeout으로 적용되며, 문장은 전부 반영되거나 전혀 반영되지 않는다.
     */
    public long incrementAndGet(String counterKey, long initialValue, Duration timeout) {
        int timeoutSeconds = toTimeoutSeconds(timeout);
        PreparedStatementCreator creator = connection -> {
            PreparedStatement statement = connection.prepareStatement(INCREMENT_SQL);
            statement.setString(1, counterKey);
            statement.setLong(2, initialValue + 1);
            statement.setQueryTimeout(timeoutSeconds);
            return statement;
        };
        Long value = jdbcTemplate.query(creator, rs -> rs.next() ? rs.getLong(1) : null);
        if (value == null) {
            throw new IllegalStateException("Counter upsert returned no row for key " + counterKey);
        }
        return value;
    }

    /**
     * 카운터가 없을 때만 {@code initialValue}로 생성한다.
     *
     * @return 행이 삽입되었으면 {@code true}
     */
    public boolean initialize(String counterKey, long initialValue) {
        return jdbcTemplate.update(INITIALIZE_SQL, counterKey, initialValue) > 0;
    }

    public Optional<SequenceCounter> find(String counterKey) {
        List<SequenceCounter> rows = jdbcTemplate.query(
                FIND_SQL,
                (rs, rowNum) -> {
                    Timestamp updatedAt = rs.getTimestamp("updated_at");
                    return new SequenceCounter(
                            rs.getString("counter_key"),
                            rs.getLong("sequence"),
                            updatedAt != null ? updatedAt.toInstant().atOffset(ZoneOffset.UTC) : null
                    );
                },
                counterKey
        );
        return rows.stream().findFirst();
    }

    /**
     * JDBC 초 단위로 올림 변환한다. JDBC는 0을 "제한 없음"으로 읽으므로 양수만 받는다.
     */
    static int toTimeoutSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("statement timeout must be positive, got " + timeout);
        }
        long seconds = timeout.toSeconds();
        if (timeout.toNanosPart() > 0) {
            seconds++;
        }
        return (int) Math.min(seconds, Integer.MAX_VALUE);
    }
}
