package quest.gekko.outlier.repository;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Testcontainers(disabledWithoutDocker = true)
class SnapshotWriteOperationsIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static SnapshotWriteOperationsImpl operations;
    private static JdbcTemplate jdbcTemplate;

    @BeforeAll
    static void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        operations = new SnapshotWriteOperationsImpl(new NamedParameterJdbcTemplate(dataSource));
    }

    @Test
    void testUpsertAll_SameDayRerunKeepsOneRowWithLatestCounts() {
        // Given a first refresh of the day
        LocalDate day = LocalDate.of(2024, 6, 10);
        operations.upsertAll(List.of(new SnapshotRow("vidA", day, 9, 1_000, 10L, 1L, null)));

        // When the same day is refreshed again with newer numbers
        operations.upsertAll(List.of(new SnapshotRow("vidA", day, 9, 1_450, 12L, null, 150L)));

        // Then
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(
                "SELECT view_count, like_count, comment_count, daily_views_rate FROM view_snapshot "
                        + "WHERE video_id = 'vidA' AND snapshot_date = ?", day);
        assertEquals(1, rows.size());
        assertEquals(1_450L, ((Number) rows.get(0).get("view_count")).longValue());
        assertEquals(12L, ((Number) rows.get(0).get("like_count")).longValue());
        assertEquals(null, rows.get(0).get("comment_count"));
        assertEquals(150L, ((Number) rows.get(0).get("daily_views_rate")).longValue());
    }

    @Test
    void testUpsertAll_NewDayAppends() {
        // Given
        operations.upsertAll(List.of(new SnapshotRow("vidB", LocalDate.of(2024, 6, 1), 0, 10, null, null, null)));

        // When
        operations.upsertAll(List.of(new SnapshotRow("vidB", LocalDate.of(2024, 6, 2), 1, 60, null, null, 50L)));

        // Then
        Integer count = jdbcTemplate.queryForObject(
                "SELECT count(*) FROM view_snapshot WHERE video_id = 'vidB'", Integer.class);
        assertEquals(2, count);
    }
}
