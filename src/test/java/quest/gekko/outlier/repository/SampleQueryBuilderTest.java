package quest.gekko.outlier.repository;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class SampleQueryBuilderTest {

    @Test
    void testBuild_FromCursorPassOrdersAscendingAndLimits() {
        SampleCriteria criteria = new SampleCriteria(null, null, null, null, null, false, 20);

        SampleQuery query = SampleQueryBuilder.build(criteria, null, 0.25, SampleQuery.Pass.FROM_CURSOR, 20);

        assertTrue(query.sql().contains("v.random_sort >= :cursor"));
        assertTrue(query.sql().contains("ORDER BY v.random_sort ASC"));
        assertEquals(0.25, query.params().getValue("cursor"));
        assertEquals(20, query.params().getValue("limit"));
        assertEquals("CHANNEL_HISTORY", query.params().getValue("baselineSource"));
    }

    @Test
    void testBuild_WrapPassSelectsBelowCursor() {
        SampleCriteria criteria = new SampleCriteria(null, null, null, null, null, false, 20);

        SampleQuery query = SampleQueryBuilder.build(criteria, null, 0.25, SampleQuery.Pass.BEFORE_CURSOR, 7);

        assertTrue(query.sql().contains("v.random_sort < :cursor"));
        assertFalse(query.sql().contains(">= :cursor"));
        assertEquals(7, query.params().getValue("limit"));
    }

    @Test
    void testBuild_AllFiltersBound() {
        // Given
        SampleCriteria criteria = new SampleCriteria(new BigDecimal("2.0"), 1_000L, 30, "science", "tutorial", true, 10);
        Instant publishedAfter = Instant.parse("2024-05-01T00:00:00Z");

        // When
        SampleQuery query = SampleQueryBuilder.build(criteria, publishedAfter, 0.5, SampleQuery.Pass.FROM_CURSOR, 10);

        // Then
        assertEquals(new BigDecimal("2.0"), query.params().getValue("minScore"));
        assertEquals(1_000L, query.params().getValue("minViews"));
        assertEquals("science", query.params().getValue("topicDomain"));
        assertEquals("tutorial", query.params().getValue("category"));
        assertTrue(query.params().hasValue("publishedAfter"));
        assertTrue(query.sql().contains("v.is_institutional = false"));
    }

    @Test
    void testBuild_InstitutionalExclusionNeverTouchesChannelTable() {
        SampleCriteria criteria = new SampleCriteria(null, null, null, null, null, true, 10);

        String sql = SampleQueryBuilder.build(criteria, null, 0.5, SampleQuery.Pass.FROM_CURSOR, 10)
                .sql().toLowerCase(Locale.ROOT);

        assertFalse(sql.contains("channel "));
        assertFalse(sql.contains("join"));
        assertFalse(sql.contains("exists"));
        assertFalse(sql.contains("(select"));
    }

    @Test
    void testCriteria_AllCategoryMeansNoFilter() {
        SampleCriteria all = new SampleCriteria(null, null, null, " ", "ALL", false, 10);

        assertNull(all.category());
        assertNull(all.topicDomain());
        SampleQuery query = SampleQueryBuilder.build(all, null, 0.5, SampleQuery.Pass.FROM_CURSOR, 10);
        assertFalse(query.sql().contains("format_type"));
        assertFalse(query.sql().contains("topic_domain"));
    }
}
