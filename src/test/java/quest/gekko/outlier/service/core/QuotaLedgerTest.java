package quest.gekko.outlier.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import quest.gekko.outlier.config.TrackerProperties;
import quest.gekko.outlier.domain.QuotaCounter;
import quest.gekko.outlier.repository.QuotaCounterRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaLedgerTest {
    private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

    @Mock
    private QuotaCounterRepository quotaCounterRepository;

    private QuotaLedger ledger;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T23:59:00Z"), ZoneOffset.UTC);
        ledger = new QuotaLedger(quotaCounterRepository, new TrackerProperties.Quota(100L, 30), clock);
    }

    private static QuotaCounter counter(long used) {
        QuotaCounter c = new QuotaCounter();
        c.setUsageDate(TODAY);
        c.setUnitsUsed(used);
        c.setMaxDailyUnits(100L);
        return c;
    }

    @Test
    void testCheckAvailable_NoRowMeansNothingUsed() {
        // Given
        when(quotaCounterRepository.findById(TODAY)).thenReturn(Optional.empty());

        // When / Then
        assertTrue(ledger.checkAvailable(100));
        assertEquals(100, ledger.getStatus().remaining());
    }

    @Test
    void testCheckAvailable_RejectsWhenUnitsExceedRemaining() {
        // Given 95 of 100 used
        when(quotaCounterRepository.findById(TODAY)).thenReturn(Optional.of(counter(95)));

        // Then
        assertTrue(ledger.checkAvailable(5));
        assertFalse(ledger.checkAvailable(10));

        QuotaStatus status = ledger.getStatus();
        assertEquals(95, status.used());
        assertEquals(5, status.remaining());
        assertEquals(100, status.total());
    }

    @Test
    void testIncrement_DelegatesToAtomicUpsert() {
        // Given
        when(quotaCounterRepository.addUnits(TODAY, 3, 100L)).thenReturn(42L);

        // When
        long total = ledger.increment(3);

        // Then
        assertEquals(42L, total);
        verify(quotaCounterRepository).addUnits(TODAY, 3, 100L);
        verify(quotaCounterRepository, never()).save(any());
    }

    @Test
    void testIncrement_RejectsNonPositiveUnits() {
        assertThrows(IllegalArgumentException.class, () -> ledger.increment(0));
        verifyNoInteractions(quotaCounterRepository);
    }

    @Test
    void testToday_UsesUtcEvenForZonedClock() {
        // 23:30 UTC is already the next day in Tokyo
        Clock tokyo = Clock.fixed(Instant.parse("2024-06-01T23:30:00Z"), ZoneId.of("Asia/Tokyo"));
        QuotaLedger zoned = new QuotaLedger(quotaCounterRepository, new TrackerProperties.Quota(100L, 30), tokyo);

        assertEquals(TODAY, zoned.today());
    }

    @Test
    void testPurgeHistory_DeletesBeforeRetentionCutoff() {
        when(quotaCounterRepository.deleteOlderThan(TODAY.minusDays(30))).thenReturn(4);

        assertEquals(4, ledger.purgeHistory());
    }
}
