package com.reelpilot.publisher.service;

import com.reelpilot.publisher.dto.QuotaUsage;
import com.reelpilot.publisher.exception.QuotaExceededException;
import com.reelpilot.publisher.model.QuotaLedgerEntry;
import com.reelpilot.publisher.model.QuotaOperation;
import com.reelpilot.publisher.repository.QuotaLedgerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotaLedgerServiceTest {

    // 11:00 in Los Angeles (PDT), so the quota resets at 07:00 UTC the next day
    private static final Instant NOW = Instant.parse("2026-03-10T18:00:00Z");
    private static final Instant NEXT_RESET = Instant.parse("2026-03-11T07:00:00Z");

    @Mock
    private QuotaLedgerRepository repository;

    private QuotaLedgerService service;

    @BeforeEach
    void setUp() {
        service = new QuotaLedgerService(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void resetBoundaryIsNextPacificMidnight() {
        assertEquals(NEXT_RESET, service.resetBoundary());
    }

    @Test
    void resetBoundaryFollowsStandardTimeInWinter() {
        QuotaLedgerService winter = new QuotaLedgerService(repository,
                Clock.fixed(Instant.parse("2026-01-15T20:00:00Z"), ZoneOffset.UTC));

        assertEquals(Instant.parse("2026-01-16T08:00:00Z"), winter.resetBoundary());
    }

    @Test
    void currentUsagePrunesThenSums() {
        when(repository.deleteExpired(NOW)).thenReturn(4);
        when(repository.sumActiveCost(NOW)).thenReturn(3250L);

        QuotaUsage usage = service.currentUsage(10_000);

        assertEquals(3250L, usage.getUsed());
        assertEquals(6750L, usage.getRemaining());
        assertEquals(32.5, usage.getPercentage(), 0.001);
        assertEquals(NEXT_RESET, usage.getResetAt());
        verify(repository).deleteExpired(NOW);
    }

    @Test
    void uploadNeedingMoreThanRemainingIsRefused() {
        when(repository.sumActiveCost(NOW)).thenReturn(9000L);

        QuotaExceededException e = assertThrows(QuotaExceededException.class,
                () -> service.checkAvailable("upload", 10_000));

        assertEquals(NEXT_RESET, e.getResetAt());
        assertTrue(e.getMessage().contains("Need 1600, have 1000"));
    }

    @Test
    void cheapOperationStillFitsInTheRemainder() {
        when(repository.sumActiveCost(NOW)).thenReturn(9000L);

        QuotaUsage usage = service.checkAvailable("comment", 10_000);

        assertEquals(1000L, usage.getRemaining());
    }

    @Test
    void overspentLedgerReportsZeroRemaining() {
        when(repository.sumActiveCost(NOW)).thenReturn(11_200L);

        assertEquals(0L, service.currentUsage(10_000).getRemaining());
    }

    @Test
    void recordAppendsEntryThatExpiresAtResetBoundary() {
        when(repository.save(any(QuotaLedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));

        service.record(QuotaOperation.UPLOAD, "long.mp4");

        ArgumentCaptor<QuotaLedgerEntry> captor = ArgumentCaptor.forClass(QuotaLedgerEntry.class);
        verify(repository).save(captor.capture());
        QuotaLedgerEntry entry = captor.getValue();
        assertEquals("upload", entry.getOperation());
        assertEquals(1600, entry.getCost());
        assertEquals(NOW, entry.getTimestamp());
        assertEquals(NEXT_RESET, entry.getResetAt());
        assertEquals("long.mp4", entry.getMetadata());
    }

    @Test
    void breakdownMapsOperationsToCost() {
        when(repository.getActiveBreakdown(NOW)).thenReturn(List.<Object[]>of(
                new Object[]{"upload", 3200L},
                new Object[]{"list", 7L}));

        Map<String, Long> breakdown = service.usageBreakdown();

        assertEquals(Map.of("upload", 3200L, "list", 7L), breakdown);
    }
}
