package com.reelpilot.publisher.service;

import com.reelpilot.publisher.dto.QuotaUsage;
import com.reelpilot.publisher.exception.QuotaExceededException;
import com.reelpilot.publisher.model.QuotaLedgerEntry;
import com.reelpilot.publisher.model.QuotaOperation;
import com.reelpilot.publisher.repository.QuotaLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger of platform quota units spent in the current quota period.
 * <p>
 * The period ends at midnight Pacific time, the platform's own reset rule, regardless of the
 * timezone content is published in. Entries carry the reset instant that was current when they
 * were recorded and stop counting once it has passed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuotaLedgerService {

    public static final ZoneId QUOTA_ZONE = ZoneId.of("America/Los_Angeles");

    private final QuotaLedgerRepository quotaLedgerRepository;
    private final Clock clock;

    public Instant resetBoundary() {
        return clock.instant().atZone(QUOTA_ZONE)
                .toLocalDate()
                .plusDays(1)
                .atStartOfDay(QUOTA_ZONE)
                .toInstant();
    }

    @Transactional
    public QuotaUsage currentUsage(int dailyLimit) {
        Instant now = clock.instant();
        int pruned = quotaLedgerRepository.deleteExpired(now);
        if (pruned > 0) {
            log.info("Pruned {} quota entries from the previous period", pruned);
        }
        Long sum = quotaLedgerRepository.sumActiveCost(now);
        long used = sum != null ? sum : 0L;
        long remaining = Math.max(0L, dailyLimit - used);
        double percentage = dailyLimit > 0 ? used * 100.0 / dailyLimit : 0.0;
        return new QuotaUsage(used, remaining, dailyLimit, resetBoundary(), percentage);
    }

    /**
     * @throws QuotaExceededException if the operation costs more than what is left this period
     */
    @Transactional
    public QuotaUsage checkAvailable(String operation, int dailyLimit) {
        int cost = QuotaOperation.costOf(operation);
        QuotaUsage usage = currentUsage(dailyLimit);
        if (cost > usage.getRemaining()) {
            throw new QuotaExceededException(String.format(
                    "Insufficient quota for %s. Need %d, have %d. Resets at %s",
                    operation, cost, usage.getRemaining(), usage.getResetAt()), usage.getResetAt());
        }
        return usage;
    }

    @Transactional
    public QuotaLedgerEntry record(String operation, int cost, String metadata) {
        QuotaLedgerEntry entry = quotaLedgerRepository.save(
                new QuotaLedgerEntry(operation, cost, clock.instant(), resetBoundary(), metadata));
        log.info("Recorded {}: {} units", operation, cost);
        return entry;
    }

    @Transactional
    public QuotaLedgerEntry record(QuotaOperation operation, String metadata) {
        return record(operation.key(), operation.getCost(), metadata);
    }

    @Transactional(readOnly = true)
    public Map<String, Long> usageBreakdown() {
        List<Object[]> results = quotaLedgerRepository.getActiveBreakdown(clock.instant());
        Map<String, Long> breakdown = new HashMap<>();
        for (Object[] result : results) {
            String operation = (String) result[0];
            Number cost = (Number) result[1];
            breakdown.put(operation, cost.longValue());
        }
        return breakdown;
    }

    @Transactional(readOnly = true)
    public List<QuotaLedgerEntry> usageHistory(int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return quotaLedgerRepository.findByTimestampGreaterThanEqualOrderByTimestampDesc(since);
    }
}
