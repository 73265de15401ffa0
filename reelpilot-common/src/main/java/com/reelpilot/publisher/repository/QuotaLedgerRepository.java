package com.reelpilot.publisher.repository;

import com.reelpilot.publisher.model.QuotaLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface QuotaLedgerRepository extends JpaRepository<QuotaLedgerEntry, Long> {

    @Query("SELECT COALESCE(SUM(q.cost), 0L) FROM QuotaLedgerEntry q WHERE q.resetAt > :now")
    Long sumActiveCost(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM QuotaLedgerEntry q WHERE q.resetAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Query("SELECT q.operation, SUM(q.cost) FROM QuotaLedgerEntry q WHERE q.resetAt > :now GROUP BY q.operation")
    List<Object[]> getActiveBreakdown(@Param("now") Instant now);

    List<QuotaLedgerEntry> findByTimestampGreaterThanEqualOrderByTimestampDesc(Instant since);
}
