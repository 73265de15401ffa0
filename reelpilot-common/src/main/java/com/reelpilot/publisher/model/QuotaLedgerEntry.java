package com.reelpilot.publisher.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "quota_usage", indexes = {
    @Index(name = "idx_quota_usage_timestamp", columnList = "timestamp"),
    @Index(name = "idx_quota_usage_reset_at", columnList = "reset_at")
})
public class QuotaLedgerEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String operation;

    @Column(nullable = false)
    private int cost;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "reset_at", nullable = false)
    private Instant resetAt;

    @Column(length = 4000)
    private String metadata;

    public QuotaLedgerEntry(String operation, int cost, Instant timestamp, Instant resetAt, String metadata) {
        this.operation = operation;
        this.cost = cost;
        this.timestamp = timestamp;
        this.resetAt = resetAt;
        this.metadata = metadata;
    }
}
