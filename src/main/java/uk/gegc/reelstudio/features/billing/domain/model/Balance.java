package uk.gegc.reelstudio.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-user token funds. {@code reserved} is the part of {@code balance} earmarked for in-flight segments;
 * only {@code balance - reserved} can back a new reservation.
 */
@Entity
@Table(name = "balances")
@Getter
@Setter
public class Balance {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "reserved", nullable = false)
    private long reserved;

    @Column(name = "total_purchased", nullable = false)
    private long totalPurchased;

    @Column(name = "total_consumed", nullable = false)
    private long totalConsumed;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Balance open(UUID userId, LocalDateTime now) {
        Balance balance = new Balance();
        balance.setUserId(userId);
        balance.setCreatedAt(now);
        balance.setUpdatedAt(now);
        return balance;
    }

    @Transient
    public long getAvailable() {
        return balance - reserved;
    }
}
