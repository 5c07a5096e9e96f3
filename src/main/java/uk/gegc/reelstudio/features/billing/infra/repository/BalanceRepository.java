package uk.gegc.reelstudio.features.billing.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reelstudio.features.billing.domain.model.Balance;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Every mutator is a single guarded UPDATE; the returned row count tells the caller whether the guard held.
 */
public interface BalanceRepository extends JpaRepository<Balance, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Balance b WHERE b.userId = :userId")
    Optional<Balance> findByUserIdForUpdate(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Balance b
            SET b.reserved = b.reserved + :amount,
                b.version = b.version + 1,
                b.updatedAt = :now
            WHERE b.userId = :userId
              AND b.balance - b.reserved >= :amount
            """)
    int reserve(@Param("userId") UUID userId, @Param("amount") long amount, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Balance b
            SET b.balance = b.balance - :amount,
                b.reserved = CASE WHEN b.reserved >= :amount THEN b.reserved - :amount ELSE 0 END,
                b.totalConsumed = b.totalConsumed + :amount,
                b.version = b.version + 1,
                b.updatedAt = :now
            WHERE b.userId = :userId
            """)
    int confirm(@Param("userId") UUID userId, @Param("amount") long amount, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Balance b
            SET b.reserved = b.reserved - :amount,
                b.version = b.version + 1,
                b.updatedAt = :now
            WHERE b.userId = :userId
              AND b.reserved >= :amount
            """)
    int release(@Param("userId") UUID userId, @Param("amount") long amount, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Balance b
            SET b.balance = b.balance - :amount,
                b.totalConsumed = b.totalConsumed + :amount,
                b.version = b.version + 1,
                b.updatedAt = :now
            WHERE b.userId = :userId
              AND b.balance - b.reserved >= :amount
            """)
    int deduct(@Param("userId") UUID userId, @Param("amount") long amount, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Balance b
            SET b.balance = b.balance + :amount,
                b.totalPurchased = b.totalPurchased + :amount,
                b.version = b.version + 1,
                b.updatedAt = :now
            WHERE b.userId = :userId
            """)
    int credit(@Param("userId") UUID userId, @Param("amount") long amount, @Param("now") LocalDateTime now);
}
