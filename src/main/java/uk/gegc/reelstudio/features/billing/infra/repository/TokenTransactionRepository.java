package uk.gegc.reelstudio.features.billing.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransaction;
import uk.gegc.reelstudio.features.billing.domain.model.TokenTransactionType;

import java.util.List;
import java.util.UUID;

public interface TokenTransactionRepository extends JpaRepository<TokenTransaction, UUID> {

    @Query("""
            SELECT t FROM TokenTransaction t
            WHERE t.userId = :userId
              AND (:type IS NULL OR t.type = :type)
            ORDER BY t.createdAt DESC, t.id DESC
            """)
    Page<TokenTransaction> findByFilters(@Param("userId") UUID userId,
                                         @Param("type") TokenTransactionType type,
                                         Pageable pageable);

    List<TokenTransaction> findByRefIdOrderByCreatedAtAsc(String refId);

    long countByRefIdAndType(String refId, TokenTransactionType type);
}
