package uk.gegc.reelstudio.features.work.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.reelstudio.features.work.domain.model.Work;

import java.util.Optional;
import java.util.UUID;

public interface WorkRepository extends JpaRepository<Work, UUID> {

    @Query("SELECT w.ownerId FROM Work w WHERE w.id = :id")
    Optional<UUID> findOwnerIdById(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Work w WHERE w.id = :id")
    Optional<Work> findByIdForUpdate(@Param("id") UUID id);
}
