package uk.gegc.reelstudio.features.segment.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.reelstudio.features.segment.domain.model.SegmentStatus;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface VideoSegmentRepository extends JpaRepository<VideoSegment, UUID> {

    List<VideoSegment> findByWorkIdAndEpisodeNumOrderByPositionAsc(UUID workId, Integer episodeNum);

    List<VideoSegment> findByWorkIdOrderByEpisodeNumAscPositionAsc(UUID workId);

    @Query("SELECT s.workId FROM VideoSegment s WHERE s.id = :id")
    Optional<UUID> findWorkIdById(@Param("id") UUID id);

    @Query("SELECT s.tokenCost FROM VideoSegment s WHERE s.id = :id")
    Optional<Long> findTokenCostById(@Param("id") UUID id);

    @Query("SELECT MAX(s.position) FROM VideoSegment s WHERE s.workId = :workId AND s.episodeNum = :episodeNum")
    Optional<Integer> findMaxPosition(@Param("workId") UUID workId, @Param("episodeNum") Integer episodeNum);

    /**
     * Segments at or after {@code fromPosition}, highest position first.
     */
    @Query("""
            SELECT s FROM VideoSegment s
            WHERE s.workId = :workId
              AND s.episodeNum = :episodeNum
              AND s.position >= :fromPosition
            ORDER BY s.position DESC
            """)
    List<VideoSegment> findTailDescending(@Param("workId") UUID workId,
                                          @Param("episodeNum") Integer episodeNum,
                                          @Param("fromPosition") Integer fromPosition);

    /**
     * Segments the provider can be asked about, least recently touched first.
     */
    @Query("""
            SELECT s FROM VideoSegment s
            WHERE s.status IN :statuses
              AND s.providerTaskId IS NOT NULL
            ORDER BY s.updatedAt ASC
            """)
    List<VideoSegment> findPollable(@Param("statuses") Collection<SegmentStatus> statuses, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE VideoSegment s
            SET s.position = :position,
                s.version = s.version + 1
            WHERE s.id = :id
            """)
    int updatePosition(@Param("id") UUID id, @Param("position") Integer position);

    /**
     * Compare-and-set on status. Exactly one concurrent caller sees a row count of 1 for a given move.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE VideoSegment s
            SET s.status = :newStatus,
                s.resultUrl = :resultUrl,
                s.errorMessage = :errorMessage,
                s.completedAt = :completedAt,
                s.updatedAt = :now,
                s.version = s.version + 1
            WHERE s.id = :id
              AND s.status IN :expectedStatuses
            """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expectedStatuses") Collection<SegmentStatus> expectedStatuses,
                         @Param("newStatus") SegmentStatus newStatus,
                         @Param("resultUrl") String resultUrl,
                         @Param("errorMessage") String errorMessage,
                         @Param("completedAt") LocalDateTime completedAt,
                         @Param("now") LocalDateTime now);

    /**
     * Moves a pending segment to submitted and fixes its cost in the same statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE VideoSegment s
            SET s.status = :submitted,
                s.tokenCost = :tokenCost,
                s.errorMessage = NULL,
                s.updatedAt = :now,
                s.version = s.version + 1
            WHERE s.id = :id
              AND s.status = :pending
            """)
    int claimPending(@Param("id") UUID id,
                     @Param("tokenCost") Long tokenCost,
                     @Param("pending") SegmentStatus pending,
                     @Param("submitted") SegmentStatus submitted,
                     @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE VideoSegment s
            SET s.providerTaskId = :taskId,
                s.updatedAt = :now,
                s.version = s.version + 1
            WHERE s.id = :id
              AND s.providerTaskId IS NULL
            """)
    int recordProviderTask(@Param("id") UUID id, @Param("taskId") String taskId, @Param("now") LocalDateTime now);

    /**
     * Deletes only while no reservation is attached; in-flight segments must be failed first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM VideoSegment s WHERE s.id = :id AND s.status IN :statuses")
    int deleteByIdAndStatusIn(@Param("id") UUID id, @Param("statuses") Collection<SegmentStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM VideoSegment s
            WHERE s.workId = :workId
              AND s.episodeNum = :episodeNum
              AND s.status IN :statuses
            """)
    int deleteScopeInStatuses(@Param("workId") UUID workId,
                              @Param("episodeNum") Integer episodeNum,
                              @Param("statuses") Collection<SegmentStatus> statuses);
}
