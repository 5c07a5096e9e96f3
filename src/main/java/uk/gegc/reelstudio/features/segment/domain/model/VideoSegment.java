package uk.gegc.reelstudio.features.segment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.DynamicUpdate;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One generation job, placed at {@code position} within its (work, episode) scope.
 *
 * <p>Status, position and settlement-relevant fields are only changed through the guarded bulk updates in
 * {@link uk.gegc.reelstudio.features.segment.domain.repository.VideoSegmentRepository}. Entity saves are
 * reserved for creation and descriptive edits; {@code @Version} makes such an edit fail rather than
 * overwrite a concurrent status change.
 */
@Entity
@Table(
        name = "video_segments",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_video_segments_scope_position",
                columnNames = {"work_id", "episode_num", "position"}
        ),
        indexes = @Index(name = "idx_video_segments_status", columnList = "status")
)
@DynamicUpdate
@Getter
@Setter
@NoArgsConstructor
public class VideoSegment {

    /**
     * Highest position a segment may hold. Everything above is kept free so that shifting by one and
     * parking on a scratch value stay inside {@code int} range.
     */
    public static final int MAX_POSITION = Integer.MAX_VALUE - 1_000_001;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "work_id", nullable = false, updatable = false)
    private UUID workId;

    @Column(name = "episode_num", nullable = false, updatable = false)
    private Integer episodeNum;

    /**
     * Non-negative once committed; negative values only exist inside a reindex transaction.
     */
    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "scene_num")
    private Integer sceneNum;

    @Column(name = "prompt", nullable = false, columnDefinition = "TEXT")
    private String prompt;

    @Column(name = "shot_type", length = 50)
    private String shotType;

    @Column(name = "camera_move", length = 50)
    private String cameraMove;

    @Column(name = "model", nullable = false, length = 50)
    private String model;

    @Column(name = "resolution", nullable = false, length = 20)
    private String resolution;

    @Column(name = "duration_sec", nullable = false)
    private Integer durationSec;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SegmentStatus status;

    @Column(name = "provider_task_id")
    private String providerTaskId;

    @Column(name = "result_url", length = 2048)
    private String resultUrl;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    /**
     * Tokens reserved at submission. {@code null} means the segment was never charged; {@code 0} is an
     * explicit free segment. Neither is settled.
     */
    @Column(name = "token_cost")
    private Long tokenCost;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    /**
     * Creates a pending segment stamped with {@code now}. The caller assigns the position.
     */
    public static VideoSegment draft(UUID workId, Integer episodeNum, LocalDateTime now) {
        VideoSegment segment = new VideoSegment();
        segment.setWorkId(workId);
        segment.setEpisodeNum(episodeNum);
        segment.setStatus(SegmentStatus.PENDING);
        segment.setCreatedAt(now);
        segment.setUpdatedAt(now);
        return segment;
    }

    public boolean isBillable() {
        return tokenCost != null && tokenCost > 0;
    }

    public boolean isPollable() {
        return status != null && status.isInFlight() && providerTaskId != null && model != null;
    }
}
