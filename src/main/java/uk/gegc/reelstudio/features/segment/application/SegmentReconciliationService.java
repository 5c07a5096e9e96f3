package uk.gegc.reelstudio.features.segment.application;

import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

import java.util.Collection;

/**
 * Brings local segment state in line with the provider, applying each transition exactly once no matter
 * how many passes race over the same segment.
 */
public interface SegmentReconciliationService {

    /**
     * Polls the pollable members of {@code segments}. Per-segment failures are logged and counted; they
     * never abort the rest of the pass.
     */
    ReconciliationResult reconcile(Collection<VideoSegment> segments);

    /**
     * One background pass over the oldest pollable segments.
     */
    ReconciliationResult sweep();
}
