package uk.gegc.reelstudio.features.work.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.reelstudio.features.work.domain.model.Work;
import uk.gegc.reelstudio.features.work.domain.repository.WorkRepository;
import uk.gegc.reelstudio.shared.exception.ForbiddenException;
import uk.gegc.reelstudio.shared.exception.ResourceNotFoundException;

import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class WorkAccessService {

    private final WorkRepository workRepository;

    /**
     * Ownership guard used by the API layer before any segment or ledger call.
     */
    @Transactional(readOnly = true)
    public void requireOwner(UUID workId, UUID userId) {
        UUID ownerId = workRepository.findOwnerIdById(workId)
                .orElseThrow(() -> new ResourceNotFoundException("Work " + workId + " not found"));
        if (!ownerId.equals(userId)) {
            log.warn("User {} denied access to work {} owned by {}", userId, workId, ownerId);
            throw new ForbiddenException("You do not have access to work " + workId);
        }
    }

    @Transactional(readOnly = true)
    public Optional<UUID> findOwner(UUID workId) {
        return workRepository.findOwnerIdById(workId);
    }

    /**
     * Takes a row lock on the work for the rest of the caller's transaction. Concurrent reindex operations on
     * any episode of the same work queue behind it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Work lockForReindex(UUID workId) {
        return workRepository.findByIdForUpdate(workId)
                .orElseThrow(() -> new ResourceNotFoundException("Work " + workId + " not found"));
    }
}
