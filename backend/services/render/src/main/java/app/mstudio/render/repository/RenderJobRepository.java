package app.mstudio.render.repository;

import app.mstudio.render.domain.entity.RenderJobEntity;
import app.mstudio.render.domain.type.RenderJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RenderJobRepository extends JpaRepository<RenderJobEntity, UUID> {
    Optional<RenderJobEntity> findByJobIdAndWorkspaceId(UUID jobId, UUID workspaceId);

    Optional<RenderJobEntity> findFirstByVersionIdAndWorkspaceIdOrderByCreatedAtDesc(UUID versionId, UUID workspaceId);

    /**
     * Active jobs for one render slot of a version. Single renders use slot 0, plan scenes use their scene number.
     */
    @Query("""
            select j from RenderJobEntity j
            where j.versionId = :versionId
              and coalesce(j.sceneNumber, 0) = :slot
              and j.status in :statuses
            order by j.createdAt desc
            """)
    List<RenderJobEntity> findInSlot(@Param("versionId") UUID versionId,
                                     @Param("slot") int slot,
                                     @Param("statuses") Collection<RenderJobStatus> statuses);

    List<RenderJobEntity> findByStatusInAndProviderJobIdIsNotNullOrderByUpdatedAtAsc(Collection<RenderJobStatus> statuses,
                                                                                    Pageable pageable);
}
