package app.mstudio.render.repository;

import app.mstudio.render.domain.entity.RenderLedgerEntryEntity;
import app.mstudio.render.domain.type.LedgerStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Repository
public interface RenderLedgerRepository extends JpaRepository<RenderLedgerEntryEntity, Long> {

    @Query("""
            select coalesce(sum(e.estimatedCostUsd), 0)
            from RenderLedgerEntryEntity e
            where e.workspaceId = :workspaceId
              and e.submittedAt >= :since
              and e.status <> :excluded
            """)
    BigDecimal sumEstimatedCostSince(@Param("workspaceId") UUID workspaceId,
                                     @Param("since") Instant since,
                                     @Param("excluded") LedgerStatus excluded);

    @Query("""
            select count(e)
            from RenderLedgerEntryEntity e
            where e.workspaceId = :workspaceId
              and e.submittedAt >= :since
              and e.status <> :excluded
            """)
    long countAttemptsSince(@Param("workspaceId") UUID workspaceId,
                            @Param("since") Instant since,
                            @Param("excluded") LedgerStatus excluded);
}
