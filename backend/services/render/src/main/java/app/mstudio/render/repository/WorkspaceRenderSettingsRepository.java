package app.mstudio.render.repository;

import app.mstudio.render.domain.entity.WorkspaceRenderSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface WorkspaceRenderSettingsRepository extends JpaRepository<WorkspaceRenderSettingsEntity, UUID> {
}
