package app.mstudio.render.repository;

import app.mstudio.render.domain.entity.ProviderCredentialEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProviderCredentialRepository extends JpaRepository<ProviderCredentialEntity, UUID> {
    Optional<ProviderCredentialEntity> findByWorkspaceIdAndProvider(UUID workspaceId, String provider);

    List<ProviderCredentialEntity> findByWorkspaceIdOrderByProviderAsc(UUID workspaceId);
}
