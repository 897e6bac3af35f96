package ai.foundrystack.backend.repository;

import ai.foundrystack.backend.model.entity.Blueprint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Provides CRUD operations for Blueprint entities.
 */
@Repository
public interface BlueprintRepository extends JpaRepository<Blueprint, UUID> {

    /**
     * Returns the blueprints created by the given user, newest first.
     *
     * @param ownerId the JWT subject of the creator
     * @return the user's blueprints
     */
    List<Blueprint> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    boolean existsByIdAndOwnerId(UUID id, String ownerId);
}
