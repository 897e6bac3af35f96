package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.BlueprintRequest;
import ai.foundrystack.backend.model.dto.BlueprintView;
import ai.foundrystack.backend.model.entity.Blueprint;
import ai.foundrystack.backend.repository.BlueprintRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Blueprint records: creation, cached reads and cache invalidation.
 * Reads go through the blueprint cache namespace; cache failures fall back to the repository.
 * Only records in a terminal status are written to the cache, so a read racing a status
 * update cannot pin an in-progress view.
 */
@Slf4j
@Service
public class BlueprintService {

    private static final TypeReference<Map<String, Object>> CONTENT_TYPE = new TypeReference<>() {
    };

    private final BlueprintRepository blueprintRepository;
    private final CacheService cacheService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public BlueprintService(BlueprintRepository blueprintRepository,
                            CacheService cacheService,
                            ObjectMapper objectMapper,
                            Clock clock) {
        this.blueprintRepository = blueprintRepository;
        this.cacheService = cacheService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Blueprint createBlueprint(String ownerId, BlueprintRequest request) {
        Blueprint blueprint = new Blueprint();
        blueprint.setOwnerId(ownerId);
        blueprint.setTitle(request.getTitle().trim());
        blueprint.setIdea(request.getIdea().trim());
        blueprint.setDescription(request.getDescription());
        blueprint.setStatus(Blueprint.Status.DRAFT);

        Blueprint saved = blueprintRepository.save(blueprint);
        log.info("Created blueprint {} for user {}", saved.getId(), ownerId);
        return saved;
    }

    /**
     * @return true if the blueprint exists and was created by {@code ownerId}
     */
    public boolean isOwnedBy(UUID blueprintId, String ownerId) {
        return ownerId != null && blueprintRepository.existsByIdAndOwnerId(blueprintId, ownerId);
    }

    /**
     * Loads a blueprint on behalf of a user. Records owned by someone else are reported as missing.
     */
    public Optional<BlueprintView> findOwned(UUID blueprintId, String ownerId) {
        if (!isOwnedBy(blueprintId, ownerId)) {
            return Optional.empty();
        }
        return findBlueprint(blueprintId);
    }

    /**
     * Loads a blueprint, serving it from the cache when possible.
     */
    public Optional<BlueprintView> findBlueprint(UUID blueprintId) {
        String cacheKey = CacheNamespace.BLUEPRINT.key(blueprintId.toString());
        try {
            Optional<BlueprintView> cached = cacheService.get(cacheKey, BlueprintView.class);
            if (cached.isPresent()) {
                log.debug("Blueprint {} served from cache", blueprintId);
                return cached;
            }
        } catch (Exception e) {
            log.warn("Blueprint cache read failed for {}: {}", blueprintId, e.getMessage());
        }

        Optional<Blueprint> record = blueprintRepository.findById(blueprintId);
        Optional<BlueprintView> view = record.map(this::toView);
        if (record.isPresent() && record.get().getStatus() != null && record.get().getStatus().isTerminal()) {
            try {
                cacheService.set(cacheKey, view.get(), CacheNamespace.BLUEPRINT.getDefaultTtl());
            } catch (Exception e) {
                log.warn("Blueprint cache write failed for {}: {}", blueprintId, e.getMessage());
            }
        }
        return view;
    }

    public List<BlueprintView> findByOwner(String ownerId) {
        return blueprintRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(this::toView)
                .collect(Collectors.toList());
    }

    public void markGenerating(Blueprint blueprint) {
        updateStatus(blueprint, Blueprint.Status.GENERATING, null);
    }

    public void saveGeneratedContent(Blueprint blueprint, Map<String, Object> content) {
        try {
            updateStatus(blueprint, Blueprint.Status.COMPLETED, objectMapper.writeValueAsString(content));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Generated content could not be serialized", e);
        }
    }

    public void markFailed(Blueprint blueprint) {
        try {
            updateStatus(blueprint, Blueprint.Status.FAILED, null);
        } catch (Exception e) {
            log.error("Could not mark blueprint {} as failed: {}", blueprint.getId(), e.getMessage());
        }
    }

    public void evict(UUID blueprintId) {
        try {
            cacheService.delete(CacheNamespace.BLUEPRINT.key(blueprintId.toString()));
        } catch (Exception e) {
            log.warn("Failed to evict blueprint {} from cache: {}", blueprintId, e.getMessage());
        }
    }

    private void updateStatus(Blueprint blueprint, Blueprint.Status status, String generatedContent) {
        blueprint.setStatus(status);
        if (generatedContent != null) {
            blueprint.setGeneratedContent(generatedContent);
        }
        blueprint.setUpdatedAt(clock.instant());
        blueprintRepository.save(blueprint);
        evict(blueprint.getId());
    }

    private BlueprintView toView(Blueprint blueprint) {
        Map<String, Object> content = null;
        if (blueprint.getGeneratedContent() != null && !blueprint.getGeneratedContent().isBlank()) {
            try {
                content = objectMapper.readValue(blueprint.getGeneratedContent(), CONTENT_TYPE);
            } catch (JsonProcessingException e) {
                log.warn("Stored content of blueprint {} is not valid JSON: {}", blueprint.getId(), e.getOriginalMessage());
            }
        }
        return BlueprintView.from(blueprint, content);
    }
}
