package ai.foundrystack.backend.controller;

import ai.foundrystack.backend.model.dto.CacheClearResponse;
import ai.foundrystack.backend.model.dto.CacheStatsResponse;
import ai.foundrystack.backend.model.dto.CacheWarmupResponse;
import ai.foundrystack.backend.service.CacheAdminService;
import ai.foundrystack.backend.service.CacheNamespace;
import ai.foundrystack.backend.service.CacheService;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Optional;

/**
 * Cache administration: statistics per namespace, invalidation and warmup check.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/cache")
public class CacheAdminController {

    private final CacheAdminService cacheAdminService;

    @Autowired
    public CacheAdminController(CacheAdminService cacheAdminService) {
        this.cacheAdminService = cacheAdminService;
    }

    @GetMapping
    public ResponseEntity<CacheStatsResponse> getStats() {
        try {
            return ResponseEntity.ok(cacheAdminService.getStats());
        } catch (CacheService.CacheServiceException e) {
            log.error("Failed to read cache statistics: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * Deletes one key ({@code ?key=}), one namespace ({@code ?type=}) or, without parameters,
     * every namespace.
     */
    @DeleteMapping
    public ResponseEntity<CacheClearResponse> clear(
            @RequestParam(value = "key", required = false) String key,
            @RequestParam(value = "type", required = false) String type) {
        try {
            if (key != null && !key.isBlank()) {
                return ResponseEntity.ok(cacheAdminService.deleteKey(key));
            }
            if (type != null && !type.isBlank()) {
                Optional<CacheNamespace> namespace = CacheNamespace.fromTypeName(type);
                if (namespace.isEmpty()) {
                    return ResponseEntity.badRequest().body(CacheClearResponse.builder()
                            .status("error")
                            .message("Unknown cache type: " + type)
                            .build());
                }
                return ResponseEntity.ok(cacheAdminService.clearNamespace(namespace.get()));
            }
            return ResponseEntity.ok(cacheAdminService.clearAll());
        } catch (CacheService.CacheServiceException e) {
            log.error("Failed to clear cache: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @PostMapping("/warmup")
    public ResponseEntity<CacheWarmupResponse> warmup() {
        return ResponseEntity.ok(cacheAdminService.warmup());
    }
}
