package ai.foundrystack.backend.controller;

import ai.foundrystack.backend.config.ClockConfig;
import ai.foundrystack.backend.config.SecurityConfig;
import ai.foundrystack.backend.model.dto.CacheClearResponse;
import ai.foundrystack.backend.model.dto.CacheStatsResponse;
import ai.foundrystack.backend.model.dto.CacheWarmupResponse;
import ai.foundrystack.backend.service.CacheAdminService;
import ai.foundrystack.backend.service.CacheNamespace;
import ai.foundrystack.backend.service.CacheService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CacheAdminController.class)
@Import({SecurityConfig.class, ClockConfig.class})
class CacheAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CacheAdminService cacheAdminService;

    @Test
    void statsShouldListNamespaces() throws Exception {
        when(cacheAdminService.getStats()).thenReturn(CacheStatsResponse.builder()
                .namespaces(Map.of("pipeline", CacheStatsResponse.NamespaceStats.builder()
                        .count(12)
                        .keys(List.of("pipeline:a"))
                        .hasMore(true)
                        .build()))
                .totalKeys(12)
                .timestamp(Instant.now())
                .build());

        mockMvc.perform(get("/api/v1/cache")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.namespaces.pipeline.count").value(12))
                .andExpect(jsonPath("$.namespaces.pipeline.hasMore").value(true))
                .andExpect(jsonPath("$.totalKeys").value(12));
    }

    @Test
    void statsShouldReturn503WhenCacheUnavailable() throws Exception {
        when(cacheAdminService.getStats()).thenThrow(new CacheService.CacheServiceException("Connection refused"));

        mockMvc.perform(get("/api/v1/cache")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void deleteByKeyShouldRemoveSingleKey() throws Exception {
        when(cacheAdminService.deleteKey("blueprint:123"))
                .thenReturn(CacheClearResponse.builder().status("success").cleared(1).build());

        mockMvc.perform(delete("/api/v1/cache").param("key", "blueprint:123")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(1));
    }

    @Test
    void deleteByTypeShouldClearNamespace() throws Exception {
        when(cacheAdminService.clearNamespace(CacheNamespace.PIPELINE))
                .thenReturn(CacheClearResponse.builder().status("success").cleared(0).total(0L).build());

        mockMvc.perform(delete("/api/v1/cache").param("type", "pipeline")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cleared").value(0))
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void deleteByUnknownTypeShouldReturn400() throws Exception {
        mockMvc.perform(delete("/api/v1/cache").param("type", "nonsense")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        verifyNoInteractions(cacheAdminService);
    }

    @Test
    void deleteWithoutParametersShouldClearEverything() throws Exception {
        when(cacheAdminService.clearAll())
                .thenReturn(CacheClearResponse.builder().status("success").cleared(7).total(7L).build());

        mockMvc.perform(delete("/api/v1/cache")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(7));
    }

    @Test
    void warmupShouldReportPerBlueprintStatus() throws Exception {
        when(cacheAdminService.warmup()).thenReturn(CacheWarmupResponse.builder()
                .status("success")
                .results(List.of(new CacheWarmupResponse.WarmupResult("mock-1", "would_cache")))
                .build());

        mockMvc.perform(post("/api/v1/cache/warmup")
                .with(jwt().jwt(jwt -> jwt.subject("admin"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].status").value("would_cache"));
    }

    @Test
    void cacheEndpointsShouldRequireAuthentication() throws Exception {
        mockMvc.perform(get("/api/v1/cache"))
                .andExpect(status().isUnauthorized());
    }
}
