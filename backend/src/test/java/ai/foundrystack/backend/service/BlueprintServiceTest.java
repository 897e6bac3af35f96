package ai.foundrystack.backend.service;

import ai.foundrystack.backend.model.dto.BlueprintRequest;
import ai.foundrystack.backend.model.dto.BlueprintView;
import ai.foundrystack.backend.model.entity.Blueprint;
import ai.foundrystack.backend.repository.BlueprintRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BlueprintServiceTest {

    @Mock
    private BlueprintRepository blueprintRepository;

    private TestClock clock;
    private InMemoryCacheService cacheService;
    private BlueprintService blueprintService;
    private Blueprint blueprint;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-01-01T10:00:00Z"));
        cacheService = new InMemoryCacheService(clock);
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.findAndRegisterModules();
        blueprintService = new BlueprintService(blueprintRepository, cacheService, objectMapper, clock);

        blueprint = new Blueprint();
        blueprint.setId(UUID.randomUUID());
        blueprint.setOwnerId("user-1");
        blueprint.setTitle("PawPal");
        blueprint.setIdea("A marketplace connecting pet owners with vetted sitters");
        blueprint.setStatus(Blueprint.Status.DRAFT);
        blueprint.setCreatedAt(Instant.parse("2024-01-01T09:00:00Z"));
    }

    @Test
    void createShouldTrimAndStartAsDraft() {
        when(blueprintRepository.save(any(Blueprint.class))).thenAnswer(invocation -> {
            Blueprint saved = invocation.getArgument(0);
            saved.setId(UUID.randomUUID());
            return saved;
        });
        BlueprintRequest request = BlueprintRequest.builder()
                .title("  PawPal ")
                .idea(" A marketplace connecting pet owners with sitters ")
                .build();

        Blueprint created = blueprintService.createBlueprint("user-1", request);

        assertThat(created.getTitle()).isEqualTo("PawPal");
        assertThat(created.getIdea()).isEqualTo("A marketplace connecting pet owners with sitters");
        assertThat(created.getStatus()).isEqualTo(Blueprint.Status.DRAFT);
        assertThat(created.getOwnerId()).isEqualTo("user-1");
    }

    @Test
    void findShouldPopulateCacheAndServeLaterReadsFromIt() {
        blueprint.setStatus(Blueprint.Status.COMPLETED);
        when(blueprintRepository.findById(blueprint.getId())).thenReturn(Optional.of(blueprint));

        Optional<BlueprintView> first = blueprintService.findBlueprint(blueprint.getId());
        Optional<BlueprintView> second = blueprintService.findBlueprint(blueprint.getId());

        assertThat(first).isPresent();
        assertThat(second).contains(first.get());
        assertThat(cacheService.exists("blueprint:" + blueprint.getId())).isTrue();
        verify(blueprintRepository, times(1)).findById(blueprint.getId());
    }

    @Test
    void cacheFailureShouldFallBackToRepository() {
        CacheService failing = mock(CacheService.class);
        when(failing.get(anyString(), any())).thenThrow(new CacheService.CacheServiceException("down"));
        doThrow(new CacheService.CacheServiceException("down"))
                .when(failing).set(anyString(), any(), any(Duration.class));
        BlueprintService service = new BlueprintService(blueprintRepository, failing, new ObjectMapper(), clock);
        when(blueprintRepository.findById(blueprint.getId())).thenReturn(Optional.of(blueprint));

        Optional<BlueprintView> view = service.findBlueprint(blueprint.getId());

        assertThat(view).map(BlueprintView::getTitle).contains("PawPal");
    }

    @Test
    void inProgressBlueprintShouldNotBeCached() {
        blueprint.setStatus(Blueprint.Status.GENERATING);
        when(blueprintRepository.findById(blueprint.getId())).thenReturn(Optional.of(blueprint));

        assertThat(blueprintService.findBlueprint(blueprint.getId())).map(BlueprintView::getStatus).contains("GENERATING");
        assertThat(cacheService.exists("blueprint:" + blueprint.getId())).isFalse();

        blueprint.setStatus(Blueprint.Status.COMPLETED);
        assertThat(blueprintService.findBlueprint(blueprint.getId())).map(BlueprintView::getStatus).contains("COMPLETED");
    }

    @Test
    void findOwnedShouldHideBlueprintsOfOtherUsers() {
        when(blueprintRepository.existsByIdAndOwnerId(blueprint.getId(), "user-2")).thenReturn(false);

        assertThat(blueprintService.findOwned(blueprint.getId(), "user-2")).isEmpty();
        assertThat(blueprintService.findOwned(blueprint.getId(), null)).isEmpty();
        verify(blueprintRepository, never()).findById(any());
    }

    @Test
    void findOwnedShouldReturnOwnersBlueprint() {
        when(blueprintRepository.existsByIdAndOwnerId(blueprint.getId(), "user-1")).thenReturn(true);
        when(blueprintRepository.findById(blueprint.getId())).thenReturn(Optional.of(blueprint));

        assertThat(blueprintService.findOwned(blueprint.getId(), "user-1")).map(BlueprintView::getTitle).contains("PawPal");
    }

    @Test
    void missingBlueprintShouldNotBeCached() {
        UUID id = UUID.randomUUID();
        when(blueprintRepository.findById(id)).thenReturn(Optional.empty());

        assertThat(blueprintService.findBlueprint(id)).isEmpty();
        assertThat(cacheService.exists("blueprint:" + id)).isFalse();
    }

    @Test
    void savingContentShouldCompleteAndEvict() {
        when(blueprintRepository.findById(blueprint.getId())).thenReturn(Optional.of(blueprint));
        blueprintService.findBlueprint(blueprint.getId());

        blueprintService.saveGeneratedContent(blueprint, Map.of("marketAnalysis", Map.of("size", "large")));

        assertThat(blueprint.getStatus()).isEqualTo(Blueprint.Status.COMPLETED);
        assertThat(blueprint.getGeneratedContent()).contains("\"marketAnalysis\"");
        assertThat(blueprint.getUpdatedAt()).isEqualTo(Instant.parse("2024-01-01T10:00:00Z"));
        assertThat(cacheService.exists("blueprint:" + blueprint.getId())).isFalse();
        verify(blueprintRepository).save(blueprint);

        BlueprintView reloaded = blueprintService.findBlueprint(blueprint.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo("COMPLETED");
        assertThat(reloaded.getContent()).containsKey("marketAnalysis");
    }

    @Test
    void markFailedShouldNotThrowWhenSaveFails() {
        when(blueprintRepository.save(blueprint)).thenThrow(new IllegalStateException("db down"));

        blueprintService.markFailed(blueprint);

        assertThat(blueprint.getStatus()).isEqualTo(Blueprint.Status.FAILED);
    }

    @Test
    void invalidStoredContentShouldYieldViewWithoutContent() {
        blueprint.setGeneratedContent("{broken");
        when(blueprintRepository.findByOwnerIdOrderByCreatedAtDesc("user-1")).thenReturn(List.of(blueprint));

        List<BlueprintView> views = blueprintService.findByOwner("user-1");

        assertThat(views).singleElement().satisfies(view -> {
            assertThat(view.getContent()).isNull();
            assertThat(view.getCreatedAt()).isEqualTo("2024-01-01T09:00:00Z");
        });
        verify(blueprintRepository, never()).save(any());
    }
}
