package ai.foundrystack.backend.model.dto;

import ai.foundrystack.backend.model.entity.Blueprint;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Read model of a blueprint record as served by the API and stored in the blueprint cache.
 * Timestamps are ISO-8601 strings so the cached JSON round-trips without type information.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlueprintView {

    private String id;

    private String title;

    private String idea;

    private String description;

    private String status;

    private Map<String, Object> content;

    private String createdAt;

    private String updatedAt;

    public static BlueprintView from(Blueprint blueprint, Map<String, Object> content) {
        return BlueprintView.builder()
                .id(blueprint.getId() != null ? blueprint.getId().toString() : null)
                .title(blueprint.getTitle())
                .idea(blueprint.getIdea())
                .description(blueprint.getDescription())
                .status(blueprint.getStatus() != null ? blueprint.getStatus().name() : null)
                .content(content)
                .createdAt(blueprint.getCreatedAt() != null ? blueprint.getCreatedAt().toString() : null)
                .updatedAt(blueprint.getUpdatedAt() != null ? blueprint.getUpdatedAt().toString() : null)
                .build();
    }
}
