package ai.foundrystack.backend.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for creating a blueprint and queueing its generation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlueprintRequest {

    @NotBlank(message = "Title is required")
    @Size(min = 3, max = 100, message = "Title must be between 3 and 100 characters")
    private String title;

    @NotBlank(message = "Idea is required")
    @Size(min = 10, max = 1000, message = "Idea must be between 10 and 1000 characters")
    @Pattern(regexp = "(?is)^(?!.*(<script|javascript:|on\\w+\\s*=)).*$",
            message = "Idea contains potentially unsafe content")
    private String idea;

    @Size(max = 2000, message = "Description must not exceed 2000 characters")
    private String description;
}
