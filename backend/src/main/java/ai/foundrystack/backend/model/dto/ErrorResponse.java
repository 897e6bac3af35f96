package ai.foundrystack.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;

    private String message;

    /**
     * Agent stage that failed, for agent chain errors
     */
    private Integer stage;

    private String agent;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
