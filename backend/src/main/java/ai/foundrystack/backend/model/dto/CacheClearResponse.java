package ai.foundrystack.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheClearResponse {

    private String status;

    private String message;

    private long cleared;

    /**
     * Number of keys matched by a bulk clear
     */
    private Long total;
}
