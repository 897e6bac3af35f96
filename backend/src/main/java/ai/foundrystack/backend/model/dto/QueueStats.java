package ai.foundrystack.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Point-in-time view of the job processor queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStats {

    private int queueLength;

    private boolean draining;

    private boolean running;

    private int activeSubjects;

    private Map<String, Long> jobsByStatus;
}
