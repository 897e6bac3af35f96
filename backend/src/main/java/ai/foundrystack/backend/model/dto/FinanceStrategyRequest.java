package ai.foundrystack.backend.model.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Startup profile submitted for a funding strategy
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinanceStrategyRequest {

    @NotBlank(message = "Startup name is required")
    @Size(max = 100)
    private String startupName;

    @NotBlank(message = "Industry is required")
    private String industry;

    @NotBlank(message = "Geography is required")
    private String geography;

    @NotBlank(message = "Business model is required")
    private String businessModel;

    @NotBlank(message = "Main financial concern is required")
    @Size(max = 500)
    private String mainFinancialConcern;

    @Min(value = 1, message = "Team size must be at least 1")
    @Max(value = 100000, message = "Team size is out of range")
    private int teamSize;

    /**
     * Idea, MVP, Launched, Growth
     */
    private String productStage;

    private String targetMarket;

    @PositiveOrZero(message = "Monthly revenue cannot be negative")
    private Double monthlyRevenue;

    private String growthRate;

    @Size(max = 1000)
    private String tractionSummary;

    @PositiveOrZero(message = "Funding goal cannot be negative")
    private Double fundingGoal;
}
