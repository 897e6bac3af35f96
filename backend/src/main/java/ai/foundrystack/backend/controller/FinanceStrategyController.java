package ai.foundrystack.backend.controller;

import ai.foundrystack.backend.model.dto.ErrorResponse;
import ai.foundrystack.backend.model.dto.FinanceStrategyRequest;
import ai.foundrystack.backend.model.dto.FinanceStrategyResponse;
import ai.foundrystack.backend.service.CacheService;
import ai.foundrystack.backend.service.FinanceStrategyService;
import ai.foundrystack.backend.service.FinanceTrialService;
import ai.foundrystack.backend.service.RateLimitService;
import ai.foundrystack.backend.service.exception.AgentExecutionException;
import ai.foundrystack.backend.service.exception.RateLimitExceededException;
import ai.foundrystack.backend.service.exception.TrialLimitExceededException;
import ai.foundrystack.backend.util.RequestUtils;

import io.micrometer.core.annotation.Timed;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;

/**
 * Synchronous funding strategy generation.
 * Each user gets a limited number of free generations; only successful ones are counted.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/finance-strategy")
public class FinanceStrategyController {

    private final FinanceStrategyService financeStrategyService;
    private final RateLimitService rateLimitService;
    private final FinanceTrialService financeTrialService;
    private final Clock clock;

    @Autowired
    public FinanceStrategyController(FinanceStrategyService financeStrategyService,
                                     RateLimitService rateLimitService,
                                     FinanceTrialService financeTrialService,
                                     Clock clock) {
        this.financeStrategyService = financeStrategyService;
        this.rateLimitService = rateLimitService;
        this.financeTrialService = financeTrialService;
        this.clock = clock;
    }

    @Timed(value = "http_request_duration_seconds", extraTags = {"endpoint", "/api/v1/finance-strategy", "operation", "finance_strategy"})
    @PostMapping
    public ResponseEntity<?> generateStrategy(
            @AuthenticationPrincipal Jwt jwt,
            @Valid @RequestBody FinanceStrategyRequest request,
            HttpServletRequest httpRequest) {
        String clientId = RequestUtils.resolveClientId(jwt, httpRequest);
        String subject = RequestUtils.subjectOf(jwt);
        String userId = subject != null ? subject : clientId;
        log.info("Received finance strategy request for {} from {}", request.getStartupName(), clientId);

        try {
            rateLimitService.checkRequest(clientId);
            financeTrialService.checkTrialAvailable(userId);

            FinanceStrategyResponse response = financeStrategyService.generateStrategy(request);
            response.setRemainingTrials(recordTrial(userId));
            return ResponseEntity.ok(response);

        } catch (TrialLimitExceededException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ErrorResponse.builder()
                            .error("Free trials exhausted")
                            .message("All " + e.getLimit() + " free finance strategies used. Upgrade to continue.")
                            .build());
        } catch (CacheService.CacheServiceException e) {
            log.error("Finance trial check failed for {}: {}", userId, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.builder().error("Trial limiter error").build());
        } catch (RateLimitExceededException e) {
            long retryAfter = Math.max(1, Duration.between(clock.instant(), e.getResetAt()).toSeconds());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header("Retry-After", String.valueOf(retryAfter))
                    .body(ErrorResponse.builder().error("Rate limit exceeded").build());
        } catch (AgentExecutionException e) {
            log.error("Finance strategy generation failed for {}: {}", request.getStartupName(), e.getMessage());
            HttpStatus status = statusFor(e.getKind());
            return ResponseEntity.status(status)
                    .body(ErrorResponse.builder()
                            .error("Failed to generate finance strategy")
                            .message(e.getMessage())
                            .stage(e.getStage())
                            .agent(e.getAgentName())
                            .build());
        }
    }

    /**
     * The strategy is already generated at this point, so a failing counter does not fail the request.
     */
    private Integer recordTrial(String userId) {
        try {
            return financeTrialService.recordTrial(userId);
        } catch (CacheService.CacheServiceException e) {
            log.error("Failed to record finance trial for {}: {}", userId, e.getMessage());
            return null;
        }
    }

    private static HttpStatus statusFor(AgentExecutionException.AgentFailureKind kind) {
        switch (kind) {
            case RATE_LIMITED:
                return HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case MODEL_CALL:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
