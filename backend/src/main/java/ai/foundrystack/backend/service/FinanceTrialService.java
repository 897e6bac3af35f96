package ai.foundrystack.backend.service;

import ai.foundrystack.backend.service.exception.TrialLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Counts finance strategy generations per user against a free trial allowance.
 *
 * The counter lives in the rate_limit cache namespace and expires a fixed period after the
 * first recorded trial, which resets the allowance. Only successful generations are counted.
 */
@Slf4j
@Service
public class FinanceTrialService {

    private static final String KEY_PREFIX = "finance_trials:";

    private final CacheService cacheService;
    private final int trialLimit;
    private final Duration trialPeriod;

    @Autowired
    public FinanceTrialService(CacheService cacheService,
                               @Value("${app.finance.trial-limit:2}") int trialLimit,
                               @Value("${app.finance.trial-period-days:7}") long trialPeriodDays) {
        if (trialLimit < 0) {
            throw new IllegalArgumentException("Trial limit must not be negative");
        }
        this.cacheService = cacheService;
        this.trialLimit = trialLimit;
        this.trialPeriod = Duration.ofDays(trialPeriodDays);
        log.info("Finance trials: {} per user, reset after {} days", trialLimit, trialPeriodDays);
    }

    /**
     * @throws TrialLimitExceededException when the user has no trials left
     * @throws CacheService.CacheServiceException when the counter cannot be read
     */
    public void checkTrialAvailable(String userId) {
        if (remainingTrials(userId) == 0) {
            log.info("User {} exhausted the finance strategy trials", userId);
            throw new TrialLimitExceededException(userId, trialLimit);
        }
    }

    /**
     * Counts one trial for the user.
     *
     * @return trials left after this one, never negative
     */
    public int recordTrial(String userId) {
        long used = cacheService.increment(key(userId), 1, trialPeriod);
        int remaining = (int) Math.max(trialLimit - used, 0);
        log.debug("User {} used {} of {} finance strategy trials", userId, used, trialLimit);
        return remaining;
    }

    public int remainingTrials(String userId) {
        return (int) Math.max(trialLimit - used(userId), 0);
    }

    private long used(String userId) {
        return cacheService.get(key(userId), Long.class).orElse(0L);
    }

    private static String key(String userId) {
        return CacheNamespace.RATE_LIMIT.key(KEY_PREFIX + userId);
    }
}
