package com.comiccomp.collector.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the {@link TimeLimiterRegistry} that holds one {@link TimeLimiter} per
 * marketplace. The orchestrator asks the registry for the marketplace's limiter,
 * configured with that marketplace's timeout, and runs every fetch attempt through
 * it; a running fetch is cancelled when its limiter times out.
 * </p>
 * <p>
 * Breaking and retrying are not done with Resilience4j: they need per-error-category
 * behaviour (immediate opening on authentication errors, category-specific
 * backoff) which the collector's own breaker and retry scheduler provide.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /**
     * Creates the global {@link TimeLimiterRegistry}.
     *
     * @return a registry whose default limiter cancels the running future on timeout
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .cancelRunningFuture(true)
                .build());
    }

}
