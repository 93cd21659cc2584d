package com.incoresoft.sosync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for safety check completion evaluation. Only the evaluation is retried,
 * never the write that triggered it.
 */
@Configuration
public class EvaluationRetryConfig {

    @Bean
    public RetryTemplate evaluationRetryTemplate(SafetyProps props) {
        long backoffMillis = Math.max(1L, props.getSettleDelay().toMillis());
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, props.getEvaluationAttempts()))
                .fixedBackoff(backoffMillis)
                .retryOn(DataAccessException.class)
                .build();
    }
}
