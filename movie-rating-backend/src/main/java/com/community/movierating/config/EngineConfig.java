package com.community.movierating.config;

import com.community.movierating.gateway.ChatGateway;
import com.community.movierating.gateway.LoggingChatGateway;
import com.community.movierating.gateway.LoggingRatingDisplay;
import com.community.movierating.gateway.RatingDisplay;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Infrastructure beans of the rating engine.
 */
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the cache sweep and self-action marker expiry.
     */
    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("rating-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Worker pool for reaction events.
     */
    @Bean(name = "reactionEventExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor reactionEventExecutor(MovieRatingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEvents().getPoolSize());
        executor.setMaxPoolSize(properties.getEvents().getPoolSize());
        executor.setQueueCapacity(properties.getEvents().getQueueCapacity());
        executor.setThreadNamePrefix("reaction-event-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    // fallbacks until a chat platform adapter registers its own beans

    @Bean
    @ConditionalOnMissingBean
    public ChatGateway chatGateway() {
        return new LoggingChatGateway();
    }

    @Bean
    @ConditionalOnMissingBean
    public RatingDisplay ratingDisplay() {
        return new LoggingRatingDisplay();
    }
}
