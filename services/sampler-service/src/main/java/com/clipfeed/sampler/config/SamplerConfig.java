package com.clipfeed.sampler.config;

import com.clipfeed.sampler.autocomplete.cache.AutocompleteCache;
import com.clipfeed.sampler.autocomplete.cache.AutocompleteCacheProperties;
import com.clipfeed.sampler.membership.MembershipCacheProperties;
import com.clipfeed.sampler.membership.MembershipLruCache;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@EnableConfigurationProperties({
    SamplerProperties.class,
    AutocompleteCacheProperties.class,
    MembershipCacheProperties.class
})
public class SamplerConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService samplerExecutor(SamplerProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getPoolSize()));
    }

    @Bean
    public Random samplerRandom() {
        return new Random();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskScheduler cacheSweepScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cache-sweep-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public AutocompleteCache autocompleteCache(
        AutocompleteCacheProperties properties,
        Clock clock,
        ThreadPoolTaskScheduler cacheSweepScheduler
    ) {
        return new AutocompleteCache(properties, clock, cacheSweepScheduler);
    }

    @Bean
    public MembershipLruCache membershipCache(MembershipCacheProperties properties) {
        return new MembershipLruCache(properties.getCapacity());
    }
}
