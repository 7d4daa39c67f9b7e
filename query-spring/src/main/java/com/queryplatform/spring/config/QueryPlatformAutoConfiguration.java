package com.queryplatform.spring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.queryplatform.core.cache.CacheConfig;
import com.queryplatform.core.cache.EvictionPolicy;
import com.queryplatform.core.offline.InMemoryOfflineQueueStore;
import com.queryplatform.core.offline.JsonFileOfflineQueueStore;
import com.queryplatform.core.offline.MutationHandlerRegistry;
import com.queryplatform.core.offline.NetworkStatus;
import com.queryplatform.core.offline.OfflineQueueManager;
import com.queryplatform.core.offline.OfflineQueueStore;
import com.queryplatform.core.query.QueryClient;
import com.queryplatform.core.query.QueryClientConfig;
import com.queryplatform.core.query.RetryPolicy;
import com.queryplatform.spring.offline.OfflineReplayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires one process-wide {@link QueryClient} plus the offline mutation queue from
 * {@code query-platform.*} properties. Every bean backs off when the application defines its own.
 *
 * <p>Durations accept both the short form ({@code 5s}, {@code 250ms}) and ISO-8601 ({@code PT5S}).
 */
@AutoConfiguration
public class QueryPlatformAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(QueryPlatformAutoConfiguration.class);

    @Value("${query-platform.cache.max-entries:1000}")
    private int maxEntries;

    @Value("${query-platform.cache.eviction-policy:LRU}")
    private String evictionPolicy;

    @Value("${query-platform.cache.default-stale-time:0s}")
    private String defaultStaleTime;

    @Value("${query-platform.cache.default-cache-time:5m}")
    private String defaultCacheTime;

    @Value("${query-platform.cache.gc-interval:30s}")
    private String gcInterval;

    @Value("${query-platform.query.dispose-delay:5s}")
    private String disposeDelay;

    @Value("${query-platform.query.max-retries:3}")
    private int maxRetries;

    @Value("${query-platform.query.initial-retry-delay:1s}")
    private String initialRetryDelay;

    @Value("${query-platform.query.retry-multiplier:2.0}")
    private double retryMultiplier;

    @Value("${query-platform.worker.pool-size:2}")
    private int workerPoolSize;

    @Value("${query-platform.offline.queue-file:}")
    private String offlineQueueFile;

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock queryPlatformClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryClientConfig queryClientConfig() {
        CacheConfig cache = new CacheConfig(
            maxEntries,
            EvictionPolicy.valueOf(evictionPolicy.trim().toUpperCase()),
            duration(defaultStaleTime),
            duration(defaultCacheTime),
            duration(gcInterval));
        RetryPolicy retry = new RetryPolicy(maxRetries, duration(initialRetryDelay), retryMultiplier);
        return new QueryClientConfig(cache, duration(disposeDelay), retry, null, workerPoolSize);
    }

    @Bean
    @ConditionalOnMissingBean
    public NetworkStatus networkStatus() {
        return new NetworkStatus(true);
    }

    @Bean(destroyMethod = "dispose")
    @ConditionalOnMissingBean
    public QueryClient queryClient(QueryClientConfig config, Clock queryPlatformClock, NetworkStatus networkStatus) {
        return new QueryClient(config, queryPlatformClock, Schedulers.parallel(), networkStatus);
    }

    @Bean
    @ConditionalOnMissingBean
    public MutationHandlerRegistry mutationHandlerRegistry(ObjectMapper objectMapper) {
        return new MutationHandlerRegistry(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public OfflineQueueStore offlineQueueStore(ObjectMapper objectMapper) {
        if (offlineQueueFile == null || offlineQueueFile.isBlank()) {
            log.info("OFFLINE_QUEUE_STORE type=in-memory");
            return new InMemoryOfflineQueueStore();
        }
        log.info("OFFLINE_QUEUE_STORE type=json-file path={}", offlineQueueFile);
        return new JsonFileOfflineQueueStore(Path.of(offlineQueueFile), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public OfflineQueueManager offlineQueueManager(OfflineQueueStore offlineQueueStore,
                                                   MutationHandlerRegistry mutationHandlerRegistry,
                                                   ObjectMapper objectMapper,
                                                   Clock queryPlatformClock) {
        return new OfflineQueueManager(offlineQueueStore, mutationHandlerRegistry, objectMapper,
            queryPlatformClock, Schedulers.boundedElastic());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "query-platform.offline", name = "replay-on-reconnect",
                           havingValue = "true", matchIfMissing = true)
    public OfflineReplayScheduler offlineReplayScheduler(NetworkStatus networkStatus,
                                                         OfflineQueueManager offlineQueueManager) {
        return new OfflineReplayScheduler(networkStatus, offlineQueueManager);
    }

    private static Duration duration(String value) {
        return DurationStyle.detectAndParse(value.trim());
    }
}
