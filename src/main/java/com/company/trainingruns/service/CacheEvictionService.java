package com.company.trainingruns.service;

import com.company.trainingruns.config.RedisCacheConfig;
import com.company.trainingruns.event.ObjectiveMetricsUpdatedEvent;
import com.company.trainingruns.event.RunDeletedEvent;
import com.company.trainingruns.event.RunRegisteredEvent;
import com.company.trainingruns.event.RunStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Aggregates span many runs, so any change to a run's status or metrics clears them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final CacheManager cacheManager;

    @EventListener
    @Async
    public void onRunRegistered(RunRegisteredEvent event) {
        clear(RedisCacheConfig.RUN_STATS);
    }

    @EventListener
    @Async
    public void onStatusChanged(RunStatusChangedEvent event) {
        clear(RedisCacheConfig.RUN_STATS);
        clear(RedisCacheConfig.OBJECTIVE_STATISTICS);
        clear(RedisCacheConfig.GRADIENT_COMPARISON);
    }

    @EventListener
    @Async
    public void onObjectiveMetricsUpdated(ObjectiveMetricsUpdatedEvent event) {
        clear(RedisCacheConfig.OBJECTIVE_STATISTICS);
        clear(RedisCacheConfig.GRADIENT_COMPARISON);
    }

    @EventListener
    @Async
    public void onRunDeleted(RunDeletedEvent event) {
        clear(RedisCacheConfig.RUN_STATS);
        clear(RedisCacheConfig.OBJECTIVE_STATISTICS);
        clear(RedisCacheConfig.GRADIENT_COMPARISON);
    }

    private void clear(String cacheName) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache != null) {
            cache.clear();
            log.debug("Cleared {} cache", cacheName);
        }
    }
}
