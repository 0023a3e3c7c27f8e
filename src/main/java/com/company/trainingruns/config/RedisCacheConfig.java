package com.company.trainingruns.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext.SerializationPair;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.util.Map;

/**
 * Redis-backed caches for the read-heavy aggregates. The connection itself comes from
 * Boot's Lettuce auto-configuration ({@code spring.data.redis.*}).
 */
@Configuration
public class RedisCacheConfig {

    public static final String OBJECTIVE_STATISTICS = "objectiveStatistics";
    public static final String GRADIENT_COMPARISON = "gradientComparison";
    public static final String RUN_STATS = "runStats";

    /**
     * Analysis aggregates only change when a run's status or metrics change; those
     * writes evict them through {@code CacheEvictionService}.
     */
    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory, TrainingRunProperties properties) {
        TrainingRunProperties.Cache cache = properties.getCache();

        RedisCacheConfiguration base = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(cache.getAggregateTtl())
                .serializeKeysWith(SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(SerializationPair.fromSerializer(
                        new GenericJackson2JsonRedisSerializer(cacheObjectMapper())))
                .disableCachingNullValues()
                .prefixCacheNameWith(cache.getKeyPrefix());

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(base)
                .withInitialCacheConfigurations(Map.of(
                        RUN_STATS, base.entryTtl(cache.getStatsTtl()),
                        OBJECTIVE_STATISTICS, base,
                        GRADIENT_COMPARISON, base))
                .transactionAware()
                .build();
    }

    // cached values are domain objects and lists of them, so type info has to travel with the JSON
    private static ObjectMapper cacheObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .activateDefaultTyping(
                        BasicPolymorphicTypeValidator.builder()
                                .allowIfSubType("com.company.trainingruns.")
                                .allowIfSubType("java.util.")
                                .allowIfSubType("java.time.")
                                .build(),
                        ObjectMapper.DefaultTyping.NON_FINAL,
                        JsonTypeInfo.As.PROPERTY);
    }
}
