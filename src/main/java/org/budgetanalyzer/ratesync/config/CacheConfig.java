package org.budgetanalyzer.ratesync.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;

/**
 * Redis cache configuration for canonical rate lookups.
 *
 * <p>Only the per-date canonical mapping is cached. Entries have no TTL: stored rates change only
 * through {@link org.budgetanalyzer.ratesync.service.RateStore#upsert}, which evicts the whole
 * cache after its transaction commits.
 */
@Configuration
@EnableCaching
public class CacheConfig {

  /** Cache of canonical rate mappings keyed by ISO date. */
  public static final String CANONICAL_RATES_CACHE = "canonicalRates";

  @Bean
  public GenericJackson2JsonRedisSerializer redisSerializer(ObjectMapper objectMapper) {
    var mapper = objectMapper.copy();

    var typeValidator =
        BasicPolymorphicTypeValidator.builder()
            .allowIfBaseType(Object.class)
            .allowIfSubType("org.budgetanalyzer")
            .allowIfSubType("java.util")
            .allowIfSubType("java.time")
            .build();

    mapper.activateDefaultTyping(typeValidator, ObjectMapper.DefaultTyping.NON_FINAL);

    return new GenericJackson2JsonRedisSerializer(mapper);
  }

  @Bean
  public RedisCacheManagerBuilderCustomizer redisCacheManagerBuilderCustomizer(
      GenericJackson2JsonRedisSerializer redisSerializer) {
    return builder ->
        builder
            .transactionAware()
            .withCacheConfiguration(
                CANONICAL_RATES_CACHE,
                RedisCacheConfiguration.defaultCacheConfig()
                    .entryTtl(Duration.ZERO)
                    .disableCachingNullValues()
                    .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            new StringRedisSerializer()))
                    .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(redisSerializer))
                    .prefixCacheNameWith("rate-sync-service:"));
  }
}
