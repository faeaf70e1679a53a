package com.flamingo.ai.climatechat.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.CacheEntry;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/** Redis-backed response cache storing entries as JSON strings with a per-key expiry. */
@Component
@ConditionalOnProperty(name = "rag.cache.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RedisResponseCache implements ResponseCache {

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Retry(name = "redis", fallbackMethod = "getFallback")
  public Optional<CacheEntry> get(String key) {
    String redisKey = redisKey(key);
    String json = redisTemplate.opsForValue().get(redisKey);
    if (json == null) {
      log.debug("Cache miss for key '{}'", key);
      meterRegistry.counter("rag.cache.miss").increment();
      return Optional.empty();
    }

    try {
      CacheEntry entry = objectMapper.readValue(json, CacheEntry.class);
      log.debug("Cache hit for key '{}'", key);
      meterRegistry.counter("rag.cache.hit").increment();
      return Optional.of(entry);
    } catch (JsonProcessingException e) {
      log.warn("Dropping corrupt cache entry '{}': {}", key, e.getOriginalMessage());
      meterRegistry.counter("rag.cache.corrupt").increment();
      redisTemplate.delete(redisKey);
      return Optional.empty();
    }
  }

  @SuppressWarnings("unused")
  Optional<CacheEntry> getFallback(String key, Throwable t) {
    log.warn("Cache unavailable for key '{}', treating as miss: {}", key, t.getMessage());
    meterRegistry.counter("rag.cache.error").increment();
    return Optional.empty();
  }

  @Override
  public boolean put(String key, CacheEntry entry) {
    try {
      String json = objectMapper.writeValueAsString(entry);
      // SET with EX writes value and expiry in one command
      redisTemplate
          .opsForValue()
          .set(redisKey(key), json, Duration.ofSeconds(ragConfig.getCache().getTtlSeconds()));
      log.debug("Cached response for key '{}'", key);
      return true;
    } catch (JsonProcessingException e) {
      log.warn("Could not serialize cache entry for '{}': {}", key, e.getOriginalMessage());
      return false;
    } catch (DataAccessException e) {
      log.warn("Could not write cache entry for '{}': {}", key, e.getMessage());
      meterRegistry.counter("rag.cache.error").increment();
      return false;
    }
  }

  @Override
  public void evict(String key) {
    try {
      redisTemplate.delete(redisKey(key));
    } catch (DataAccessException e) {
      log.warn("Could not evict cache entry '{}': {}", key, e.getMessage());
    }
  }

  private String redisKey(String key) {
    return ragConfig.getCache().getKeyPrefix() + key;
  }
}
