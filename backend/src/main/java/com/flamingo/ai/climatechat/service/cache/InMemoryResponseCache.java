package com.flamingo.ai.climatechat.service.cache;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Process-local response cache for single-instance deployments and tests. */
@Component
@ConditionalOnProperty(name = "rag.cache.type", havingValue = "memory")
@Slf4j
public class InMemoryResponseCache implements ResponseCache {

  private static final long MAX_ENTRIES = 10_000L;

  private final Cache<String, CacheEntry> cache;
  private final MeterRegistry meterRegistry;

  @Autowired
  public InMemoryResponseCache(RagConfig ragConfig, MeterRegistry meterRegistry) {
    this(ragConfig, meterRegistry, Ticker.systemTicker());
  }

  InMemoryResponseCache(RagConfig ragConfig, MeterRegistry meterRegistry, Ticker ticker) {
    this.meterRegistry = meterRegistry;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(MAX_ENTRIES)
            .expireAfterWrite(Duration.ofSeconds(ragConfig.getCache().getTtlSeconds()))
            .ticker(ticker)
            .build();
    log.info(
        "In-memory response cache initialized: ttl={}s", ragConfig.getCache().getTtlSeconds());
  }

  @Override
  public Optional<CacheEntry> get(String key) {
    CacheEntry entry = cache.getIfPresent(key);
    meterRegistry.counter(entry == null ? "rag.cache.miss" : "rag.cache.hit").increment();
    return Optional.ofNullable(entry);
  }

  @Override
  public boolean put(String key, CacheEntry entry) {
    cache.put(key, entry);
    return true;
  }

  @Override
  public void evict(String key) {
    cache.invalidate(key);
  }
}
