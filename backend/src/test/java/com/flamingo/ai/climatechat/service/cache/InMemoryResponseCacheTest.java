package com.flamingo.ai.climatechat.service.cache;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.climatechat.config.RagConfig;
import com.flamingo.ai.climatechat.domain.model.CacheEntry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryResponseCache Tests")
class InMemoryResponseCacheTest {

  private final AtomicLong nanos = new AtomicLong();
  private InMemoryResponseCache cache;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getCache().setTtlSeconds(3600);
    cache = new InMemoryResponseCache(ragConfig, new SimpleMeterRegistry(), nanos::get);
  }

  @Test
  @DisplayName("Should return what was stored within the TTL")
  void shouldReturnStoredEntryWithinTtl() {
    CacheEntry entry = new CacheEntry("Answer", List.of(), 0.9, null);
    cache.put("en:q", entry);

    nanos.addAndGet(Duration.ofMinutes(59).toNanos());

    assertThat(cache.get("en:q")).contains(entry);
  }

  @Test
  @DisplayName("Should expire entries after the TTL")
  void shouldExpireEntriesAfterTtl() {
    cache.put("en:q", new CacheEntry("Answer", List.of(), 0.9, null));

    nanos.addAndGet(Duration.ofSeconds(3601).toNanos());

    assertThat(cache.get("en:q")).isEmpty();
  }

  @Test
  @DisplayName("Should keep languages apart")
  void shouldKeepLanguagesApart() {
    cache.put("en:what is climate change?", new CacheEntry("Answer", List.of(), 0.9, null));

    assertThat(cache.get("es:what is climate change?")).isEmpty();
  }

  @Test
  @DisplayName("Should forget evicted entries")
  void shouldForgetEvictedEntries() {
    cache.put("en:q", new CacheEntry("Answer", List.of(), 0.9, null));
    cache.evict("en:q");

    assertThat(cache.get("en:q")).isEmpty();
  }
}
