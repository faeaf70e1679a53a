package com.flamingo.ai.climatechat.service.cache;

import com.flamingo.ai.climatechat.domain.model.CacheEntry;
import java.util.Optional;

/**
 * Expiring store of computed answers keyed by {@code language:normalized query}. Implementations
 * are shared by all in-flight requests and must be safe for concurrent use. Store failures are
 * absorbed: a failing read is a miss and a failing write returns {@code false}.
 */
public interface ResponseCache {

  Optional<CacheEntry> get(String key);

  /**
   * Writes the entry atomically, replacing any previous value and restarting its time to live.
   *
   * @return whether the entry was stored
   */
  boolean put(String key, CacheEntry entry);

  void evict(String key);
}
