package com.scholary.mp3.fetcher.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of finished jobs, keyed by download token.
 *
 * <p>Uses a Caffeine cache as the concurrent map. Entries are never evicted by the cache itself;
 * they leave only through {@link #takeIfPresent(String)}, which is called by whichever of the
 * download endpoint or the reclaimer gets there first.
 */
@Repository
public class JobStore {

  private final Cache<String, Job> cache = Caffeine.newBuilder().build();

  /**
   * Register a finished job.
   *
   * @throws IllegalStateException if the token is already registered
   */
  public void put(Job job) {
    Job previous = cache.asMap().putIfAbsent(job.token(), job);
    if (previous != null) {
      throw new IllegalStateException("token already registered: " + job.token());
    }
  }

  /**
   * Atomically remove and return the job for a token.
   *
   * <p>At most one caller ever receives a given job; every later call returns empty.
   */
  public Optional<Job> takeIfPresent(String token) {
    if (token == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(cache.asMap().remove(token));
  }

  public long size() {
    return cache.estimatedSize();
  }
}
