package com.example.authsession.adapter.memory;

import com.example.authsession.service.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-process session store for local development and tests.
 * Expired entries are dropped lazily when touched.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.session", name = "store", havingValue = "memory")
public class InMemorySessionStore implements SessionStore {

  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemorySessionStore(Clock clock) {
    this.clock = clock;
    log.warn("Using in-memory session store; sessions are not shared between instances");
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(live(key)).map(Entry::value);
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
  }

  @Override
  public boolean replaceIfPresent(String key, String value, Duration ttl) {
    Instant expiresAt = clock.instant().plus(ttl);
    return entries.computeIfPresent(key, (k, e) -> e.isExpired(clock.instant()) ? null : new Entry(value, expiresAt))
        != null;
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    Instant expiresAt = clock.instant().plus(ttl);
    return entries.computeIfPresent(key, (k, e) -> e.isExpired(clock.instant()) ? null : new Entry(e.value(), expiresAt))
        != null;
  }

  @Override
  public void delete(String key) {
    entries.remove(key);
  }

  @Override
  public Optional<String> getAndDelete(String key) {
    Entry removed = entries.remove(key);
    if (removed == null || removed.isExpired(clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(removed.value());
  }

  @Override
  public Optional<String> tryLock(String key, Duration ttl) {
    String lockToken = UUID.randomUUID().toString();
    AtomicReference<String> acquired = new AtomicReference<>();
    entries.compute(key, (k, existing) -> {
      if (existing == null || existing.isExpired(clock.instant())) {
        acquired.set(lockToken);
        return new Entry(lockToken, clock.instant().plus(ttl));
      }
      return existing;
    });
    return Optional.ofNullable(acquired.get());
  }

  @Override
  public boolean unlock(String key, String ownerToken) {
    Entry existing = entries.get(key);
    return existing != null && ownerToken.equals(existing.value()) && entries.remove(key, existing);
  }

  private Entry live(String key) {
    Entry entry = entries.get(key);
    if (entry != null && entry.isExpired(clock.instant())) {
      entries.remove(key, entry);
      return null;
    }
    return entry;
  }

  private record Entry(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }
}
