package com.example.authsession.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Ephemeral, TTL-capable key-value store backing sessions, login state and refresh locks.
 * Each operation is a single atomic round trip; sequences of operations are not.
 */
public interface SessionStore {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  /**
   * Overwrites {@code key} with a new value and TTL only if it still exists.
   *
   * @return false when the key was absent (nothing is written)
   */
  boolean replaceIfPresent(String key, String value, Duration ttl);

  /**
   * Extends the TTL of an existing key.
   *
   * @return false when the key does not exist (nothing is created)
   */
  boolean expire(String key, Duration ttl);

  void delete(String key);

  /**
   * Reads and removes a key in one step, for single-use values.
   */
  Optional<String> getAndDelete(String key);

  /**
   * Sets {@code key} only if absent, holding a random owner token for at most {@code ttl}.
   *
   * @return the owner token when acquired, empty when another owner holds the key
   */
  Optional<String> tryLock(String key, Duration ttl);

  /**
   * Releases a lock only if it is still held by {@code ownerToken}.
   */
  boolean unlock(String key, String ownerToken);
}
