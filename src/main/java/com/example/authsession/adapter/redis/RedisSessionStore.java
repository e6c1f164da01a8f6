package com.example.authsession.adapter.redis;

import com.example.authsession.service.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-backed session store. Values are JSON strings; TTLs are enforced by Redis.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.session", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisSessionStore implements SessionStore {

  // Compare-and-delete: the lock may have expired and been taken by another owner
  static final RedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>(
      "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
      Long.class);

  private final StringRedisTemplate redisTemplate;

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(key));
  }

  @Override
  public void set(String key, String value, Duration ttl) {
    redisTemplate.opsForValue().set(key, value, ttl);
  }

  @Override
  public boolean replaceIfPresent(String key, String value, Duration ttl) {
    return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfPresent(key, value, ttl));
  }

  @Override
  public boolean expire(String key, Duration ttl) {
    return Boolean.TRUE.equals(redisTemplate.expire(key, ttl));
  }

  @Override
  public void delete(String key) {
    redisTemplate.delete(key);
  }

  @Override
  public Optional<String> getAndDelete(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().getAndDelete(key));
  }

  @Override
  public Optional<String> tryLock(String key, Duration ttl) {
    String lockToken = UUID.randomUUID().toString();

    Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, lockToken, ttl);

    return Boolean.TRUE.equals(acquired) ? Optional.of(lockToken) : Optional.empty();
  }

  @Override
  public boolean unlock(String key, String ownerToken) {
    Long deleted = redisTemplate.execute(UNLOCK_SCRIPT, List.of(key), ownerToken);

    if (deleted != null && deleted > 0) {
      return true;
    }
    log.debug("Lock {} no longer owned by caller, leaving it to expire", key);
    return false;
  }
}
