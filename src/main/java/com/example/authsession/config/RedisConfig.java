package com.example.authsession.config;

import com.example.authsession.properties.ApplicationProperties;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.SslOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis connection for the session store: standalone Lettuce with a commons-pool2 pool.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "app.session", name = "store", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisConfig {

  private final ApplicationProperties properties;

  @Bean(destroyMethod = "shutdown")
  public ClientResources lettuceClientResources() {
    return DefaultClientResources.builder()
        .ioThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .computationThreadPoolSize(Runtime.getRuntime().availableProcessors())
        .build();
  }

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    ApplicationProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());

    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    config.setTimeBetweenEvictionRuns(poolProps.timeBetweenEvictionRuns());
    config.setMinEvictableIdleTime(Duration.ofMinutes(1));
    config.setNumTestsPerEvictionRun(3);

    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      ClientResources clientResources,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    ApplicationProperties.RedisProperties redisProps = properties.redis();

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }
    redisConfig.setDatabase(redisProps.database());

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientResources(clientResources)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(redisProps));

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    log.info("Session store: Redis at {}:{} (db {})", redisProps.host(), redisProps.port(), redisProps.database());
    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);
    return factory;
  }

  @Bean
  public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
    StringRedisTemplate template = new StringRedisTemplate();
    template.setConnectionFactory(connectionFactory);
    template.afterPropertiesSet();
    return template;
  }

  private ClientOptions createClientOptions(ApplicationProperties.RedisProperties redisProps) {
    ClientOptions.Builder builder = ClientOptions.builder()
        .socketOptions(SocketOptions.builder()
                           .connectTimeout(redisProps.timeout())
                           .keepAlive(true)
                           .tcpNoDelay(true)
                           .build())
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .cancelCommandsOnReconnectFailure(false)
        .publishOnScheduler(true)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()));

    if (redisProps.ssl()) {
      builder.sslOptions(SslOptions.builder().jdkSslProvider().build());
    }

    return builder.build();
  }
}
