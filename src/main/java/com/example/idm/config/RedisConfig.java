package com.example.idm.config;

import com.example.idm.cache.IdmCache;
import com.example.idm.cache.RedisIdmCache;
import com.example.idm.properties.IdmProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.cluster.ClusterClientOptions;
import io.lettuce.core.cluster.ClusterTopologyRefreshOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisNode;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

/**
 * Redis cache backend. Supports both standalone and cluster modes with connection pooling.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "idm.cache.mode", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisConfig {

  private final IdmProperties properties;

  @Bean
  public GenericObjectPoolConfig<StatefulConnection<?, ?>> redisPoolConfig() {
    IdmProperties.RedisProperties.PoolProperties poolProps = properties.redis().pool();

    GenericObjectPoolConfig<StatefulConnection<?, ?>> config = new GenericObjectPoolConfig<>();
    config.setMaxTotal(poolProps.maxActive());
    config.setMaxIdle(poolProps.maxIdle());
    config.setMinIdle(poolProps.minIdle());
    config.setMaxWait(poolProps.maxWait());
    config.setTestOnBorrow(false);
    config.setTestWhileIdle(true);
    return config;
  }

  @Bean
  public RedisConnectionFactory redisConnectionFactory(
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {
    IdmProperties.RedisProperties redisProps = properties.redis();

    if ("cluster".equalsIgnoreCase(redisProps.mode())
        && redisProps.clusterNodes() != null
        && !redisProps.clusterNodes().isBlank()) {
      log.info("Connecting to Redis cluster: {}", redisProps.clusterNodes());
      return createClusterConnectionFactory(redisProps, poolConfig);
    }
    log.info("Connecting to Redis at {}:{}", redisProps.host(), redisProps.port());
    return createStandaloneConnectionFactory(redisProps, poolConfig);
  }

  @Bean
  @Primary
  public RedisTemplate<String, String> redisTemplate(RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, String> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);

    StringRedisSerializer stringSerializer = new StringRedisSerializer();
    template.setKeySerializer(stringSerializer);
    template.setValueSerializer(stringSerializer);
    template.setHashKeySerializer(stringSerializer);
    template.setHashValueSerializer(stringSerializer);

    template.setEnableTransactionSupport(false);
    template.afterPropertiesSet();
    return template;
  }

  @Bean
  public IdmCache idmCache(RedisTemplate<String, String> redisTemplate, ObjectMapper objectMapper) {
    return new RedisIdmCache(redisTemplate, objectMapper, properties.cache());
  }

  private RedisConnectionFactory createStandaloneConnectionFactory(
      IdmProperties.RedisProperties redisProps,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
    redisConfig.setHostName(redisProps.host());
    redisConfig.setPort(redisProps.port());
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      redisConfig.setPassword(redisProps.password());
    }

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .commandTimeout(redisProps.timeout())
            .shutdownTimeout(Duration.ofSeconds(2))
            .clientOptions(createClientOptions(redisProps));

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    LettuceConnectionFactory factory = new LettuceConnectionFactory(redisConfig, builder.build());
    factory.setShareNativeConnection(true);
    factory.setValidateConnection(false);
    return factory;
  }

  private RedisConnectionFactory createClusterConnectionFactory(
      IdmProperties.RedisProperties redisProps,
      GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig) {

    RedisClusterConfiguration clusterConfig = new RedisClusterConfiguration();
    for (String node : redisProps.clusterNodes().split(",")) {
      String[] parts = node.trim().split(":");
      clusterConfig.addClusterNode(new RedisNode(parts[0], Integer.parseInt(parts[1])));
    }
    if (redisProps.password() != null && !redisProps.password().isBlank()) {
      clusterConfig.setPassword(redisProps.password());
    }

    ClusterTopologyRefreshOptions topologyRefreshOptions = ClusterTopologyRefreshOptions.builder()
        .enablePeriodicRefresh(Duration.ofMinutes(1))
        .enableAllAdaptiveRefreshTriggers()
        .build();

    ClusterClientOptions clientOptions = ClusterClientOptions.builder()
        .topologyRefreshOptions(topologyRefreshOptions)
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()))
        .build();

    LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
        LettucePoolingClientConfiguration.builder()
            .poolConfig(poolConfig)
            .clientOptions(clientOptions)
            .commandTimeout(redisProps.timeout());

    if (redisProps.ssl()) {
      builder.useSsl();
    }

    return new LettuceConnectionFactory(clusterConfig, builder.build());
  }

  private ClientOptions createClientOptions(IdmProperties.RedisProperties redisProps) {
    return ClientOptions.builder()
        .socketOptions(createSocketOptions(redisProps.timeout()))
        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
        .timeoutOptions(TimeoutOptions.enabled(redisProps.timeout()))
        .build();
  }

  private SocketOptions createSocketOptions(Duration timeout) {
    return SocketOptions.builder()
        .connectTimeout(timeout)
        .keepAlive(true)
        .tcpNoDelay(true)
        .build();
  }
}
