package com.wxradar.common.store;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Registers the {@link WeatherStore} selected by {@code wx.storage.type}. */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(WeatherStoreProperties.class)
public class WeatherStoreConfig {

  @Bean
  @ConditionalOnProperty(prefix = "wx.storage", name = "type", havingValue = "redis", matchIfMissing = true)
  public WeatherStore redisWeatherStore(StringRedisTemplate redisTemplate, WeatherStoreProperties properties) {
    return new RedisWeatherStore(redisTemplate, properties.keyPrefix());
  }

  @Bean
  @ConditionalOnProperty(prefix = "wx.storage", name = "type", havingValue = "memory")
  public WeatherStore inMemoryWeatherStore() {
    return new InMemoryWeatherStore(Clock.systemUTC());
  }
}
