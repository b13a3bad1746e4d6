package com.example.placecache.config;

import com.example.placecache.service.RefreshFailureHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AppConfig {
  @Bean
  public RestTemplate restTemplate(
      RestTemplateBuilder builder,
      @Value("${http.client.connect-timeout-ms:5000}") int connectTimeoutMs,
      @Value("${http.client.read-timeout-ms:15000}") int readTimeoutMs
  ) {
    return builder
        .setConnectTimeout(Duration.ofMillis(Math.max(1000, connectTimeoutMs)))
        .setReadTimeout(Duration.ofMillis(Math.max(1000, readTimeoutMs)))
        .build();
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "refreshExecutor")
  public ThreadPoolTaskExecutor refreshExecutor(
      @Value("${place-cache.refresh.pool-size:4}") int poolSize,
      @Value("${place-cache.refresh.queue-capacity:2147483647}") int queueCapacity
  ) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(Math.max(1, poolSize));
    executor.setMaxPoolSize(Math.max(1, poolSize));
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("refresh-");
    executor.initialize();
    return executor;
  }

  @Bean
  public RefreshFailureHandler refreshFailureHandler() {
    return (restaurantId, externalId, error) ->
        log.warn("Background refresh failed for restaurant {} (placeId='{}'): {}",
            restaurantId, externalId, error.getMessage());
  }
}
