package com.wxradar.api;

import com.wxradar.api.config.ApiProperties;
import com.wxradar.common.store.WeatherStoreConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Main Spring Boot entrypoint for the weather lookup API.
 *
 * <p>The service is read-only: it serves whatever the ingester last stored, keyed by ICAO code.
 */
@SpringBootApplication
@EnableConfigurationProperties(ApiProperties.class)
@Import(WeatherStoreConfig.class)
public class ApiApplication {
  /**
   * Starts the API application.
   *
   * @param args standard Spring Boot startup arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(ApiApplication.class, args);
  }
}
