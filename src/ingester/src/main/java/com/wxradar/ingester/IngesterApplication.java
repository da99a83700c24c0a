package com.wxradar.ingester;

import com.wxradar.common.store.WeatherStoreConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(WeatherStoreConfig.class)
public class IngesterApplication {
  // Main entrypoint: boots Spring; FeedScheduler starts the feed loops once the context is ready.
  public static void main(String[] args) {
    SpringApplication.run(IngesterApplication.class, args);
  }
}
