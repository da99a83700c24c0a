package com.wxradar.ingester;

import static org.assertj.core.api.Assertions.assertThat;

import com.wxradar.common.store.InMemoryWeatherStore;
import com.wxradar.common.store.WeatherStore;
import com.wxradar.ingester.feed.FeedIngestor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "ingester.scheduling.enabled=false",
      "wx.storage.type=memory"
    })
class IngesterApplicationTests {
  @Autowired
  private ApplicationContext applicationContext;

  @Test
  void contextLoadsWithAllFeedsAndNoScheduler() {
    assertThat(applicationContext.getBeansOfType(FeedIngestor.class)).hasSize(3);
    assertThat(applicationContext.getBeansOfType(FeedScheduler.class)).isEmpty();
    assertThat(applicationContext.getBean(WeatherStore.class)).isInstanceOf(InMemoryWeatherStore.class);
  }
}
