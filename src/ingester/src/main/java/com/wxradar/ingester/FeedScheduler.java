package com.wxradar.ingester;

import com.wxradar.ingester.feed.FeedIngestor;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Runs every feed on its own fixed-delay loop.
 *
 * <p>The delay counts from the end of the previous cycle, so cycles of one feed never overlap.
 * Stopping lets an in-flight cycle finish; only future runs are cancelled.
 */
@Component
@ConditionalOnProperty(
    prefix = "ingester.scheduling",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class FeedScheduler {
  private static final Logger log = LoggerFactory.getLogger(FeedScheduler.class);

  private final TaskScheduler taskScheduler;
  private final List<FeedIngestor> ingestors;
  private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

  public FeedScheduler(TaskScheduler taskScheduler, List<FeedIngestor> ingestors) {
    this.taskScheduler = taskScheduler;
    this.ingestors = ingestors;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    for (FeedIngestor ingestor : ingestors) {
      tasks.computeIfAbsent(ingestor.feedName(), name -> {
        log.info("Scheduling {} feed every {}", name, ingestor.refreshInterval());
        return taskScheduler.scheduleWithFixedDelay(ingestor::ingest, ingestor.refreshInterval());
      });
    }
  }

  @PreDestroy
  public void stop() {
    tasks.forEach((name, task) -> {
      task.cancel(false);
      log.info("Stopped {} feed", name);
    });
    tasks.clear();
  }

  public boolean isScheduled(String feedName) {
    ScheduledFuture<?> task = tasks.get(feedName);
    return task != null && !task.isCancelled();
  }
}
