package com.wxradar.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the lookup API, bound from {@code wx.api.*}.
 */
@ConfigurationProperties(prefix = "wx.api")
public class ApiProperties {
  private int maxLocations = 16;
  private final Cors cors = new Cors();

  /** Largest number of codes accepted by one batch lookup. */
  public int getMaxLocations() {
    return maxLocations;
  }

  public void setMaxLocations(int maxLocations) {
    this.maxLocations = maxLocations;
  }

  public Cors getCors() {
    return cors;
  }

  /** Wildcard CORS headers for browser clients. */
  public static class Cors {
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
