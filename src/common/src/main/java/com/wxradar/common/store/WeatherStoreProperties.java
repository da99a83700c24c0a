package com.wxradar.common.store;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Storage selection bound from {@code wx.storage.*}.
 *
 * @param type {@code redis} (default) or {@code memory}
 * @param keyPrefix prefix for every Redis key
 */
@ConfigurationProperties(prefix = "wx.storage")
public record WeatherStoreProperties(String type, String keyPrefix) {}
