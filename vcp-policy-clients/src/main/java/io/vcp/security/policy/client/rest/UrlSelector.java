// (Copyright) The vcp-security authors.

package io.vcp.security.policy.client.rest;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Round-robin selection over policy server urls, starting from a random entry.
 */
public class UrlSelector {

  private int index;
  private final List<String> urls;

  public UrlSelector(List<String> urls) {
    this(urls, new Random().nextInt(urls == null || urls.isEmpty() ? 1 : urls.size()));
  }

  UrlSelector(List<String> urls, int index) {
    if (urls == null || urls.isEmpty()) {
      throw new IllegalArgumentException("Expected at least one policy server URL to be passed in constructor");
    }

    this.urls = new ArrayList<>(urls);
    this.index = index % urls.size();
  }

  public String current() {
    return urls.get(index);
  }

  /**
   * Declare the current url as failed so that the next attempt uses the next url.
   */
  public void fail() {
    index = (index + 1) % urls.size();
  }

  public int size() {
    return urls.size();
  }

  public int index() {
    return index;
  }

  @Override
  public String toString() {
    return urls.toString();
  }
}
