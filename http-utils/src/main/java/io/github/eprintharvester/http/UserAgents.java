package io.github.eprintharvester.http;

import io.github.eprintharvester.http.model.HttpSettings;

/**
 * Builds the client identification string.
 */
public final class UserAgents {

  private UserAgents() {
  }

  /**
   * User agent for the given settings. The contact is embedded as a mailto comment only when it
   * contains an {@code @}.
   *
   * @param settings the settings
   * @return the user agent
   */
  public static String userAgent(final HttpSettings settings) {
    final String contact = settings.contact().map(String::trim).orElse("");
    if (contact.contains("@")) {
      return settings.product() + " (mailto:" + contact + ")";
    }
    return settings.product();
  }
}
