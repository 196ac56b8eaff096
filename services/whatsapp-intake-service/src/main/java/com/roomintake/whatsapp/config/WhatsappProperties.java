package com.roomintake.whatsapp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** WhatsApp Cloud API credentials; passed to the messaging client through its constructor. */
@ConfigurationProperties(prefix = "whatsapp")
public record WhatsappProperties(String apiBaseUrl, String token, String phoneId) {

  public WhatsappProperties {
    apiBaseUrl =
        apiBaseUrl == null || apiBaseUrl.isBlank()
            ? "https://graph.facebook.com/v19.0"
            : apiBaseUrl.trim();
    token = token == null ? "" : token.trim();
    phoneId = phoneId == null ? "" : phoneId.trim();
  }
}
