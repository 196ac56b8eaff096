package com.roomintake.whatsapp.client;

import com.roomintake.whatsapp.config.WhatsappProperties;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/** WhatsApp Cloud API (Graph) implementation of {@link MessagingGateway}. */
@Service
@Slf4j
public class WhatsappCloudClient implements MessagingGateway {

  static final int MAX_TEXT = 4096;
  static final int MAX_BODY = 1024;
  static final int MAX_HEADER = 60;
  static final int MAX_ROW_TITLE = 24;
  static final int MAX_BUTTON_TITLE = 20;
  static final int MAX_ROWS = 10;
  static final int MAX_BUTTONS = 3;

  private final RestClient rest;
  private final String token;
  private final String phoneId;

  public WhatsappCloudClient(RestClient.Builder builder, WhatsappProperties properties) {
    this.token = properties.token();
    this.phoneId = properties.phoneId();
    this.rest = builder.baseUrl(properties.apiBaseUrl()).build();
  }

  public boolean isConfigured() {
    return !token.isBlank() && !phoneId.isBlank();
  }

  @Override
  public boolean sendText(String recipient, String body) {
    if (body == null || body.isBlank() || body.length() > MAX_TEXT) {
      log.error("Message to {} is empty or too long", recipient);
      return false;
    }
    Map<String, Object> payload = envelope(recipient, "text");
    payload.put("text", Map.of("body", body));
    return post(recipient, payload);
  }

  @Override
  public boolean sendSingleSelectList(
      String recipient, String body, String title, List<String> options) {
    if (options == null || options.isEmpty() || options.size() > MAX_ROWS) {
      log.error("List message to {} needs 1..{} options", recipient, MAX_ROWS);
      return false;
    }
    List<Map<String, Object>> rows = new ArrayList<>();
    for (String opt : options) {
      rows.add(Map.of("id", optionId(opt), "title", truncate(opt, MAX_ROW_TITLE)));
    }
    Map<String, Object> interactive = new HashMap<>();
    interactive.put("type", "list");
    String header = title == null || title.isBlank() ? "Select an option" : title;
    interactive.put("header", Map.of("type", "text", "text", truncate(header, MAX_HEADER)));
    interactive.put("body", Map.of("text", truncate(body, MAX_BODY)));
    Map<String, Object> section = Map.of("title", "Choose one", "rows", rows);
    interactive.put("action", Map.of("button", "Options", "sections", List.of(section)));

    Map<String, Object> payload = envelope(recipient, "interactive");
    payload.put("interactive", interactive);
    return post(recipient, payload);
  }

  @Override
  public boolean sendQuickReplyButtons(String recipient, String body, List<String> options) {
    if (options == null || options.isEmpty() || options.size() > MAX_BUTTONS) {
      log.error("Button message to {} needs 1..{} buttons", recipient, MAX_BUTTONS);
      return false;
    }
    List<Map<String, Object>> buttons = new ArrayList<>();
    for (String btn : options) {
      buttons.add(
          Map.of(
              "type",
              "reply",
              "reply",
              Map.of("id", optionId(btn), "title", truncate(btn, MAX_BUTTON_TITLE))));
    }
    Map<String, Object> interactive = new HashMap<>();
    interactive.put("type", "button");
    interactive.put("body", Map.of("text", truncate(body, MAX_BODY)));
    interactive.put("action", Map.of("buttons", buttons));

    Map<String, Object> payload = envelope(recipient, "interactive");
    payload.put("interactive", interactive);
    return post(recipient, payload);
  }

  /** Reply id the provider echoes back when the party picks an option. */
  static String optionId(String option) {
    return option == null ? "" : option.toLowerCase(Locale.ROOT).replace(" ", "_");
  }

  private boolean post(String recipient, Map<String, Object> payload) {
    if (!isConfigured()) {
      log.warn("WhatsApp token or phone id is not configured; skip sending to {}", recipient);
      return false;
    }
    if (recipient == null || recipient.isBlank()) {
      log.error("No recipient specified");
      return false;
    }
    try {
      rest.post()
          .uri("/{phoneId}/messages", phoneId)
          .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
          .contentType(MediaType.APPLICATION_JSON)
          .body(payload)
          .retrieve()
          .toBodilessEntity();
      log.debug("Message sent to {}", recipient);
      return true;
    } catch (RestClientResponseException e) {
      log.error(
          "WhatsApp API error {} for {}: {}",
          e.getStatusCode().value(),
          recipient,
          e.getResponseBodyAsString());
      if (e.getStatusCode().value() == HttpStatus.UNAUTHORIZED.value()) {
        log.error("Authentication failed; check whatsapp.token and whatsapp.phone-id");
      }
      return false;
    } catch (Exception e) {
      log.error("Failed to send WhatsApp message to {}: {}", recipient, e.getMessage());
      return false;
    }
  }

  private static Map<String, Object> envelope(String recipient, String type) {
    Map<String, Object> payload = new HashMap<>();
    payload.put("messaging_product", "whatsapp");
    payload.put("to", recipient);
    payload.put("type", type);
    return payload;
  }

  private static String truncate(String s, int max) {
    if (s == null) {
      return "";
    }
    return s.length() <= max ? s : s.substring(0, max);
  }
}
