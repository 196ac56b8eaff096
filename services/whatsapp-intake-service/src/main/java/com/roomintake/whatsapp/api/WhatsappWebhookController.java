package com.roomintake.whatsapp.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.roomintake.whatsapp.dispatch.OutboundDispatcher;
import com.roomintake.whatsapp.domain.ConversationEngine;
import com.roomintake.whatsapp.domain.EngineResult;
import com.roomintake.whatsapp.domain.PartyLockRegistry;
import com.roomintake.whatsapp.domain.StoreUnavailableException;
import com.roomintake.whatsapp.model.InboundEvent;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * WhatsApp Cloud webhook: the subscription handshake and the message delivery endpoint.
 *
 * <p>Deliveries of one party are handled under that party's lock, so the engine's load, mutate
 * and save sequence never interleaves with a concurrent retry.
 */
@RestController
@RequestMapping("/webhook")
@Slf4j
public class WhatsappWebhookController {

  private final ConversationEngine engine;
  private final OutboundDispatcher dispatcher;
  private final PartyLockRegistry locks;
  private final WebhookPayloadParser parser;
  private final WebhookSignatureVerifier signatures;
  private final ObjectMapper mapper;
  private final String verifyToken;

  public WhatsappWebhookController(
      ConversationEngine engine,
      OutboundDispatcher dispatcher,
      PartyLockRegistry locks,
      WebhookPayloadParser parser,
      WebhookSignatureVerifier signatures,
      ObjectMapper mapper,
      @Value("${whatsapp.verify-token:}") String verifyToken) {
    this.engine = engine;
    this.dispatcher = dispatcher;
    this.locks = locks;
    this.parser = parser;
    this.signatures = signatures;
    this.mapper = mapper;
    this.verifyToken = verifyToken == null ? "" : verifyToken.trim();
  }

  @GetMapping
  public ResponseEntity<String> verify(
      @RequestParam(name = "hub.mode", required = false) String mode,
      @RequestParam(name = "hub.verify_token", required = false) String token,
      @RequestParam(name = "hub.challenge", required = false) String challenge) {
    log.info("Webhook verification attempt, mode={}", mode);
    if (!verifyToken.isBlank() && "subscribe".equals(mode) && verifyToken.equals(token)) {
      log.info("Webhook verified");
      return ResponseEntity.ok(challenge == null ? "" : challenge);
    }
    log.warn("Webhook verification failed");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Verification failed");
  }

  @PostMapping
  public ResponseEntity<Map<String, Object>> receive(
      @RequestBody String body,
      @RequestHeader(value = "X-Hub-Signature-256", required = false) String signature) {

    if (signatures.isEnabled() && !signatures.verify(body, signature)) {
      log.warn("Webhook signature mismatch");
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(Map.of("status", "error", "message", "Invalid signature"));
    }

    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      log.warn("Webhook body is not JSON: {}", e.getOriginalMessage());
      return badRequest("Invalid data format");
    }

    WebhookPayloadParser.Parsed parsed = parser.parse(root);
    switch (parsed.outcome()) {
      case INVALID:
        log.error("No entries in webhook data");
        return badRequest("Invalid data format");
      case NO_MESSAGES:
        return ResponseEntity.ok(Map.of("status", "ok", "message", "No messages"));
      case NO_SENDER:
        log.error("No sender in message");
        return badRequest("No sender");
      default:
        break;
    }

    InboundEvent event = parsed.event();
    log.info("Delivery {} type={}", event.deliveryId(), event.messageType());
    log.debug("Delivery {} from {}", event.deliveryId(), event.partyId());
    try {
      locks.withLock(event.partyId(), () -> handle(event));
    } catch (StoreUnavailableException e) {
      log.error("Store unavailable while handling delivery {}", event.deliveryId(), e);
      dispatcher.sendApology(event.partyId());
      // answered with 200 so the provider does not retry a delivery the party was told to resend
      return ResponseEntity.ok(Map.of("status", "error", "message", "Temporarily unavailable"));
    }
    return ResponseEntity.ok(Map.of("status", "ok"));
  }

  private EngineResult handle(InboundEvent event) {
    EngineResult result = engine.handleEvent(event.partyId(), event);
    dispatcher.deliver(result);
    return result;
  }

  private static ResponseEntity<Map<String, Object>> badRequest(String message) {
    return ResponseEntity.badRequest().body(Map.of("status", "error", "message", message));
  }
}
