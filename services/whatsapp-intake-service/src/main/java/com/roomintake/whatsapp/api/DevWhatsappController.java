package com.roomintake.whatsapp.api;

import com.roomintake.whatsapp.domain.ConversationEngine;
import com.roomintake.whatsapp.domain.EngineResult;
import com.roomintake.whatsapp.domain.PartyLockRegistry;
import com.roomintake.whatsapp.domain.Step;
import com.roomintake.whatsapp.model.InboundEvent;
import com.roomintake.whatsapp.model.OutboundDirective;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.UUID;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local training endpoint.
 *
 * <p>Runs a fake inbound message through the engine and returns the directive instead of sending
 * it to WhatsApp. Enabled only if intake.dev.enabled=true.
 */
@RestController
@RequestMapping("/dev/whatsapp")
@ConditionalOnProperty(name = "intake.dev.enabled", havingValue = "true")
public class DevWhatsappController {

  private final ConversationEngine engine;
  private final PartyLockRegistry locks;

  public DevWhatsappController(ConversationEngine engine, PartyLockRegistry locks) {
    this.engine = engine;
    this.locks = locks;
  }

  public record DevMessageRequest(
      @NotBlank String partyId,
      String displayName,
      @NotBlank String type,
      String text,
      String selectionId,
      String deliveryId) {}

  public record DevMessageResponse(
      OutboundDirective directive, Step step, boolean duplicate, boolean listingConfirmed) {}

  @PostMapping("/message")
  public DevMessageResponse message(@Valid @RequestBody DevMessageRequest req) {
    String deliveryId =
        req.deliveryId() == null || req.deliveryId().isBlank()
            ? UUID.randomUUID().toString()
            : req.deliveryId();
    InboundEvent event =
        new InboundEvent(
            deliveryId,
            req.partyId(),
            req.displayName(),
            req.type(),
            req.text(),
            req.selectionId());
    EngineResult result =
        locks.withLock(req.partyId(), () -> engine.handleEvent(req.partyId(), event));
    return new DevMessageResponse(
        result.directive(),
        result.session() == null ? null : result.session().step(),
        result.duplicate(),
        result.listingConfirmed());
  }
}
