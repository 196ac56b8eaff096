package com.roomintake.whatsapp.dispatch;

import com.roomintake.whatsapp.client.MessagingGateway;
import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.domain.EngineResult;
import com.roomintake.whatsapp.domain.Session;
import com.roomintake.whatsapp.model.OutboundDirective;
import com.roomintake.whatsapp.render.ListingSummaryFormatter;
import com.roomintake.whatsapp.render.PromptTemplates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends what the engine decided. Delivery is best-effort: a failed send is logged and never rolls
 * back the session the engine already committed.
 */
@Service
@Slf4j
public class OutboundDispatcher {

  private final MessagingGateway gateway;
  private final PromptTemplates prompts;
  private final ListingSummaryFormatter summary;
  private final IntakeProperties.Owner owner;

  public OutboundDispatcher(
      MessagingGateway gateway,
      PromptTemplates prompts,
      ListingSummaryFormatter summary,
      IntakeProperties properties) {
    this.gateway = gateway;
    this.prompts = prompts;
    this.summary = summary;
    this.owner = properties.owner();
  }

  public void deliver(EngineResult result) {
    if (result == null || result.duplicate()) {
      return;
    }
    boolean sent = dispatch(result.directive());
    if (!sent) {
      log.warn("Reply to {} was not delivered", result.directive().recipient());
    }
    if (result.listingConfirmed()) {
      notifyOwner(result.session());
    }
  }

  public boolean dispatch(OutboundDirective d) {
    return switch (d.form()) {
      case NONE -> true;
      case TEXT -> gateway.sendText(d.recipient(), d.body());
      case SINGLE_SELECT_LIST ->
          gateway.sendSingleSelectList(d.recipient(), d.body(), d.title(), d.options());
      case QUICK_REPLY_BUTTONS ->
          gateway.sendQuickReplyButtons(d.recipient(), d.body(), d.options());
    };
  }

  /** Fire-and-forget: the party already got the thank-you reply whatever happens here. */
  public void notifyOwner(Session session) {
    if (!owner.isConfigured()) {
      log.warn(
          "intake.owner.phone is not configured; listing of {} not forwarded", session.partyId());
      return;
    }
    String name = session.displayName() == null ? "unknown" : session.displayName();
    String text =
        prompts.format(
            PromptTemplates.OWNER_SUMMARY,
            name,
            session.partyId(),
            summary.format(session.attributes()));
    try {
      if (!gateway.sendText(owner.phone(), text)) {
        log.warn("Owner notification for listing of {} failed", session.partyId());
      }
    } catch (RuntimeException e) {
      log.error("Owner notification for listing of {} failed", session.partyId(), e);
    }
  }

  public void sendApology(String recipient) {
    gateway.sendText(recipient, prompts.resolve(PromptTemplates.APOLOGY));
  }
}
