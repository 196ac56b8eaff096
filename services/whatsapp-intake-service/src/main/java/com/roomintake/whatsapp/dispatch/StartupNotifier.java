package com.roomintake.whatsapp.dispatch;

import com.roomintake.whatsapp.client.MessagingGateway;
import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.render.PromptTemplates;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Tells the owner the bot is up. Enabled only if intake.owner.notify-on-startup=true. */
@Component
@Slf4j
@ConditionalOnProperty(name = "intake.owner.notify-on-startup", havingValue = "true")
public class StartupNotifier {

  private final MessagingGateway gateway;
  private final PromptTemplates prompts;
  private final IntakeProperties.Owner owner;

  public StartupNotifier(
      MessagingGateway gateway, PromptTemplates prompts, IntakeProperties properties) {
    this.gateway = gateway;
    this.prompts = prompts;
    this.owner = properties.owner();
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onReady() {
    if (!owner.isConfigured()) {
      log.warn("intake.owner.notify-on-startup=true but intake.owner.phone is empty; skipped");
      return;
    }
    if (gateway.sendText(owner.phone(), prompts.resolve(PromptTemplates.STARTUP_NOTICE))) {
      log.info("Startup notice sent to owner");
    } else {
      log.error("Failed to send startup notice to owner");
    }
  }
}
