package com.roomintake.whatsapp.client;

import java.util.List;

/**
 * Outbound chat messages. Every call reports delivery success; failures are logged by the
 * implementation and never thrown.
 */
public interface MessagingGateway {

  boolean sendText(String recipient, String body);

  /** Single-select list with at most 10 rows. */
  boolean sendSingleSelectList(String recipient, String body, String title, List<String> options);

  /** Quick-reply message with at most 3 buttons. */
  boolean sendQuickReplyButtons(String recipient, String body, List<String> options);
}
