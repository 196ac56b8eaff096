package com.roomintake.whatsapp.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.roomintake.whatsapp.dispatch.OutboundDispatcher;
import com.roomintake.whatsapp.domain.ConversationEngine;
import com.roomintake.whatsapp.domain.EngineResult;
import com.roomintake.whatsapp.domain.PartyLockRegistry;
import com.roomintake.whatsapp.domain.Session;
import com.roomintake.whatsapp.domain.StoreUnavailableException;
import com.roomintake.whatsapp.model.InboundEvent;
import com.roomintake.whatsapp.model.OutboundDirective;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = WhatsappWebhookController.class,
    properties = "whatsapp.verify-token=BOT")
@Import({PartyLockRegistry.class, WebhookPayloadParser.class, WebhookSignatureVerifier.class})
@ExtendWith(OutputCaptureExtension.class)
class WhatsappWebhookControllerTest {

  private static final String TEXT_DELIVERY =
      "{\"object\":\"whatsapp_business_account\",\"entry\":[{\"changes\":[{\"value\":{"
          + "\"contacts\":[{\"profile\":{\"name\":\"Tendai\"}}],"
          + "\"messages\":[{\"from\":\"263771234567\",\"id\":\"wamid.1\",\"type\":\"text\","
          + "\"text\":{\"body\":\"Hi\"}}]}}]}]}";

  @Autowired MockMvc mvc;

  @MockBean ConversationEngine engine;
  @MockBean OutboundDispatcher dispatcher;

  @Test
  void verificationEchoesChallenge() throws Exception {
    mvc.perform(
            get("/webhook")
                .param("hub.mode", "subscribe")
                .param("hub.verify_token", "BOT")
                .param("hub.challenge", "1158201444"))
        .andExpect(status().isOk())
        .andExpect(content().string("1158201444"));
  }

  @Test
  void verificationWithWrongTokenIsForbidden() throws Exception {
    mvc.perform(
            get("/webhook")
                .param("hub.mode", "subscribe")
                .param("hub.verify_token", "nope")
                .param("hub.challenge", "1"))
        .andExpect(status().isForbidden())
        .andExpect(content().string("Verification failed"));
  }

  @Test
  void textDeliveryRunsEngineAndDispatches() throws Exception {
    EngineResult result =
        new EngineResult(
            OutboundDirective.text("263771234567", "Hello"),
            Session.fresh("263771234567"),
            false,
            false);
    when(engine.handleEvent(eq("263771234567"), any(InboundEvent.class))).thenReturn(result);

    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(TEXT_DELIVERY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"));

    ArgumentCaptor<InboundEvent> event = ArgumentCaptor.forClass(InboundEvent.class);
    verify(engine).handleEvent(eq("263771234567"), event.capture());
    assertThat(event.getValue())
        .isEqualTo(new InboundEvent("wamid.1", "263771234567", "Tendai", "text", "Hi", null));
    verify(dispatcher).deliver(result);
  }

  @Test
  void deliveryLogDoesNotCarrySender(CapturedOutput output) throws Exception {
    when(engine.handleEvent(eq("263771234567"), any(InboundEvent.class)))
        .thenReturn(
            new EngineResult(
                OutboundDirective.text("263771234567", "Hello"),
                Session.fresh("263771234567"),
                false,
                false));

    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(TEXT_DELIVERY))
        .andExpect(status().isOk());

    assertThat(output.getOut())
        .contains("Delivery wamid.1 type=text")
        .doesNotContain("263771234567");
  }

  @Test
  void missingEntryIsBadRequest() throws Exception {
    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Invalid data format"));

    verifyNoInteractions(engine);
  }

  @Test
  void statusCallbackIsAcknowledged() throws Exception {
    String statuses =
        "{\"entry\":[{\"changes\":[{\"value\":{\"statuses\":[{\"id\":\"wamid.1\"}]}}]}]}";

    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(statuses))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.message").value("No messages"));

    verifyNoInteractions(engine);
  }

  @Test
  void nonJsonBodyIsBadRequest() throws Exception {
    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content("not json"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void storeOutageApologisesAndAcknowledges() throws Exception {
    when(engine.handleEvent(eq("263771234567"), any(InboundEvent.class)))
        .thenThrow(new StoreUnavailableException("redis down"));

    mvc.perform(post("/webhook").contentType(MediaType.APPLICATION_JSON).content(TEXT_DELIVERY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("error"));

    verify(dispatcher).sendApology("263771234567");
    verify(dispatcher, never()).deliver(any());
  }
}
