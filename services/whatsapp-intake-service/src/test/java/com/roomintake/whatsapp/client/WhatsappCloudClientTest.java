package com.roomintake.whatsapp.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.roomintake.whatsapp.config.WhatsappProperties;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class WhatsappCloudClientTest {

  private static final String BASE = "https://graph.test/v19.0";
  private static final String MESSAGES = BASE + "/12345/messages";

  private MockRestServiceServer server;
  private WhatsappCloudClient client;

  @BeforeEach
  void setUp() {
    RestClient.Builder builder = RestClient.builder();
    server = MockRestServiceServer.bindTo(builder).build();
    client = new WhatsappCloudClient(builder, new WhatsappProperties(BASE, "secret", "12345"));
  }

  @Test
  void sendsTextWithBearerToken() {
    server
        .expect(requestTo(MESSAGES))
        .andExpect(method(HttpMethod.POST))
        .andExpect(header("Authorization", "Bearer secret"))
        .andExpect(jsonPath("$.messaging_product").value("whatsapp"))
        .andExpect(jsonPath("$.to").value("263771234567"))
        .andExpect(jsonPath("$.type").value("text"))
        .andExpect(jsonPath("$.text.body").value("Hello"))
        .andRespond(
            withSuccess("{\"messages\":[{\"id\":\"wamid.1\"}]}", MediaType.APPLICATION_JSON));

    assertThat(client.sendText("263771234567", "Hello")).isTrue();
    server.verify();
  }

  @Test
  void listRowsCarryDerivedIds() {
    server
        .expect(requestTo(MESSAGES))
        .andExpect(jsonPath("$.interactive.type").value("list"))
        .andExpect(jsonPath("$.interactive.header.text").value("User Type"))
        .andExpect(jsonPath("$.interactive.body.text").value("Are you a student or landlord?"))
        .andExpect(jsonPath("$.interactive.action.sections[0].rows[0].id").value("student"))
        .andExpect(jsonPath("$.interactive.action.sections[0].rows[1].id").value("real_landlord"))
        .andExpect(
            jsonPath("$.interactive.action.sections[0].rows[1].title").value("Real Landlord"))
        .andRespond(withSuccess());

    boolean sent =
        client.sendSingleSelectList(
            "263771234567",
            "Are you a student or landlord?",
            "User Type",
            List.of("Student", "Real Landlord"));

    assertThat(sent).isTrue();
    server.verify();
  }

  @Test
  void buttonTitlesAreTruncated() {
    server
        .expect(requestTo(MESSAGES))
        .andExpect(jsonPath("$.interactive.type").value("button"))
        .andExpect(jsonPath("$.interactive.action.buttons[0].type").value("reply"))
        .andExpect(jsonPath("$.interactive.action.buttons[0].reply.id").value("yes"))
        .andExpect(
            jsonPath("$.interactive.action.buttons[1].reply.title").value("A very long button t"))
        .andRespond(withSuccess());

    boolean sent =
        client.sendQuickReplyButtons(
            "263771234567", "Pick", List.of("Yes", "A very long button title"));

    assertThat(sent).isTrue();
    server.verify();
  }

  @Test
  void unauthorizedReturnsFalse() {
    server
        .expect(requestTo(MESSAGES))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("{\"error\":\"bad token\"}"));

    assertThat(client.sendText("263771234567", "Hello")).isFalse();
    server.verify();
  }

  @Test
  void tooManyButtonsIsRefusedWithoutCall() {
    assertThat(client.sendQuickReplyButtons("263771234567", "Pick", List.of("a", "b", "c", "d")))
        .isFalse();
    assertThat(client.sendSingleSelectList("263771234567", "Pick", "T", List.of())).isFalse();
    server.verify();
  }

  @Test
  void oversizedTextIsRefused() {
    assertThat(client.sendText("263771234567", "x".repeat(4097))).isFalse();
    server.verify();
  }

  @Test
  void missingCredentialsSkipSending() {
    RestClient.Builder builder = RestClient.builder();
    MockRestServiceServer idle = MockRestServiceServer.bindTo(builder).build();
    WhatsappCloudClient unconfigured =
        new WhatsappCloudClient(builder, new WhatsappProperties(BASE, "", ""));

    assertThat(unconfigured.isConfigured()).isFalse();
    assertThat(unconfigured.sendText("263771234567", "Hello")).isFalse();
    idle.verify();
  }

  @Test
  void optionIdIsLowercasedWithUnderscores() {
    assertThat(WhatsappCloudClient.optionId("Mixed Hostel")).isEqualTo("mixed_hostel");
  }
}
