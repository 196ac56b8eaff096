package com.roomintake.whatsapp.api;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code X-Hub-Signature-256} header (HMAC-SHA256 of the raw body with the app
 * secret). Disabled while {@code whatsapp.app-secret} is empty.
 */
@Component
public class WebhookSignatureVerifier {

  private static final String PREFIX = "sha256=";

  private final String appSecret;

  public WebhookSignatureVerifier(@Value("${whatsapp.app-secret:}") String appSecret) {
    this.appSecret = appSecret == null ? "" : appSecret.trim();
  }

  public boolean isEnabled() {
    return !appSecret.isBlank();
  }

  public boolean verify(String rawBody, String header) {
    if (header == null || !header.startsWith(PREFIX)) {
      return false;
    }
    byte[] expected = sign(rawBody == null ? "" : rawBody);
    byte[] provided;
    try {
      provided = HexFormat.of().parseHex(header.substring(PREFIX.length()).trim());
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(expected, provided);
  }

  byte[] sign(String rawBody) {
    try {
      Mac mac = Mac.getInstance("HmacSHA256");
      mac.init(new SecretKeySpec(appSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
      return mac.doFinal(rawBody.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 is not available", e);
    }
  }
}
