package com.roomintake.whatsapp.render;

import java.util.HashMap;
import java.util.IllegalFormatException;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Party-facing texts. Built-in defaults can be overridden per key under {@code
 * intake.prompts.templates.*}.
 */
@Component
@ConfigurationProperties(prefix = "intake.prompts")
public class PromptTemplates {

  public static final String ROLE_BODY = "role.body";
  public static final String ROLE_TITLE = "role.title";
  public static final String IMAGE_REQUEST = "image.request";
  public static final String IMAGE_REPROMPT = "image.reprompt";
  public static final String HOUSE_BODY = "house.body";
  public static final String HOUSE_TITLE = "house.title";
  public static final String CAT_BODY = "cat.body";
  public static final String AVAILABILITY_BODY = "availability.body";
  public static final String AVAILABILITY_NONE = "availability.none";
  public static final String TIER_COUNT = "tier.count";
  public static final String TIER_RENT = "tier.rent";
  public static final String AGE_BODY = "age.body";
  public static final String CONFIRM_BODY = "confirm.body";
  public static final String LISTING_CONFIRMED = "listing.confirmed";
  public static final String LISTING_CANCELLED = "listing.cancelled";
  public static final String STUDENT_BODY = "student.body";
  public static final String END_BODY = "end.body";
  public static final String APOLOGY = "apology";
  public static final String OWNER_SUMMARY = "owner.summary";
  public static final String STARTUP_NOTICE = "startup.notice";

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private Map<String, String> templates = new HashMap<>();

  public String resolve(String key) {
    if (key == null || key.isBlank()) {
      return null;
    }
    String override = templates.get(key);
    if (override != null && !override.isBlank()) {
      return override;
    }
    return DEFAULTS.get(key);
  }

  public String format(String key, Object... args) {
    String template = resolve(key);
    if (template == null) {
      return null;
    }
    try {
      return String.format(template, args == null ? new Object[0] : args);
    } catch (IllegalFormatException e) {
      // overridden template with mismatched placeholders
      return template;
    }
  }

  public Map<String, String> getTemplates() {
    return templates;
  }

  public void setTemplates(Map<String, String> templates) {
    this.templates = templates == null ? new HashMap<>() : templates;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> m = new HashMap<>();
    m.put(ROLE_BODY, "Hello! Are you a student or landlord?");
    m.put(ROLE_TITLE, "User Type");
    m.put(
        IMAGE_REQUEST,
        "Great! Please send a screenshot of your WhatsApp profile for verification.");
    m.put(
        IMAGE_REPROMPT,
        "Please send an image (screenshot of your WhatsApp profile) to verify your identity.");
    m.put(HOUSE_BODY, "Is your accommodation for boys, girls, or mixed?");
    m.put(HOUSE_TITLE, "Accommodation Type");
    m.put(CAT_BODY, "Do you have a cat?");
    m.put(AVAILABILITY_BODY, "Do you have vacancies?");
    m.put(
        AVAILABILITY_NONE,
        "OK thanks. Whenever you have vacancies, don't hesitate to say 'Hi!'");
    m.put(TIER_COUNT, "How many %s rooms are available? (Reply with number only)");
    m.put(TIER_RENT, "What is the monthly rent for a %s room? (Reply with amount only)");
    m.put(AGE_BODY, "What age range of students do you accept? (e.g. 18-22)");
    m.put(CONFIRM_BODY, "Please review your listing:\n%s\n\nConfirm to submit or cancel.");
    m.put(LISTING_CONFIRMED, "Thank you! Your listing has been submitted.");
    m.put(LISTING_CANCELLED, "Your listing has been cancelled. Type 'Hi' to start again.");
    m.put(STUDENT_BODY, "Welcome student! Please download our app to find accommodation.");
    m.put(END_BODY, "Thank you for using our service. Type 'Hi' to start again.");
    m.put(APOLOGY, "Sorry, something went wrong on our side. Please try again in a moment.");
    m.put(OWNER_SUMMARY, "New listing from %s (%s):\n%s");
    m.put(STARTUP_NOTICE, "WhatsApp Bot started successfully!");
    return Map.copyOf(m);
  }
}
