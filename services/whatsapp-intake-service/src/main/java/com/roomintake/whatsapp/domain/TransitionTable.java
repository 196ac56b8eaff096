package com.roomintake.whatsapp.domain;

import static com.roomintake.whatsapp.render.PromptTemplates.AGE_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.AVAILABILITY_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.AVAILABILITY_NONE;
import static com.roomintake.whatsapp.render.PromptTemplates.CAT_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.CONFIRM_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.END_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.HOUSE_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.HOUSE_TITLE;
import static com.roomintake.whatsapp.render.PromptTemplates.IMAGE_REPROMPT;
import static com.roomintake.whatsapp.render.PromptTemplates.IMAGE_REQUEST;
import static com.roomintake.whatsapp.render.PromptTemplates.LISTING_CANCELLED;
import static com.roomintake.whatsapp.render.PromptTemplates.LISTING_CONFIRMED;
import static com.roomintake.whatsapp.render.PromptTemplates.ROLE_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.ROLE_TITLE;
import static com.roomintake.whatsapp.render.PromptTemplates.STUDENT_BODY;
import static com.roomintake.whatsapp.render.PromptTemplates.TIER_COUNT;
import static com.roomintake.whatsapp.render.PromptTemplates.TIER_RENT;

import com.roomintake.whatsapp.model.Input;
import com.roomintake.whatsapp.model.InputKind;
import com.roomintake.whatsapp.model.OutboundDirective;
import com.roomintake.whatsapp.render.ListingSummaryFormatter;
import com.roomintake.whatsapp.render.PromptTemplates;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Fixed intake graph: maps {@code (session.step, input)} to the next session and the directive to
 * send.
 *
 * <p>Pure: no I/O, no state of its own. A rejected input always returns the untouched session and
 * the step's canonical prompt, so a bad answer can never leave a partial write in the attributes.
 */
@Component
public class TransitionTable {

  private static final String LANDLORD = "landlord";
  private static final String STUDENT = "student";
  private static final String YES = "yes";
  private static final String NO = "no";
  private static final String CONFIRM = "confirm";
  private static final String CANCEL = "cancel";

  private static final List<String> ROLE_OPTIONS = List.of("Student", "Landlord");
  private static final List<String> HOUSE_OPTIONS = List.of("Boys", "Girls", "Mixed");
  private static final Set<String> HOUSE_TYPES = Set.of("boys", "girls", "mixed");
  private static final List<String> YES_NO_OPTIONS = List.of("Yes", "No");
  private static final List<String> CONFIRM_OPTIONS = List.of("Confirm", "Cancel");

  private final PromptTemplates prompts;
  private final ListingSummaryFormatter summary;

  public TransitionTable(PromptTemplates prompts, ListingSummaryFormatter summary) {
    this.prompts = prompts;
    this.summary = summary;
  }

  public Transition apply(Session session, Input input) {
    return switch (session.step()) {
      case START -> onStart(session, input);
      case AWAITING_IMAGE -> onAwaitingImage(session, input);
      case COLLECTING_HOUSE_TYPE -> onHouseType(session, input);
      case ASKING_CAT -> onCat(session, input);
      case ASKING_AVAILABILITY -> onAvailability(session, input);
      case SINGLE_COUNT, TWO_SHARE_COUNT, THREE_SHARE_COUNT -> onTierCount(session, input);
      case SINGLE_RENT, TWO_SHARE_RENT, THREE_SHARE_RENT -> onTierRent(session, input);
      case ASKING_AGE -> onAge(session, input);
      case CONFIRMING_LISTING -> onConfirm(session, input);
      case STUDENT_PENDING -> Transition.stay(session, promptFor(session));
      case END -> onEnd(session, input);
    };
  }

  /** Canonical prompt of the session's current step. */
  public OutboundDirective promptFor(Session session) {
    String to = session.partyId();
    Step step = session.step();
    return switch (step) {
      case START -> rolePrompt(to);
      case AWAITING_IMAGE -> OutboundDirective.text(to, prompts.resolve(IMAGE_REPROMPT));
      case COLLECTING_HOUSE_TYPE ->
          OutboundDirective.list(
              to, prompts.resolve(HOUSE_TITLE), prompts.resolve(HOUSE_BODY), HOUSE_OPTIONS);
      case ASKING_CAT ->
          OutboundDirective.buttons(to, prompts.resolve(CAT_BODY), YES_NO_OPTIONS);
      case ASKING_AVAILABILITY ->
          OutboundDirective.buttons(to, prompts.resolve(AVAILABILITY_BODY), YES_NO_OPTIONS);
      case SINGLE_COUNT, TWO_SHARE_COUNT, THREE_SHARE_COUNT ->
          OutboundDirective.text(to, prompts.format(TIER_COUNT, step.tier().label()));
      case SINGLE_RENT, TWO_SHARE_RENT, THREE_SHARE_RENT ->
          OutboundDirective.text(to, prompts.format(TIER_RENT, step.tier().label()));
      case ASKING_AGE -> OutboundDirective.text(to, prompts.resolve(AGE_BODY));
      case CONFIRMING_LISTING ->
          OutboundDirective.buttons(
              to,
              prompts.format(CONFIRM_BODY, summary.format(session.attributes())),
              CONFIRM_OPTIONS);
      case STUDENT_PENDING -> OutboundDirective.text(to, prompts.resolve(STUDENT_BODY));
      case END -> OutboundDirective.text(to, prompts.resolve(END_BODY));
    };
  }

  private Transition onStart(Session s, Input in) {
    if (in.is(InputKind.GREETING)) {
      return Transition.stay(s, rolePrompt(s.partyId()));
    }
    if (isChoice(in) && in.matches(LANDLORD)) {
      Session next =
          s.withStep(Step.AWAITING_IMAGE)
              .withVerified(false)
              .withImageReceived(false)
              .withAttributes(ListingAttributes.empty());
      return Transition.advance(
          next, OutboundDirective.text(s.partyId(), prompts.resolve(IMAGE_REQUEST)));
    }
    if (isChoice(in) && in.matches(STUDENT)) {
      Session next = s.withStep(Step.STUDENT_PENDING);
      return Transition.advance(next, promptFor(next));
    }
    return reject(s);
  }

  private Transition onAwaitingImage(Session s, Input in) {
    if (!in.is(InputKind.IMAGE) || s.imageReceived()) {
      return reject(s);
    }
    Session next =
        s.withImageReceived(true).withVerified(true).withStep(Step.COLLECTING_HOUSE_TYPE);
    return Transition.advance(next, promptFor(next));
  }

  private Transition onHouseType(Session s, Input in) {
    String token = isChoice(in) ? in.token() : null;
    if (token == null || !HOUSE_TYPES.contains(token)) {
      return reject(s);
    }
    Session next =
        s.withAttributes(s.attributes().withHouseType(token)).withStep(Step.ASKING_CAT);
    return Transition.advance(next, promptFor(next));
  }

  private Transition onCat(Session s, Input in) {
    Boolean answer = yesNo(in);
    if (answer == null) {
      return reject(s);
    }
    Session next =
        s.withAttributes(s.attributes().withHasCat(answer)).withStep(Step.ASKING_AVAILABILITY);
    return Transition.advance(next, promptFor(next));
  }

  private Transition onAvailability(Session s, Input in) {
    Boolean answer = yesNo(in);
    if (answer == null) {
      return reject(s);
    }
    if (!answer) {
      return Transition.advance(
          s.withStep(Step.END),
          OutboundDirective.text(s.partyId(), prompts.resolve(AVAILABILITY_NONE)));
    }
    Session next = s.withStep(Step.countOf(RoomTier.SINGLE));
    return Transition.advance(next, promptFor(next));
  }

  private Transition onTierCount(Session s, Input in) {
    if (!in.is(InputKind.NUMBER)) {
      return reject(s);
    }
    int count;
    try {
      count = Integer.parseInt(in.normalized());
    } catch (NumberFormatException e) {
      // digits only, but too large for an int
      return reject(s);
    }
    RoomTier tier = s.step().tier();
    Session next =
        s.withAttributes(tier.writeCount(s.attributes(), count)).withStep(Step.rentOf(tier));
    return Transition.advance(next, promptFor(next));
  }

  private Transition onTierRent(Session s, Input in) {
    if (!in.is(InputKind.DECIMAL) && !in.is(InputKind.NUMBER)) {
      return reject(s);
    }
    BigDecimal rent = new BigDecimal(in.normalized());
    RoomTier tier = s.step().tier();
    RoomTier nextTier = tier.next();
    Step nextStep = nextTier == null ? Step.ASKING_AGE : Step.countOf(nextTier);
    Session next = s.withAttributes(tier.writeRent(s.attributes(), rent)).withStep(nextStep);
    return Transition.advance(next, promptFor(next));
  }

  private Transition onAge(Session s, Input in) {
    if (!in.is(InputKind.FREE_TEXT) && !in.is(InputKind.NUMBER)) {
      return reject(s);
    }
    Session next =
        s.withAttributes(s.attributes().withStudentAge(in.normalized()))
            .withStep(Step.CONFIRMING_LISTING);
    return Transition.advance(next, promptFor(next));
  }

  private Transition onConfirm(Session s, Input in) {
    if (isChoice(in) && in.matches(CONFIRM)) {
      return Transition.confirmed(
          s.withStep(Step.END),
          OutboundDirective.text(s.partyId(), prompts.resolve(LISTING_CONFIRMED)));
    }
    if (isChoice(in) && in.matches(CANCEL)) {
      return Transition.advance(
          s.withStep(Step.END),
          OutboundDirective.text(s.partyId(), prompts.resolve(LISTING_CANCELLED)));
    }
    return reject(s);
  }

  private Transition onEnd(Session s, Input in) {
    if (in.is(InputKind.GREETING)) {
      Session next = s.restart();
      return Transition.advance(next, rolePrompt(s.partyId()));
    }
    return Transition.stay(s, promptFor(s));
  }

  private Transition reject(Session s) {
    return Transition.reject(s, promptFor(s));
  }

  private OutboundDirective rolePrompt(String to) {
    return OutboundDirective.list(
        to, prompts.resolve(ROLE_TITLE), prompts.resolve(ROLE_BODY), ROLE_OPTIONS);
  }

  private static boolean isChoice(Input in) {
    return in.is(InputKind.SELECTION_ID)
        || in.is(InputKind.FREE_TEXT)
        || in.is(InputKind.YES_NO)
        || in.is(InputKind.ROLE_CHOICE);
  }

  private static Boolean yesNo(Input in) {
    if (!isChoice(in)) {
      return null;
    }
    if (in.matches(YES)) {
      return Boolean.TRUE;
    }
    if (in.matches(NO)) {
      return Boolean.FALSE;
    }
    return null;
  }
}
