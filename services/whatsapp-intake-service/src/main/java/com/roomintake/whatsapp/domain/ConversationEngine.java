package com.roomintake.whatsapp.domain;

import com.roomintake.whatsapp.config.IntakeProperties;
import com.roomintake.whatsapp.model.InboundEvent;
import com.roomintake.whatsapp.model.Input;
import com.roomintake.whatsapp.store.SessionStore;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one inbound delivery through dedup, session load, normalization and the transition table,
 * then commits the new session.
 *
 * <p>Everything before the commit is read-only, so a failing store leaves the party's state as it
 * was. Once the session is saved, recording the delivery id is best-effort. The engine never talks
 * to the messaging provider; the caller dispatches the returned directive. It also does not
 * serialize deliveries of the same party: callers must (see {@link PartyLockRegistry}).
 */
@Service
@Slf4j
public class ConversationEngine {

  private final DedupFilter dedup;
  private final SessionStore sessions;
  private final InputNormalizer normalizer;
  private final TransitionTable table;
  private final Duration sessionTtl;

  public ConversationEngine(
      DedupFilter dedup,
      SessionStore sessions,
      InputNormalizer normalizer,
      TransitionTable table,
      IntakeProperties properties) {
    this.dedup = dedup;
    this.sessions = sessions;
    this.normalizer = normalizer;
    this.table = table;
    this.sessionTtl = properties.session().ttl();
  }

  public EngineResult handleEvent(String partyId, InboundEvent event) {
    String deliveryId = event.deliveryId();
    if (dedup.isDuplicate(partyId, deliveryId)) {
      log.debug("Skip duplicate delivery {} for {}", deliveryId, partyId);
      return EngineResult.duplicate(partyId);
    }

    Session current = loadOrCreate(partyId).captureDisplayName(event.displayName());
    Input input = normalizer.normalize(event);
    Transition t = table.apply(current, input);

    if (t.rejected()) {
      log.debug("Input {} rejected at {} for {}", input.kind(), current.step(), partyId);
    } else if (t.session().step() != current.step()) {
      log.debug("Party {} moved {} -> {}", partyId, current.step(), t.session().step());
    }

    sessions.save(partyId, t.session(), sessionTtl);
    try {
      dedup.record(partyId, deliveryId);
    } catch (StoreUnavailableException e) {
      // session is committed; a retry of this delivery may slip through
      log.warn("Could not record delivery {} as seen: {}", deliveryId, e.getMessage());
    }
    return new EngineResult(t.directive(), t.session(), false, t.listingConfirmed());
  }

  private Session loadOrCreate(String partyId) {
    Session stored = sessions.load(partyId).orElse(null);
    if (stored == null) {
      return Session.fresh(partyId);
    }
    if (stored.step() == null) {
      log.warn("Session of {} holds an unknown step; starting over", partyId);
      return Session.fresh(partyId).captureDisplayName(stored.displayName());
    }
    return stored.withPartyId(partyId);
  }
}
