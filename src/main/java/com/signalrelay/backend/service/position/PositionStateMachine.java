package com.signalrelay.backend.service.position;

import com.signalrelay.backend.model.PositionRecord;
import com.signalrelay.backend.model.PositionSide;
import com.signalrelay.backend.model.SignalSide;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Entry/exit decision for a signal against a reconciled position.
 *
 * <pre>
 *   current | signal   | decision
 *   --------+----------+-------------------------------
 *   LONG    | LONG     | ALREADY_IN_POSITION
 *   SHORT   | SHORT    | ALREADY_IN_POSITION
 *   any     | any      | COOLDOWN while now < cooldownUntil
 *   FLAT    | either   | OPEN
 *   LONG    | SHORT    | FLIP
 *   SHORT   | LONG     | FLIP
 * </pre>
 *
 * The same-side row is checked first, so a repeat of the held side reports
 * ALREADY_IN_POSITION even inside the cooldown window.
 */
@Component
public class PositionStateMachine {

    public TransitionDecision decide(PositionRecord record, SignalSide signalSide, Instant now) {
        PositionSide current = record.getSide();
        if (current.matches(signalSide)) {
            return TransitionDecision.ALREADY_IN_POSITION;
        }
        if (record.inCooldown(now)) {
            return TransitionDecision.COOLDOWN;
        }
        return current == PositionSide.FLAT ? TransitionDecision.OPEN : TransitionDecision.FLIP;
    }
}
