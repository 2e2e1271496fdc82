package com.mimecast.listrunner.pipeline;

import com.mimecast.listrunner.hold.HoldReason;

import java.util.Collections;
import java.util.List;

/**
 * Result of one handler step.
 *
 * <p>{@link Kind#CONTINUE} advances to the next handler, {@link Kind#REQUEUE} leaves the message for a later cycle,
 * every other kind is terminal.
 */
public final class Outcome {

    /**
     * Outcome kinds.
     */
    public enum Kind {
        CONTINUE,
        REQUEUE,
        HOLD,
        REJECT,
        DISCARD,
        DELIVER
    }

    private static final Outcome PROCEED = new Outcome(Kind.CONTINUE, null, Collections.emptyList());
    private static final Outcome DELIVERY = new Outcome(Kind.DELIVER, null, Collections.emptyList());

    private final Kind kind;
    private final String reason;
    private final List<HoldReason> holdReasons;

    private Outcome(Kind kind, String reason, List<HoldReason> holdReasons) {
        this.kind = kind;
        this.reason = reason;
        this.holdReasons = holdReasons;
    }

    public static Outcome proceed() {
        return PROCEED;
    }

    public static Outcome requeue(String reason) {
        return new Outcome(Kind.REQUEUE, reason, Collections.emptyList());
    }

    public static Outcome hold(List<HoldReason> reasons) {
        if (reasons.isEmpty()) {
            throw new IllegalArgumentException("Hold requires at least one reason");
        }
        return new Outcome(Kind.HOLD, reasons.get(0).getDescription(), List.copyOf(reasons));
    }

    public static Outcome reject(String reason) {
        return new Outcome(Kind.REJECT, reason, Collections.emptyList());
    }

    public static Outcome discard(String reason) {
        return new Outcome(Kind.DISCARD, reason, Collections.emptyList());
    }

    public static Outcome deliver() {
        return DELIVERY;
    }

    public Kind getKind() {
        return kind;
    }

    public String getReason() {
        return reason;
    }

    public List<HoldReason> getHoldReasons() {
        return holdReasons;
    }

    /**
     * Is this a final disposition.
     *
     * @return Boolean.
     */
    public boolean isTerminal() {
        return kind != Kind.CONTINUE && kind != Kind.REQUEUE;
    }

    @Override
    public String toString() {
        return reason == null ? kind.name() : kind.name() + "(" + reason + ")";
    }
}
