package com.mimecast.listrunner.hold;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Moderation hold of one message.
 *
 * <p>Serialized with Gson next to the quarantined payload.
 */
public class HoldRecord {

    private String id;
    private String listName;
    private List<String> reasons = new ArrayList<>();
    private String reason;
    private String sender;
    private String subject;
    private String messageId;
    private long timestamp;
    private HoldState state = HoldState.PENDING;
    private long decidedTime;
    private String comment;

    /**
     * Constructs a new HoldRecord instance.
     * <p>Used by Gson.
     */
    public HoldRecord() {
    }

    /**
     * Constructs a new HoldRecord instance.
     *
     * @param id        Queue message id.
     * @param listName  List name.
     * @param reasons   Hold reasons, first one is the primary reason.
     * @param timestamp Creation time in epoch millis.
     */
    public HoldRecord(String id, String listName, List<HoldReason> reasons, long timestamp) {
        this.id = id;
        this.listName = listName;
        this.timestamp = timestamp;
        for (HoldReason holdReason : reasons) {
            this.reasons.add(holdReason.name());
        }
        this.reason = reasons.isEmpty() ? null : reasons.get(0).getDescription();
    }

    public String getId() {
        return id;
    }

    public String getListName() {
        return listName;
    }

    /**
     * Gets reason codes.
     *
     * @return List of String.
     */
    public List<String> getReasons() {
        return reasons != null ? reasons : new ArrayList<>();
    }

    /**
     * Gets reasons with unknown codes left out.
     *
     * @return List of HoldReason.
     */
    public List<HoldReason> getHoldReasons() {
        List<HoldReason> list = new ArrayList<>();
        for (String code : getReasons()) {
            HoldReason.fromName(code).ifPresent(list::add);
        }
        return list;
    }

    /**
     * Gets primary reason.
     *
     * @return Optional of HoldReason.
     */
    public Optional<HoldReason> getPrimaryReason() {
        List<HoldReason> list = getHoldReasons();
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    public String getReason() {
        return reason;
    }

    public String getSender() {
        return sender;
    }

    public HoldRecord setSender(String sender) {
        this.sender = sender;
        return this;
    }

    public String getSubject() {
        return subject;
    }

    public HoldRecord setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public String getMessageId() {
        return messageId;
    }

    public HoldRecord setMessageId(String messageId) {
        this.messageId = messageId;
        return this;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public HoldState getState() {
        return state;
    }

    public boolean isPending() {
        return state == HoldState.PENDING;
    }

    public long getDecidedTime() {
        return decidedTime;
    }

    public String getComment() {
        return comment;
    }

    /**
     * Records a moderator decision.
     *
     * @param state       Terminal state.
     * @param decidedTime Decision time in epoch millis.
     * @param comment     Moderator comment, may be null.
     * @return Self.
     */
    HoldRecord decide(HoldState state, long decidedTime, String comment) {
        this.state = state;
        this.decidedTime = decidedTime;
        this.comment = comment;
        return this;
    }

    @Override
    public String toString() {
        return "HoldRecord{id=" + id + ", list=" + listName + ", reasons=" + reasons + ", state=" + state + "}";
    }
}
