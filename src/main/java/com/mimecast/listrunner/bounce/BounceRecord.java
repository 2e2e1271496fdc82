package com.mimecast.listrunner.bounce;

import java.time.LocalDate;

/**
 * Per member bounce score.
 *
 * <p>Dates are stored as ISO strings so the ledger files stay readable.
 */
public class BounceRecord {

    private String address;
    private double score;
    private String lastBounceDate;
    private int warningsSent;
    private String lastWarningDate;
    private int staleAfterDays;

    /**
     * Constructs a new BounceRecord instance for Gson.
     */
    public BounceRecord() {
    }

    /**
     * Constructs a new BounceRecord instance.
     *
     * @param address        Member address.
     * @param staleAfterDays Staleness window at creation.
     */
    public BounceRecord(String address, int staleAfterDays) {
        this.address = address;
        this.staleAfterDays = staleAfterDays;
    }

    public String getAddress() {
        return address;
    }

    public double getScore() {
        return score;
    }

    public BounceRecord setScore(double score) {
        this.score = Math.max(0.0, score);
        return this;
    }

    public LocalDate getLastBounceDate() {
        return lastBounceDate == null ? null : LocalDate.parse(lastBounceDate);
    }

    public BounceRecord setLastBounceDate(LocalDate date) {
        this.lastBounceDate = date == null ? null : date.toString();
        return this;
    }

    public int getWarningsSent() {
        return warningsSent;
    }

    public BounceRecord setWarningsSent(int warningsSent) {
        this.warningsSent = warningsSent;
        return this;
    }

    public LocalDate getLastWarningDate() {
        return lastWarningDate == null ? null : LocalDate.parse(lastWarningDate);
    }

    public BounceRecord setLastWarningDate(LocalDate date) {
        this.lastWarningDate = date == null ? null : date.toString();
        return this;
    }

    public int getStaleAfterDays() {
        return staleAfterDays;
    }

    public BounceRecord setStaleAfterDays(int staleAfterDays) {
        this.staleAfterDays = staleAfterDays;
        return this;
    }

    /**
     * Was a bounce already scored on the given day.
     *
     * @param today Current day.
     * @return Boolean.
     */
    public boolean scoredOn(LocalDate today) {
        return today.equals(getLastBounceDate());
    }

    /**
     * Is the last bounce older than the staleness window.
     *
     * @param today Current day.
     * @return Boolean.
     */
    public boolean isStale(LocalDate today) {
        LocalDate last = getLastBounceDate();
        return last != null && last.plusDays(staleAfterDays).isBefore(today);
    }

    @Override
    public String toString() {
        return "BounceRecord{address=" + address + ", score=" + score + ", lastBounceDate=" + lastBounceDate +
                ", warningsSent=" + warningsSent + ", lastWarningDate=" + lastWarningDate + "}";
    }
}
