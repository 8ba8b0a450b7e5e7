package com.minisessiondb.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 会话附加信息
 *
 * purpose和notes可为空;domains由序列化器根据标签页地址重新推导。
 */
public class SessionMetadata {

    private String purpose;

    private String notes;

    private boolean isPrivate;

    private long totalTime;

    private int pageCount;

    private List<String> domains = new ArrayList<>();

    public SessionMetadata() {
    }

    public SessionMetadata(SessionMetadata other) {
        this.purpose = other.purpose;
        this.notes = other.notes;
        this.isPrivate = other.isPrivate;
        this.totalTime = other.totalTime;
        this.pageCount = other.pageCount;
        this.domains = other.domains == null ? new ArrayList<>() : new ArrayList<>(other.domains);
    }

    public String getPurpose() {
        return purpose;
    }

    public void setPurpose(String purpose) {
        this.purpose = purpose;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public boolean isPrivate() {
        return isPrivate;
    }

    public void setPrivate(boolean isPrivate) {
        this.isPrivate = isPrivate;
    }

    public long getTotalTime() {
        return totalTime;
    }

    public void setTotalTime(long totalTime) {
        this.totalTime = totalTime;
    }

    public int getPageCount() {
        return pageCount;
    }

    public void setPageCount(int pageCount) {
        this.pageCount = pageCount;
    }

    public List<String> getDomains() {
        return domains;
    }

    public void setDomains(List<String> domains) {
        this.domains = domains;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionMetadata)) return false;
        SessionMetadata that = (SessionMetadata) o;
        return isPrivate == that.isPrivate
                && totalTime == that.totalTime
                && pageCount == that.pageCount
                && Objects.equals(purpose, that.purpose)
                && Objects.equals(notes, that.notes)
                && Objects.equals(domains, that.domains);
    }

    @Override
    public int hashCode() {
        return Objects.hash(purpose, notes, isPrivate, totalTime, pageCount, domains);
    }

    @Override
    public String toString() {
        return "SessionMetadata{" +
                "purpose='" + purpose + '\'' +
                ", isPrivate=" + isPrivate +
                ", totalTime=" + totalTime +
                ", pageCount=" + pageCount +
                ", domains=" + domains +
                '}';
    }
}
