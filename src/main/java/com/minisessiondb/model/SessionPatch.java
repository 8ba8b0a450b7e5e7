package com.minisessiondb.model;

import java.util.ArrayList;
import java.util.List;

/**
 * SessionPatch - 会话的部分更新
 *
 * 为null的字段表示"不修改"。id和createdAt是身份字段,不允许通过补丁修改;
 * updatedAt由引擎在合并时重新打戳。
 *
 * <pre>
 * SessionPatch patch = SessionPatch.builder()
 *     .tag("work")
 *     .notes("整理完毕")
 *     .build();
 * engine.updateSession("s1", patch).join();
 * </pre>
 */
public final class SessionPatch {

    private final String tag;

    private final List<Tab> tabs;

    private final List<Integer> windowIds;

    private final String purpose;

    private final String notes;

    private final Boolean isPrivate;

    private final Long totalTime;

    private final Integer pageCount;

    private SessionPatch(Builder builder) {
        this.tag = builder.tag;
        this.tabs = builder.tabs;
        this.windowIds = builder.windowIds;
        this.purpose = builder.purpose;
        this.notes = builder.notes;
        this.isPrivate = builder.isPrivate;
        this.totalTime = builder.totalTime;
        this.pageCount = builder.pageCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 把补丁合并到会话上(原地修改)
     */
    public void applyTo(Session session) {
        if (tag != null) {
            session.setTag(tag);
        }
        if (tabs != null) {
            List<Tab> copied = new ArrayList<>();
            for (Tab tab : tabs) {
                copied.add(new Tab(tab));
            }
            session.setTabs(copied);
        }
        if (windowIds != null) {
            session.setWindowIds(new ArrayList<>(windowIds));
        }
        SessionMetadata metadata = session.getMetadata();
        if (metadata == null) {
            metadata = new SessionMetadata();
            session.setMetadata(metadata);
        }
        if (purpose != null) {
            metadata.setPurpose(purpose);
        }
        if (notes != null) {
            metadata.setNotes(notes);
        }
        if (isPrivate != null) {
            metadata.setPrivate(isPrivate);
        }
        if (totalTime != null) {
            metadata.setTotalTime(totalTime);
        }
        if (pageCount != null) {
            metadata.setPageCount(pageCount);
        }
    }

    public boolean isEmpty() {
        return tag == null && tabs == null && windowIds == null && purpose == null
                && notes == null && isPrivate == null && totalTime == null && pageCount == null;
    }

    public String getTag() {
        return tag;
    }

    public List<Tab> getTabs() {
        return tabs;
    }

    public static final class Builder {
        private String tag;
        private List<Tab> tabs;
        private List<Integer> windowIds;
        private String purpose;
        private String notes;
        private Boolean isPrivate;
        private Long totalTime;
        private Integer pageCount;

        private Builder() {
        }

        public Builder tag(String tag) {
            this.tag = tag;
            return this;
        }

        public Builder tabs(List<Tab> tabs) {
            this.tabs = tabs;
            return this;
        }

        public Builder windowIds(List<Integer> windowIds) {
            this.windowIds = windowIds;
            return this;
        }

        public Builder purpose(String purpose) {
            this.purpose = purpose;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder isPrivate(boolean isPrivate) {
            this.isPrivate = isPrivate;
            return this;
        }

        public Builder totalTime(long totalTime) {
            this.totalTime = totalTime;
            return this;
        }

        public Builder pageCount(int pageCount) {
            this.pageCount = pageCount;
            return this;
        }

        public SessionPatch build() {
            return new SessionPatch(this);
        }
    }
}
