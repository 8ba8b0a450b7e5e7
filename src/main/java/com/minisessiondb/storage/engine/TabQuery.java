package com.minisessiondb.storage.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 标签页查询条件: sessionIds / windowIds / domains(子串) / dateRange(createdAt)
 */
public final class TabQuery {

    private final List<String> sessionIds;

    private final List<Integer> windowIds;

    private final List<String> domains;

    private final DateRange dateRange;

    private final QueryOptions options;

    private TabQuery(Builder builder) {
        this.sessionIds = Collections.unmodifiableList(new ArrayList<>(builder.sessionIds));
        this.windowIds = Collections.unmodifiableList(new ArrayList<>(builder.windowIds));
        this.domains = Collections.unmodifiableList(new ArrayList<>(builder.domains));
        this.dateRange = builder.dateRange;
        this.options = builder.options == null ? QueryOptions.defaults() : builder.options;
    }

    public static TabQuery all() {
        return builder().build();
    }

    public static TabQuery forSession(String sessionId) {
        return builder().sessionIds(sessionId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getSessionIds() {
        return sessionIds;
    }

    public List<Integer> getWindowIds() {
        return windowIds;
    }

    public List<String> getDomains() {
        return domains;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public QueryOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "TabQuery{" +
                "sessionIds=" + sessionIds +
                ", windowIds=" + windowIds +
                ", domains=" + domains +
                ", dateRange=" + dateRange +
                ", options=" + options +
                '}';
    }

    public static final class Builder {
        private final List<String> sessionIds = new ArrayList<>();
        private final List<Integer> windowIds = new ArrayList<>();
        private final List<String> domains = new ArrayList<>();
        private DateRange dateRange;
        private QueryOptions options;

        private Builder() {
        }

        public Builder sessionIds(String... sessionIds) {
            this.sessionIds.addAll(Arrays.asList(sessionIds));
            return this;
        }

        public Builder windowIds(Integer... windowIds) {
            this.windowIds.addAll(Arrays.asList(windowIds));
            return this;
        }

        public Builder domains(String... domains) {
            this.domains.addAll(Arrays.asList(domains));
            return this;
        }

        public Builder dateRange(long start, long end) {
            this.dateRange = new DateRange(start, end);
            return this;
        }

        public Builder options(QueryOptions options) {
            this.options = options;
            return this;
        }

        public TabQuery build() {
            return new TabQuery(this);
        }
    }
}
