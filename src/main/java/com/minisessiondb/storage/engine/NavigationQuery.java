package com.minisessiondb.storage.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 导航事件查询条件: sessionIds / tabIds / domains(子串) / dateRange(timestamp)
 */
public final class NavigationQuery {

    private final List<String> sessionIds;

    private final List<Integer> tabIds;

    private final List<String> domains;

    private final DateRange dateRange;

    private final QueryOptions options;

    private NavigationQuery(Builder builder) {
        this.sessionIds = Collections.unmodifiableList(new ArrayList<>(builder.sessionIds));
        this.tabIds = Collections.unmodifiableList(new ArrayList<>(builder.tabIds));
        this.domains = Collections.unmodifiableList(new ArrayList<>(builder.domains));
        this.dateRange = builder.dateRange;
        this.options = builder.options == null ? QueryOptions.defaults() : builder.options;
    }

    public static NavigationQuery all() {
        return builder().build();
    }

    public static NavigationQuery forSession(String sessionId) {
        return builder().sessionIds(sessionId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getSessionIds() {
        return sessionIds;
    }

    public List<Integer> getTabIds() {
        return tabIds;
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
        return "NavigationQuery{" +
                "sessionIds=" + sessionIds +
                ", tabIds=" + tabIds +
                ", domains=" + domains +
                ", dateRange=" + dateRange +
                ", options=" + options +
                '}';
    }

    public static final class Builder {
        private final List<String> sessionIds = new ArrayList<>();
        private final List<Integer> tabIds = new ArrayList<>();
        private final List<String> domains = new ArrayList<>();
        private DateRange dateRange;
        private QueryOptions options;

        private Builder() {
        }

        public Builder sessionIds(String... sessionIds) {
            this.sessionIds.addAll(Arrays.asList(sessionIds));
            return this;
        }

        public Builder tabIds(Integer... tabIds) {
            this.tabIds.addAll(Arrays.asList(tabIds));
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

        public NavigationQuery build() {
            return new NavigationQuery(this);
        }
    }
}
