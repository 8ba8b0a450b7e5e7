package com.minisessiondb.exchange;

import com.minisessiondb.storage.engine.DateRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 导出过滤条件,各条件依次叠加
 *
 * - sessionIds: 只保留这些会话及其标签页、导航事件、边界
 * - dateRange: 会话/标签页按createdAt,导航事件/边界按timestamp
 * - tags: 只保留这些标签的会话及其关联记录
 * - domains: 会话任一域名命中,标签页和导航事件按自身域名,边界不受影响
 */
public final class ExportFilter {

    private final List<String> sessionIds;

    private final DateRange dateRange;

    private final List<String> tags;

    private final List<String> domains;

    private ExportFilter(Builder builder) {
        this.sessionIds = Collections.unmodifiableList(builder.sessionIds);
        this.dateRange = builder.dateRange;
        this.tags = Collections.unmodifiableList(builder.tags);
        this.domains = Collections.unmodifiableList(builder.domains);
    }

    public static ExportFilter none() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getSessionIds() {
        return sessionIds;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getDomains() {
        return domains;
    }

    @Override
    public String toString() {
        return "ExportFilter{" +
                "sessionIds=" + sessionIds +
                ", dateRange=" + dateRange +
                ", tags=" + tags +
                ", domains=" + domains +
                '}';
    }

    public static final class Builder {
        private final List<String> sessionIds = new ArrayList<>();
        private DateRange dateRange;
        private final List<String> tags = new ArrayList<>();
        private final List<String> domains = new ArrayList<>();

        private Builder() {
        }

        public Builder sessionIds(String... sessionIds) {
            this.sessionIds.addAll(Arrays.asList(sessionIds));
            return this;
        }

        public Builder dateRange(long start, long end) {
            this.dateRange = DateRange.of(start, end);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder domains(String... domains) {
            this.domains.addAll(Arrays.asList(domains));
            return this;
        }

        public ExportFilter build() {
            return new ExportFilter(this);
        }
    }
}
