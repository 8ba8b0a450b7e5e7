package com.minisessiondb.storage.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 会话查询条件
 *
 * 各条件之间为AND关系,列表条件内部为OR关系:
 * - tags: 标签精确匹配其一
 * - dateRange: createdAt落在闭区间内
 * - domains: 会话任一域名包含其一(子串)
 * - searchText: 标签、用途、备注中任一包含该文本(忽略大小写)
 */
public final class SessionQuery {

    private final List<String> tags;

    private final DateRange dateRange;

    private final List<String> domains;

    private final String searchText;

    private final QueryOptions options;

    private SessionQuery(Builder builder) {
        this.tags = Collections.unmodifiableList(new ArrayList<>(builder.tags));
        this.dateRange = builder.dateRange;
        this.domains = Collections.unmodifiableList(new ArrayList<>(builder.domains));
        this.searchText = builder.searchText;
        this.options = builder.options == null ? QueryOptions.defaults() : builder.options;
    }

    public static SessionQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getTags() {
        return tags;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public List<String> getDomains() {
        return domains;
    }

    public String getSearchText() {
        return searchText;
    }

    public QueryOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "SessionQuery{" +
                "tags=" + tags +
                ", dateRange=" + dateRange +
                ", domains=" + domains +
                ", searchText='" + searchText + '\'' +
                ", options=" + options +
                '}';
    }

    public static final class Builder {
        private final List<String> tags = new ArrayList<>();
        private DateRange dateRange;
        private final List<String> domains = new ArrayList<>();
        private String searchText;
        private QueryOptions options;

        private Builder() {
        }

        public Builder tags(String... tags) {
            this.tags.addAll(Arrays.asList(tags));
            return this;
        }

        public Builder dateRange(long start, long end) {
            this.dateRange = new DateRange(start, end);
            return this;
        }

        public Builder domains(String... domains) {
            this.domains.addAll(Arrays.asList(domains));
            return this;
        }

        public Builder searchText(String searchText) {
            this.searchText = searchText;
            return this;
        }

        public Builder options(QueryOptions options) {
            this.options = options;
            return this;
        }

        public SessionQuery build() {
            return new SessionQuery(this);
        }
    }
}
