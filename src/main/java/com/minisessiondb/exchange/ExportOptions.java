package com.minisessiondb.exchange;

/**
 * 导出内容开关,默认全部包含并输出带缩进的JSON
 */
public final class ExportOptions {

    private final boolean includeSessions;

    private final boolean includeTabs;

    private final boolean includeHistory;

    private final boolean includeBoundaries;

    private final boolean prettyPrint;

    private ExportOptions(Builder builder) {
        this.includeSessions = builder.includeSessions;
        this.includeTabs = builder.includeTabs;
        this.includeHistory = builder.includeHistory;
        this.includeBoundaries = builder.includeBoundaries;
        this.prettyPrint = builder.prettyPrint;
    }

    public static ExportOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isIncludeSessions() {
        return includeSessions;
    }

    public boolean isIncludeTabs() {
        return includeTabs;
    }

    /**
     * 是否包含导航事件
     */
    public boolean isIncludeHistory() {
        return includeHistory;
    }

    public boolean isIncludeBoundaries() {
        return includeBoundaries;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    @Override
    public String toString() {
        return "ExportOptions{" +
                "includeSessions=" + includeSessions +
                ", includeTabs=" + includeTabs +
                ", includeHistory=" + includeHistory +
                ", includeBoundaries=" + includeBoundaries +
                ", prettyPrint=" + prettyPrint +
                '}';
    }

    public static final class Builder {
        private boolean includeSessions = true;
        private boolean includeTabs = true;
        private boolean includeHistory = true;
        private boolean includeBoundaries = true;
        private boolean prettyPrint = true;

        private Builder() {
        }

        public Builder includeSessions(boolean includeSessions) {
            this.includeSessions = includeSessions;
            return this;
        }

        public Builder includeTabs(boolean includeTabs) {
            this.includeTabs = includeTabs;
            return this;
        }

        public Builder includeHistory(boolean includeHistory) {
            this.includeHistory = includeHistory;
            return this;
        }

        public Builder includeBoundaries(boolean includeBoundaries) {
            this.includeBoundaries = includeBoundaries;
            return this;
        }

        public Builder prettyPrint(boolean prettyPrint) {
            this.prettyPrint = prettyPrint;
            return this;
        }

        public ExportOptions build() {
            return new ExportOptions(this);
        }
    }
}
