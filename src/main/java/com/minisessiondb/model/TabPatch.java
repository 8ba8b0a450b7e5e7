package com.minisessiondb.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 标签页的部分更新。id和createdAt不可修改,lastAccessed由引擎重新打戳。
 */
public final class TabPatch {

    private final String url;

    private final String title;

    private final String favicon;

    private final Integer windowId;

    private final Long timeSpent;

    private final Integer scrollPosition;

    private final Map<String, String> formData;

    private TabPatch(Builder builder) {
        this.url = builder.url;
        this.title = builder.title;
        this.favicon = builder.favicon;
        this.windowId = builder.windowId;
        this.timeSpent = builder.timeSpent;
        this.scrollPosition = builder.scrollPosition;
        this.formData = builder.formData;
    }

    public static Builder builder() {
        return new Builder();
    }

    public void applyTo(Tab tab) {
        if (url != null) {
            tab.setUrl(url);
        }
        if (title != null) {
            tab.setTitle(title);
        }
        if (favicon != null) {
            tab.setFavicon(favicon);
        }
        if (windowId != null) {
            tab.setWindowId(windowId);
        }
        if (timeSpent != null) {
            tab.setTimeSpent(timeSpent);
        }
        if (scrollPosition != null) {
            tab.setScrollPosition(scrollPosition);
        }
        if (formData != null) {
            tab.setFormData(new LinkedHashMap<>(formData));
        }
    }

    public String getUrl() {
        return url;
    }

    public static final class Builder {
        private String url;
        private String title;
        private String favicon;
        private Integer windowId;
        private Long timeSpent;
        private Integer scrollPosition;
        private Map<String, String> formData;

        private Builder() {
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder favicon(String favicon) {
            this.favicon = favicon;
            return this;
        }

        public Builder windowId(int windowId) {
            this.windowId = windowId;
            return this;
        }

        public Builder timeSpent(long timeSpent) {
            this.timeSpent = timeSpent;
            return this;
        }

        public Builder scrollPosition(int scrollPosition) {
            this.scrollPosition = scrollPosition;
            return this;
        }

        public Builder formData(Map<String, String> formData) {
            this.formData = formData;
            return this;
        }

        public TabPatch build() {
            return new TabPatch(this);
        }
    }
}
