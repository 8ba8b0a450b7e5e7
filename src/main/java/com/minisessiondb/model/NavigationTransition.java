package com.minisessiondb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 导航跳转类型(对应浏览器history API的transition type)
 */
public enum NavigationTransition {
    LINK("link"),
    TYPED("typed"),
    BOOKMARK("bookmark"),
    AUTO_BOOKMARK("auto_bookmark"),
    AUTO_SUBFRAME("auto_subframe"),
    MANUAL_SUBFRAME("manual_subframe"),
    GENERATED("generated"),
    START_PAGE("start_page"),
    FORM_SUBMIT("form_submit"),
    RELOAD("reload"),
    KEYWORD("keyword"),
    KEYWORD_GENERATED("keyword_generated");

    private final String wireName;

    NavigationTransition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static NavigationTransition fromWireName(String wireName) {
        for (NavigationTransition transition : values()) {
            if (transition.wireName.equals(wireName)) {
                return transition;
            }
        }
        throw new IllegalArgumentException("Unknown transition type: " + wireName);
    }
}
