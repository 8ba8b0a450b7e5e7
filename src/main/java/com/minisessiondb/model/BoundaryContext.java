package com.minisessiondb.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 边界检测时的上下文信息,各字段均可缺省
 */
public class BoundaryContext {

    private Long idleDuration;

    private Long navigationGap;

    private String domainFrom;

    private String domainTo;

    private List<Integer> tabsInvolved = new ArrayList<>();

    private List<Integer> windowsInvolved = new ArrayList<>();

    public BoundaryContext() {
    }

    public BoundaryContext(BoundaryContext other) {
        this.idleDuration = other.idleDuration;
        this.navigationGap = other.navigationGap;
        this.domainFrom = other.domainFrom;
        this.domainTo = other.domainTo;
        this.tabsInvolved = other.tabsInvolved == null ? new ArrayList<>() : new ArrayList<>(other.tabsInvolved);
        this.windowsInvolved = other.windowsInvolved == null ? new ArrayList<>() : new ArrayList<>(other.windowsInvolved);
    }

    public Long getIdleDuration() {
        return idleDuration;
    }

    public void setIdleDuration(Long idleDuration) {
        this.idleDuration = idleDuration;
    }

    public Long getNavigationGap() {
        return navigationGap;
    }

    public void setNavigationGap(Long navigationGap) {
        this.navigationGap = navigationGap;
    }

    public String getDomainFrom() {
        return domainFrom;
    }

    public void setDomainFrom(String domainFrom) {
        this.domainFrom = domainFrom;
    }

    public String getDomainTo() {
        return domainTo;
    }

    public void setDomainTo(String domainTo) {
        this.domainTo = domainTo;
    }

    public List<Integer> getTabsInvolved() {
        return tabsInvolved;
    }

    public void setTabsInvolved(List<Integer> tabsInvolved) {
        this.tabsInvolved = tabsInvolved;
    }

    public List<Integer> getWindowsInvolved() {
        return windowsInvolved;
    }

    public void setWindowsInvolved(List<Integer> windowsInvolved) {
        this.windowsInvolved = windowsInvolved;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundaryContext)) return false;
        BoundaryContext that = (BoundaryContext) o;
        return Objects.equals(idleDuration, that.idleDuration)
                && Objects.equals(navigationGap, that.navigationGap)
                && Objects.equals(domainFrom, that.domainFrom)
                && Objects.equals(domainTo, that.domainTo)
                && Objects.equals(tabsInvolved, that.tabsInvolved)
                && Objects.equals(windowsInvolved, that.windowsInvolved);
    }

    @Override
    public int hashCode() {
        return Objects.hash(idleDuration, navigationGap, domainFrom, domainTo, tabsInvolved, windowsInvolved);
    }
}
