package com.minisessiondb.common;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;

/**
 * UrlUtils - URL与域名工具
 *
 * 先按RFC 3986解析(URI),失败时退回到宽松的java.net.URL解析,
 * 这样带空格等未转义字符的浏览器地址也能提取到主机名。
 */
public final class UrlUtils {

    /** 无法解析主机名时使用的域名 */
    public static final String UNKNOWN_DOMAIN = "unknown";

    private UrlUtils() {
    }

    /**
     * 提取主机名
     *
     * @param url 地址
     * @return 主机名,无法解析时返回null
     */
    public static String extractDomain(String url) {
        if (url == null || url.isEmpty()) {
            return null;
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() != null) {
                return uri.getHost();
            }
        } catch (URISyntaxException e) {
            // 尝试宽松解析
        }
        try {
            String host = new URL(url).getHost();
            return host == null || host.isEmpty() ? null : host;
        } catch (MalformedURLException e) {
            return null;
        }
    }

    /**
     * 提取主机名,失败时返回 "unknown"
     */
    public static String extractDomainOrUnknown(String url) {
        String domain = extractDomain(url);
        return domain != null ? domain : UNKNOWN_DOMAIN;
    }

    /**
     * 是否为带scheme的绝对地址(about:blank这类无主机地址同样有效)
     */
    public static boolean isValidUrl(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        try {
            URI uri = new URI(url);
            return uri.isAbsolute();
        } catch (URISyntaxException e) {
            try {
                new URL(url);
                return true;
            } catch (MalformedURLException ex) {
                return false;
            }
        }
    }

    /**
     * 拆分出 scheme://host 前缀和路径部分,用于截断过长地址
     *
     * @return 两个元素的数组 {origin, path},无法解析时返回null
     */
    public static String[] splitOriginAndPath(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return null;
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            return new String[]{uri.getScheme() + "://" + uri.getRawAuthority(), path};
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
