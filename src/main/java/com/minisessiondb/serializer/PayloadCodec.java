package com.minisessiondb.serializer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.minisessiondb.common.ObjectMappers;
import com.minisessiondb.common.UrlUtils;
import com.minisessiondb.exception.StorageException;
import com.minisessiondb.model.Tab;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * PayloadCodec - 标签页快照的压缩编解码
 *
 * 编码步骤:
 * 1. 建立主机名字典: 每个不同的主机名分配一个短token(d0, d1, ...)
 * 2. 从地址中挖掉主机名,记录token和挖掉的位置
 * 3. 整体JSON → GZIP → Base64
 *
 * 解码是严格的逆过程,地址按原位置把主机名插回,结果与编码前逐字节相同。
 */
public class PayloadCodec {

    private static final String TOKEN_PREFIX = "d";

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this.mapper = ObjectMappers.standard();
    }

    /**
     * 压缩标签页列表
     *
     * @return Base64文本
     */
    public String encode(List<Tab> tabs) {
        Map<String, String> hostToToken = new LinkedHashMap<>();
        Payload payload = new Payload();

        for (Tab tab : tabs) {
            PackedTab packed = new PackedTab();
            Tab copy = new Tab(tab);
            String url = copy.getUrl();
            String host = UrlUtils.extractDomain(url);
            int offset = host == null ? -1 : url.indexOf(host);
            if (offset >= 0) {
                String token = hostToToken.computeIfAbsent(host, h -> TOKEN_PREFIX + hostToToken.size());
                copy.setUrl(url.substring(0, offset) + url.substring(offset + host.length()));
                packed.setHostToken(token);
                packed.setHostOffset(offset);
            }
            packed.setTab(copy);
            payload.getTabs().add(packed);
        }
        for (Map.Entry<String, String> entry : hostToToken.entrySet()) {
            payload.getDictionary().put(entry.getValue(), entry.getKey());
        }

        try {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try (OutputStream gzip = new GZIPOutputStream(buffer)) {
                gzip.write(mapper.writeValueAsBytes(payload));
            }
            return Base64.getEncoder().encodeToString(buffer.toByteArray());
        } catch (IOException e) {
            throw new StorageException("Failed to compress tab payload", e);
        }
    }

    /**
     * 解压标签页列表
     *
     * @throws StorageException 负载损坏
     */
    public List<Tab> decode(String encoded) {
        Payload payload;
        try {
            byte[] compressed = Base64.getDecoder().decode(encoded);
            try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
                payload = mapper.readValue(gzip.readAllBytes(), Payload.class);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Session data corruption detected", e);
        }

        List<Tab> tabs = new ArrayList<>(payload.getTabs().size());
        for (PackedTab packed : payload.getTabs()) {
            Tab tab = packed.getTab();
            if (packed.getHostToken() != null) {
                String host = payload.getDictionary().get(packed.getHostToken());
                if (host == null) {
                    throw new StorageException("Session data corruption detected: unknown host token "
                            + packed.getHostToken());
                }
                String url = tab.getUrl();
                int offset = packed.getHostOffset();
                tab.setUrl(url.substring(0, offset) + host + url.substring(offset));
            }
            tabs.add(tab);
        }
        return tabs;
    }

    /**
     * 压缩负载结构
     */
    public static class Payload {

        private Map<String, String> dictionary = new LinkedHashMap<>();

        private List<PackedTab> tabs = new ArrayList<>();

        public Map<String, String> getDictionary() {
            return dictionary;
        }

        public void setDictionary(Map<String, String> dictionary) {
            this.dictionary = dictionary;
        }

        public List<PackedTab> getTabs() {
            return tabs;
        }

        public void setTabs(List<PackedTab> tabs) {
            this.tabs = tabs;
        }
    }

    public static class PackedTab {

        private Tab tab;

        private String hostToken;

        private int hostOffset = -1;

        public Tab getTab() {
            return tab;
        }

        public void setTab(Tab tab) {
            this.tab = tab;
        }

        public String getHostToken() {
            return hostToken;
        }

        public void setHostToken(String hostToken) {
            this.hostToken = hostToken;
        }

        public int getHostOffset() {
            return hostOffset;
        }

        public void setHostOffset(int hostOffset) {
            this.hostOffset = hostOffset;
        }
    }
}
