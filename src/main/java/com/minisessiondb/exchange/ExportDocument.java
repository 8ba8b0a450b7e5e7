package com.minisessiondb.exchange;

import com.minisessiondb.storage.StoreSnapshot;

/**
 * 导出文件的JSON结构: {"metadata": {...}, "data": {...}}
 */
public class ExportDocument {

    private ExportMetadata metadata;

    private StoreSnapshot data;

    public ExportDocument() {
    }

    public ExportDocument(ExportMetadata metadata, StoreSnapshot data) {
        this.metadata = metadata;
        this.data = data;
    }

    public ExportMetadata getMetadata() {
        return metadata;
    }

    public void setMetadata(ExportMetadata metadata) {
        this.metadata = metadata;
    }

    public StoreSnapshot getData() {
        return data;
    }

    public void setData(StoreSnapshot data) {
        this.data = data;
    }
}
