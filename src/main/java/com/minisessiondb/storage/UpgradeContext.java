package com.minisessiondb.storage;

/**
 * 升级上下文:结构编辑器加上一个覆盖全部容器的读写事务
 */
public final class UpgradeContext {

    private final SchemaEditor schemaEditor;

    private final Transaction transaction;

    private final int oldVersion;

    private final int newVersion;

    public UpgradeContext(SchemaEditor schemaEditor, Transaction transaction, int oldVersion, int newVersion) {
        this.schemaEditor = schemaEditor;
        this.transaction = transaction;
        this.oldVersion = oldVersion;
        this.newVersion = newVersion;
    }

    public SchemaEditor getSchemaEditor() {
        return schemaEditor;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public int getOldVersion() {
        return oldVersion;
    }

    public int getNewVersion() {
        return newVersion;
    }
}
