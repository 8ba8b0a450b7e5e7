package com.minisessiondb.exchange;

/**
 * 导入选项
 *
 * overwriteExisting=false 时主键已存在的记录被跳过,true 时覆盖。
 * validateData=true 时未通过校验的记录不导入,错误写入结果。
 */
public final class ImportOptions {

    private final boolean overwriteExisting;

    private final boolean validateData;

    public ImportOptions(boolean overwriteExisting, boolean validateData) {
        this.overwriteExisting = overwriteExisting;
        this.validateData = validateData;
    }

    public static ImportOptions skipExisting() {
        return new ImportOptions(false, true);
    }

    public static ImportOptions overwrite() {
        return new ImportOptions(true, true);
    }

    public boolean isOverwriteExisting() {
        return overwriteExisting;
    }

    public boolean isValidateData() {
        return validateData;
    }

    @Override
    public String toString() {
        return "ImportOptions{" +
                "overwriteExisting=" + overwriteExisting +
                ", validateData=" + validateData +
                '}';
    }
}
