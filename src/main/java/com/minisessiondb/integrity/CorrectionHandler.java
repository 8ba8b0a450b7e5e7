package com.minisessiondb.integrity;

/**
 * 自动修正处理器,按错误类型注册到 {@link DataIntegrityValidator}
 *
 * 抛出任何异常都视为修正失败,错误会留在未修正列表中。
 */
@FunctionalInterface
public interface CorrectionHandler {

    void correct(ValidationError error) throws Exception;
}
