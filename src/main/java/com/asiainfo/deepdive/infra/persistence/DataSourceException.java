package com.asiainfo.deepdive.infra.persistence;

/**
 * 数据仓库查询失败或超时
 * 保留原始诊断信息，核心层不做重试，由调用方决定是否重试
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
