package com.asiainfo.deepdive.shared;

/**
 * 不变量违例
 * 非法的下钻跳转、未知的分组键、越级的范围过滤等编程/配置错误，直接失败，不做修正
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
