package com.mts.common.status;

/**
 * 操作结果码，同时也是返回给客户端的 wire 层状态码。
 */
public enum StatusCode {
    OK,
    INVALID_ARGUMENT,
    NOT_FOUND,
    ALREADY_EXISTS,
    UNAVAILABLE,
    CONFLICT,
    DEADLINE_EXCEEDED,
    INTERNAL
}
