package com.demo.quotatoken.web.response;

/**
 * 错误响应体：{"detail": "..."}
 */
public record ApiError(String detail) {

    public static ApiError unauthorized() {
        return new ApiError("Unauthorized");
    }
}
