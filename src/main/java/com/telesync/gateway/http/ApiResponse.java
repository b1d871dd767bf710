package com.telesync.gateway.http;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(boolean success, Object data, String error, String code) {

    public static ApiResponse ok(Object data) {
        return new ApiResponse(true, data, null, null);
    }

    public static ApiResponse error(String message, String code) {
        return new ApiResponse(false, null, message, code);
    }
}
