package com.phillippitts.alarmblock.presentation.controller;

import java.util.Map;

/**
 * Envelope returned by mutating endpoints.
 */
record ApiResponse(String message, String status, Map<String, Object> data) {

    static final String SUCCESS = "success";
    static final String ERROR = "error";

    static ApiResponse success(String message) {
        return new ApiResponse(message, SUCCESS, Map.of());
    }

    static ApiResponse success(String message, Map<String, Object> data) {
        return new ApiResponse(message, SUCCESS, data);
    }

    static ApiResponse error(String message, Map<String, Object> data) {
        return new ApiResponse(message, ERROR, data);
    }
}
