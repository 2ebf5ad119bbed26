package com.streammeta.metadata.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Plain status reply for write operations
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse {

    private int code;
    private String message;

    public static ApiResponse ok(String message) {
        return new ApiResponse(200, message);
    }
}
