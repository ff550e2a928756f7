package com.quotaguard.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body. {@code requiredStep} names the operation the caller must run first, when there is one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    private String code;
    private String message;
    private String requiredStep;

    public static ApiError of(String code, String message) {
        return new ApiError(code, message, null);
    }

    public static ApiError requiring(String code, String message, String requiredStep) {
        return new ApiError(code, message, requiredStep);
    }
}
