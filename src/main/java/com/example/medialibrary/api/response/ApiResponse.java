package com.example.medialibrary.api.response;

import com.example.medialibrary.common.exception.BusinessException;
import com.example.medialibrary.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope of every {@code /api/v1} answer. {@code traceId} is the request id stamped by {@link AccessLogFilter}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String CODE_OK = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;
    private String traceId;

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(CODE_OK, "OK", data, null, MDC.get(AccessLogFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null, MDC.get(AccessLogFilter.MDC_REQUEST_ID));
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return new ApiResponse<>(e.getCode(), e.getMessage(), null, e.getUserAction(),
                MDC.get(AccessLogFilter.MDC_REQUEST_ID));
    }
}
