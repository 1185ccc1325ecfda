package com.example.musictracker.api.response;

import com.example.musictracker.common.exception.BusinessException;
import com.example.musictracker.common.logging.AccessLogFilter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

/**
 * Envelope of every tracker endpoint. Failures carry the {@link BusinessException} code, so clients see the same
 * codes as task failures ("404", "409", "IO_ERROR", "STORAGE_ERROR", ...).
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    public static final String SUCCESS_CODE = "0";

    private String code;
    private String message;
    private T data;
    private String userAction;

    /**
     * Request id of the access log line for this call, absent outside of an HTTP request.
     */
    private String traceId;

    private ApiResponse(String code, String message, T data, String userAction) {
        this.code = code;
        this.message = message;
        this.data = data;
        this.userAction = userAction;
        this.traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(SUCCESS_CODE, "OK", data, null);
    }

    public static <T> ApiResponse<T> fail(String code, String message) {
        return new ApiResponse<>(code, message, null, null);
    }

    public static <T> ApiResponse<T> fail(BusinessException e) {
        return new ApiResponse<>(e.getCode(), e.getMessage(), null, e.getUserAction());
    }

    public static <T> ApiResponse<T> notFound(String subject) {
        return fail("404", subject + " not found");
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS_CODE.equals(code);
    }
}
