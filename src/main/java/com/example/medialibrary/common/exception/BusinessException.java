package com.example.medialibrary.common.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Rejection of a request by the library. {@code code} is either a numeric HTTP-style code or a symbolic
 * library code such as {@code LIBRARY_NO_FOLDERS}.
 */
public class BusinessException extends RuntimeException {

    private static final Map<String, Integer> SYMBOLIC_STATUS = new HashMap<>();

    static {
        SYMBOLIC_STATUS.put("LIBRARY_NO_FOLDERS", 400);
        SYMBOLIC_STATUS.put("LIBRARY_NO_EXTENSIONS", 400);
        SYMBOLIC_STATUS.put("COLLECTION_ORDER_MISMATCH", 409);
        SYMBOLIC_STATUS.put("SCAN_NOT_COMPLETED", 409);
        SYMBOLIC_STATUS.put("TASK_EXECUTOR_REJECTED", 503);
    }

    private final String code;
    private final String userAction;

    public BusinessException(String code, String message) {
        this(code, message, null);
    }

    public BusinessException(String code, String message, String userAction) {
        super(message);
        this.code = code;
        this.userAction = userAction;
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }

    /**
     * HTTP status the API answers with. Numeric codes in the 4xx/5xx range are used as is.
     */
    public int getHttpStatus() {
        Integer symbolic = SYMBOLIC_STATUS.get(code);
        if (symbolic != null) {
            return symbolic;
        }
        try {
            int numeric = Integer.parseInt(code);
            return numeric >= 400 && numeric < 600 ? numeric : 400;
        } catch (NumberFormatException e) {
            return 400;
        }
    }
}
