package com.orbitframe.api.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OrbitFrame 基础异常
 * <p>
 * 携带错误码和只读的上下文详情，所有内核异常均继承此类。
 * </p>
 *
 * @author OrbitFrame
 */
@Getter
public class OrbitException extends RuntimeException {

    private final ErrorCode code;

    private final Map<String, Object> details;

    public OrbitException(ErrorCode code, String message) {
        this(code, message, null, null);
    }

    public OrbitException(ErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public OrbitException(ErrorCode code, String message, Map<String, Object> details, Throwable cause) {
        super(message != null ? message : String.valueOf(code), cause);
        this.code = code != null ? code : ErrorCode.UNKNOWN;
        this.details = details == null || details.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName())
                .append(" [").append(code).append("]: ").append(getMessage());
        if (!details.isEmpty()) {
            sb.append(" details=").append(details);
        }
        if (getCause() != null) {
            sb.append(" cause=").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
