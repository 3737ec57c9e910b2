package com.metagov.errors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised by integration code when a start, close, webhook or update against an external system fails.
 * A failed start rolls the process back; for the other operations the error is recorded into the
 * process {@code errors} field and the process is kept.
 */
public final class PluginInternalException extends MetagovException {

    public static final String DEFAULT_CODE = "plugin_error";

    private final String code;
    private final Map<String, Object> detail;

    public PluginInternalException(String message) {
        this(DEFAULT_CODE, message, null, null);
    }

    public PluginInternalException(String message, Throwable cause) {
        this(DEFAULT_CODE, message, null, cause);
    }

    public PluginInternalException(String code, String message, Map<String, Object> detail, Throwable cause) {
        super(message, cause);
        this.code = code != null && !code.isBlank() ? code : DEFAULT_CODE;
        this.detail = detail != null ? Collections.unmodifiableMap(new LinkedHashMap<>(detail)) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    /** Serialized form stored in a process's {@code errors} field. */
    public Map<String, Object> toErrorPayload() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", code);
        out.put("message", getMessage() != null ? getMessage() : "");
        if (!detail.isEmpty()) {
            out.put("detail", detail);
        }
        return out;
    }
}
