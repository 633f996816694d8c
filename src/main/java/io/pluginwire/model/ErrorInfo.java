package io.pluginwire.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured error carried in {@code execute_reply} content.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorInfo(
        @JsonProperty("ename") String ename,
        @JsonProperty("evalue") String evalue,
        @JsonProperty("traceback") List<String> traceback
) {
    public ErrorInfo {
        Objects.requireNonNull(ename, "ename");
        traceback = traceback == null ? List.of() : List.copyOf(traceback);
    }

    public static ErrorInfo of(String ename, String evalue) {
        return new ErrorInfo(ename, evalue, List.of());
    }

    public static ErrorInfo from(Throwable error) {
        Objects.requireNonNull(error, "error");
        List<String> frames = new ArrayList<>();
        for (StackTraceElement frame : error.getStackTrace()) {
            frames.add(frame.toString());
        }
        return new ErrorInfo(error.getClass().getName(), error.getMessage(), frames);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ename", ename);
        if (evalue != null) {
            out.put("evalue", evalue);
        }
        out.put("traceback", traceback);
        return out;
    }
}
