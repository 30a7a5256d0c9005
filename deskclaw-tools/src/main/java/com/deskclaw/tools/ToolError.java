package com.deskclaw.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Structured tool failure with recovery steps the agent can follow.
 * Serialised as {@code {"error": {...}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolError {
    private String code;
    private String message;
    @Builder.Default
    private List<String> recovery = new ArrayList<>();
    private Object context;

    public static ToolError of(String code, String message, String... recovery) {
        return ToolError.builder()
                .code(code)
                .message(message)
                .recovery(new ArrayList<>(Arrays.asList(recovery)))
                .build();
    }

    public String toJson() {
        return ToolParamUtils.toJsonString(Map.of("error", this));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(code).append("] ").append(message);
        if (recovery != null && !recovery.isEmpty()) {
            sb.append("\nRecovery steps:");
            for (String step : recovery) {
                sb.append("\n  - ").append(step);
            }
        }
        return sb.toString();
    }
}
