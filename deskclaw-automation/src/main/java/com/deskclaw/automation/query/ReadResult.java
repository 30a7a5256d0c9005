package com.deskclaw.automation.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Elements of one window region, flattened with their depth below the region root.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadResult {
    private String region;
    private boolean found;
    private int elementCount;
    @Builder.Default
    private List<Element> elements = new ArrayList<>();
    private String message;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Element {
        private String ref;
        private String role;
        private String name;
        private int depth;
        @Builder.Default
        private boolean enabled = true;
        @Builder.Default
        private List<String> states = new ArrayList<>();
    }

    public static ReadResult notFound(String region) {
        return ReadResult.builder()
                .region(region)
                .found(false)
                .message("No " + region + " region found in this window")
                .build();
    }

    public String toCompactString() {
        if (!found) {
            return "Region '" + region + "': not found. " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(region.toUpperCase()).append(" (").append(elementCount).append(" elements) ===");
        for (Element element : elements) {
            sb.append('\n').append("  ".repeat(element.getDepth()))
                    .append('[').append(element.getRef()).append("] ")
                    .append(element.getRole()).append(" \"")
                    .append(element.getName() != null ? element.getName() : "").append('"');
            for (String state : element.getStates()) {
                sb.append(" [").append(state).append(']');
            }
        }
        return sb.toString();
    }
}
