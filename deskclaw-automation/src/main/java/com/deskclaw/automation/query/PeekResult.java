package com.deskclaw.automation.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The focused element and its nearest siblings. The focused element is always
 * the first entry of {@code children}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PeekResult {
    private String ref;
    private String role;
    private String name;
    /** Number of children of the focused element's parent. */
    private int childCount;
    @Builder.Default
    private List<PeekElement> children = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PeekElement {
        private String ref;
        private String role;
        private String name;
        @Builder.Default
        private boolean enabled = true;
    }

    public String toCompactString() {
        StringBuilder sb = new StringBuilder();
        sb.append(role).append(" \"").append(name != null ? name : "").append("\" [")
                .append(ref).append("] - ").append(childCount).append(" children");
        for (PeekElement child : children) {
            sb.append("\n  [").append(child.getRef()).append("] ").append(child.getRole())
                    .append(" \"").append(child.getName()).append('"');
            if (!child.isEnabled()) {
                sb.append(" [disabled]");
            }
        }
        return sb.toString();
    }
}
