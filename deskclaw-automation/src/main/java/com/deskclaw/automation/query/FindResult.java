package com.deskclaw.automation.query;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches of one element search, in traversal order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FindResult {
    private Query query;
    private int totalSearched;
    private int matchCount;
    /** The visit budget ran out before the tree was exhausted. */
    private boolean truncated;
    @Builder.Default
    private List<Element> elements = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Query {
        private String role;
        private String nameContains;
        private String state;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Element {
        private String ref;
        private String name;
        @Builder.Default
        private boolean enabled = true;
    }

    public String toCompactString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(matchCount).append(' ')
                .append(query != null ? query.getRole() : "element").append('s');
        for (Element element : elements) {
            sb.append("\n  [").append(element.getRef()).append("] \"").append(element.getName()).append('"');
            if (!element.isEnabled()) {
                sb.append(" [disabled]");
            }
        }
        if (truncated) {
            sb.append("\n[Search truncated at ").append(totalSearched).append(" elements]");
        }
        return sb.toString();
    }
}
