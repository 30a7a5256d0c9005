package com.deskclaw.automation.query;

import com.deskclaw.automation.snapshot.Role;
import com.deskclaw.common.config.AutomationDefaults;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Criteria for {@link ElementFinder}. Only {@code role} is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FindQuery {
    private Role role;
    /** Case-insensitive; supports a leading and/or trailing {@code *}. */
    private String nameContains;
    private String nameExact;
    private StateCriterion state;
    @Builder.Default
    private int maxResults = AutomationDefaults.FIND_DEFAULT_MAX_RESULTS;
    /** Visit budget for the walk. */
    @Builder.Default
    private int maxSearch = AutomationDefaults.FIND_MAX_SEARCH;
    @Builder.Default
    private int nameMaxLength = AutomationDefaults.FIND_NAME_MAX_LENGTH;
}
