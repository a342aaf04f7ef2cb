package com.phillippitts.n8nsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Lightweight listing entry used by remote polling. Full content is fetched only when
 * {@code updatedAt} changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowSummary(
        String id,
        String name,
        boolean active,
        List<WorkflowTag> tags,
        String updatedAt
) {

    public WorkflowSummary {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
