package com.phillippitts.n8nsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Tag attached to a workflow on the remote instance.
 *
 * <p>Only the identifying fields are kept; the remote's tag timestamps change independently
 * of the workflow and are not part of its content.
 *
 * @param id remote tag id (may be null for tags written by hand)
 * @param name tag name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowTag(String id, String name) {
}
