package com.phillippitts.n8nsync.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A workflow document, either as returned by the remote API or as stored in a local file.
 *
 * <p>Graph content ({@code nodes}, {@code connections}, {@code settings}) is kept as raw JSON
 * trees so that fields this service does not know about survive a round trip unchanged.
 * Null components are omitted when serialized, which is how the normalizer drops fields
 * from the storage and push forms.
 *
 * @param id remote workflow id, null for a workflow that has never been pushed
 * @param name display name, also the source of the local filename
 * @param nodes node list (order is significant)
 * @param connections connection graph keyed by source node name
 * @param settings workflow settings object
 * @param tags attached tags
 * @param active whether the workflow is active on the remote instance
 * @param updatedAt remote last-modified timestamp as sent by the server
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "name", "nodes", "connections", "settings", "tags", "active", "updatedAt"})
public record Workflow(
        String id,
        String name,
        JsonNode nodes,
        JsonNode connections,
        JsonNode settings,
        List<WorkflowTag> tags,
        Boolean active,
        String updatedAt
) {

    public Workflow withId(String newId) {
        return new Workflow(newId, name, nodes, connections, settings, tags, active, updatedAt);
    }

    public Workflow withName(String newName) {
        return new Workflow(id, newName, nodes, connections, settings, tags, active, updatedAt);
    }

    public Workflow withActive(boolean newActive) {
        return new Workflow(id, name, nodes, connections, settings, tags, newActive, updatedAt);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }
}
