package com.phillippitts.n8nsync.service.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowTag;

import java.util.List;
import java.util.Set;

/**
 * Strips instance-specific and volatile fields from workflows.
 *
 * <p>Two forms are produced:
 * <ul>
 *   <li><b>storage</b> - what is written to disk and hashed:
 *       {@code name, nodes, connections, settings, tags, active}</li>
 *   <li><b>push</b> - what is sent to the remote on create/update: the storage form without
 *       {@code active} and {@code tags}, which have their own remote endpoints and must not
 *       be overwritten by a content push</li>
 * </ul>
 *
 * <p>Missing collections default to empty and a missing {@code active} flag defaults to
 * {@code false}, the remote's default for new workflows, so a hand-written file and the
 * remote's echo of it hash identically.
 */
public final class WorkflowNormalizer {

    /** Settings keys that differ between instances or change on every execution. */
    public static final Set<String> VOLATILE_SETTINGS = Set.of(
            "executionUrl",
            "availableInMCP",
            "callerPolicy",
            "saveDataErrorExecution",
            "saveManualExecutions",
            "saveExecutionProgress",
            "executionOrder"
    );

    public Workflow forStorage(Workflow workflow) {
        return new Workflow(
                null,
                workflow.name(),
                orEmptyArray(workflow.nodes()),
                orEmptyObject(workflow.connections()),
                cleanSettings(workflow.settings()),
                cleanTags(workflow.tags()),
                workflow.isActive(),
                null
        );
    }

    public Workflow forPush(Workflow workflow) {
        Workflow storage = forStorage(workflow);
        return new Workflow(null, storage.name(), storage.nodes(), storage.connections(),
                storage.settings(), null, null, null);
    }

    private static ObjectNode cleanSettings(JsonNode settings) {
        ObjectNode copy = JsonNodeFactory.instance.objectNode();
        if (settings != null && settings.isObject()) {
            copy.setAll((ObjectNode) settings.deepCopy());
            copy.remove(VOLATILE_SETTINGS);
        }
        return copy;
    }

    private static List<WorkflowTag> cleanTags(List<WorkflowTag> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream()
                .map(t -> new WorkflowTag(t.id(), t.name()))
                .toList();
    }

    private static JsonNode orEmptyArray(JsonNode node) {
        return node == null || node.isNull() ? JsonNodeFactory.instance.arrayNode() : node.deepCopy();
    }

    private static JsonNode orEmptyObject(JsonNode node) {
        return node == null || node.isNull() ? JsonNodeFactory.instance.objectNode() : node.deepCopy();
    }
}
