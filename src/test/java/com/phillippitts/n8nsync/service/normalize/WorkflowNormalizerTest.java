package com.phillippitts.n8nsync.service.normalize;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.phillippitts.n8nsync.domain.Workflow;
import com.phillippitts.n8nsync.domain.WorkflowTag;
import com.phillippitts.n8nsync.service.hash.CanonicalHasher;
import com.phillippitts.n8nsync.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.phillippitts.n8nsync.testutil.WorkflowFixtures.withTags;
import static com.phillippitts.n8nsync.testutil.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;

class WorkflowNormalizerTest {

    private final WorkflowNormalizer normalizer = new WorkflowNormalizer();
    private final CanonicalHasher hasher = new CanonicalHasher(Jsons.newMapper());

    @Test
    void storageFormDropsIdentityAndVolatileSettings() {
        Workflow remote = new Workflow("wf-1", "Orders", workflow("Orders", "v0").nodes(),
                workflow("Orders", "v0").connections(), workflow("Orders", "v0").settings(),
                List.of(new WorkflowTag("t1", "prod")), true, "2024-01-01T00:00:00Z");

        Workflow storage = normalizer.forStorage(remote);

        assertThat(storage.id()).isNull();
        assertThat(storage.updatedAt()).isNull();
        assertThat(storage.active()).isTrue();
        assertThat(storage.tags()).extracting(WorkflowTag::name).containsExactly("prod");
        assertThat(storage.settings().has("timezone")).isTrue();
        for (String key : WorkflowNormalizer.VOLATILE_SETTINGS) {
            assertThat(storage.settings().has(key)).as(key).isFalse();
        }
    }

    @Test
    void missingCollectionsDefaultToEmpty() {
        Workflow bare = new Workflow(null, "Bare", null, null, null, null, null, null);

        Workflow storage = normalizer.forStorage(bare);

        assertThat(storage.nodes().isArray()).isTrue();
        assertThat(storage.connections().isObject()).isTrue();
        assertThat(storage.settings().isObject()).isTrue();
        assertThat(storage.tags()).isEmpty();
        assertThat(storage.active()).isFalse();
    }

    @Test
    void pushFormOmitsActiveAndTags() {
        Workflow push = normalizer.forPush(withTags(workflow("wf-1", "Orders", "v0"), "prod").withActive(true));

        assertThat(push.id()).isNull();
        assertThat(push.active()).isNull();
        assertThat(push.tags()).isNull();
        assertThat(push.name()).isEqualTo("Orders");
    }

    @Test
    void doesNotMutateInput() {
        Workflow original = workflow("Orders", "v0");
        String settingsBefore = original.settings().toString();

        normalizer.forStorage(original);

        assertThat(original.settings().toString()).isEqualTo(settingsBefore);
    }

    @Test
    void isIdempotent() {
        Workflow once = normalizer.forStorage(workflow("wf-1", "Orders", "v0"));
        assertThat(normalizer.forStorage(once)).isEqualTo(once);
    }

    @Test
    void pushPayloadHashesLikeStorageFormForDefaultFlags() {
        Workflow local = normalizer.forStorage(workflow("Orders", "v0"));

        Workflow echoed = normalizer.forStorage(normalizer.forPush(local));

        assertThat(hasher.hash(echoed)).isEqualTo(hasher.hash(local));
    }

    @Test
    void nonObjectSettingsBecomeEmpty() {
        Workflow w = new Workflow(null, "X", null, null, JsonNodeFactory.instance.textNode("oops"), null, null, null);

        assertThat(normalizer.forStorage(w).settings().size()).isZero();
    }
}
