package com.statecore.engine.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.statecore.core.model.EntityKey;
import com.statecore.core.model.EntityType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheDependencyTableTest {

    private static final EntityKey T1 = EntityKey.of(EntityType.TASK, "T1");

    private static ObjectNode json() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Test
    void parse_readsSourceFieldAndTarget() {
        DependencyRule rule = DependencyRule.parse("task.assigned_agent->agent");

        assertThat(rule.source()).isEqualTo(EntityType.TASK);
        assertThat(rule.field()).isEqualTo("assigned_agent");
        assertThat(rule.target()).isEqualTo(EntityType.AGENT);
        assertThat(rule).hasToString("task.assigned_agent->agent");
    }

    @Test
    void parse_rejectsMalformedRule() {
        assertThatThrownBy(() -> DependencyRule.parse("task->agent")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dependentsOf_coversReferencesBeforeAndAfterTheChange() {
        CacheDependencyTable table = CacheDependencyTable.defaults();

        ObjectNode before = json().put("workflow_id", "W1").put("assigned_agent", "A1");
        ObjectNode after = json().put("workflow_id", "W1").put("assigned_agent", "A2");

        assertThat(table.dependentsOf(T1, before, after)).containsExactlyInAnyOrder(
            EntityKey.of(EntityType.WORKFLOW, "W1"),
            EntityKey.of(EntityType.AGENT, "A1"),
            EntityKey.of(EntityType.AGENT, "A2"));
    }

    @Test
    void dependentsOf_followsArrayReferences() {
        CacheDependencyTable table = new CacheDependencyTable(List.of(DependencyRule.parse("resource.allocated_to->agent")));
        ObjectNode after = json();
        after.putArray("allocated_to").add("A1").add("A2");

        assertThat(table.dependentsOf(EntityKey.of(EntityType.RESOURCE, "R1"), null, after))
            .containsExactlyInAnyOrder(EntityKey.of(EntityType.AGENT, "A1"), EntityKey.of(EntityType.AGENT, "A2"));
    }

    @Test
    void dependentsOf_ignoresOtherTypesAndMissingFields() {
        CacheDependencyTable table = CacheDependencyTable.defaults();

        assertThat(table.dependentsOf(EntityKey.of(EntityType.AGENT, "A1"), null, json().put("workflow_id", "W1")))
            .isEmpty();
        assertThat(table.dependentsOf(T1, null, json().putNull("workflow_id"))).isEmpty();
        assertThat(CacheDependencyTable.empty().dependentsOf(T1, null, json().put("workflow_id", "W1"))).isEmpty();
    }
}
