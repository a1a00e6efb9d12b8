package org.agenticscript.runtime.stdlib;

import org.agenticscript.runtime.bus.Mailbox;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.Value;
import org.agenticscript.runtime.tools.ToolContext;
import org.agenticscript.runtime.tools.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class AgentRoutingToolTest {

    private final AgentRoutingTool routing = new AgentRoutingTool();
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new MessageBus(100);
        bus.register("coordinator_001", new Mailbox());
        bus.register("researcher_002", new Mailbox());
        bus.register("writer_003", new Mailbox());
    }

    @Test
    void routesToEveryBoundTarget() {
        ToolContext context = new ToolContext("coordinator_001", List.of("researcher_002", "writer_003"), bus);

        Value result = routing.execute(context, List.of(Value.of("start")));

        List<Message> sent = bus.recentMessages(10);
        assertThat(sent).extracting(Message::getRecipientId).containsExactly("researcher_002", "writer_003");
        assertThat(sent).extracting(Message::getSenderId).containsOnly("coordinator_001");
        assertThat(result.display())
                .startsWith("Message routed to researcher_002 (")
                .contains("writer_003 (");
        assertThat(bus.pendingCount("researcher_002")).isEqualTo(1);
    }

    @Test
    void routesToSelectedTargetByNamePrefix() {
        ToolContext context = new ToolContext("coordinator_001", List.of("researcher_002", "writer_003"), bus);

        routing.execute(context, List.of(Value.of("draft"), Value.of("writer")));

        assertThat(bus.pendingCount("writer_003")).isEqualTo(1);
        assertThat(bus.pendingCount("researcher_002")).isZero();
    }

    @Test
    void rejectsTargetOutsideBinding() {
        ToolContext context = new ToolContext("coordinator_001", List.of("researcher_002"), bus);

        assertThatThrownBy(() -> routing.execute(context, List.of(Value.of("x"), Value.of("writer"))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Agent 'writer' is not a routing target of coordinator_001");
        assertThat(bus.pendingCount("writer_003")).isZero();
    }

    @Test
    void requiresBoundTargets() {
        ToolContext context = new ToolContext("coordinator_001", List.of(), bus);

        assertThatThrownBy(() -> routing.execute(context, List.of(Value.of("x"))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessage("AgentRouting has no target agents bound for coordinator_001");
    }

    @Test
    void unregisteredTargetFailsTheCall() {
        ToolContext context = new ToolContext("coordinator_001", List.of("gone_009"), bus);

        assertThatThrownBy(() -> routing.execute(context, List.of(Value.of("x"))))
                .isInstanceOf(ToolExecutionException.class)
                .hasMessageStartingWith("Routing failed: ");
    }
}
