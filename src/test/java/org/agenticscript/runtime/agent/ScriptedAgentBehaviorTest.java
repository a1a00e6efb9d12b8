package org.agenticscript.runtime.agent;

import org.agenticscript.runtime.bus.Mailbox;
import org.agenticscript.runtime.bus.Message;
import org.agenticscript.runtime.bus.MessageBus;
import org.agenticscript.runtime.model.AgentStatus;
import org.agenticscript.runtime.model.Value;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the keyword rules of {@link ScriptedAgentBehavior}.
 */
@Tag("unit")
class ScriptedAgentBehaviorTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "HELLO world          | Hello from scout!",
            "what is your status? | Agent scout status: active",
            "an Error occurred    | Error handling: an Error occurred",
            "are you busy         | scout was busy but processed: are you busy",
            "hello, status?       | Hello from scout!",
            "summarize this       | scout (local/llama-3) received: summarize this"
    })
    void repliesByKeyword(String question, String expected) {
        // Arrange
        Agent agent = new Agent("scout_001", "scout", AgentKind.BASIC, "local/llama-3", 10);
        MessageBus bus = new MessageBus(10);
        bus.register(agent.getId(), new Mailbox());
        Message ask = bus.tell(MessageBus.SYSTEM_SENDER, agent.getId(), Value.of(question));

        // Act
        Value reply = new ScriptedAgentBehavior().onAsk(agent, ask, AgentStatus.ACTIVE);

        // Assert
        assertThat(reply).isEqualTo(Value.of(expected));
    }
}
