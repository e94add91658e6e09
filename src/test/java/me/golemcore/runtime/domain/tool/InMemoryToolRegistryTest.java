package me.golemcore.runtime.domain.tool;

import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.port.outbound.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryToolRegistryTest {

    @Test
    void shouldListToolsInRegistrationOrder() {
        InMemoryToolRegistry registry = new InMemoryToolRegistry(List.of(
                TestTools.echo("Read", ToolCapability.READ_ONLY, ""),
                TestTools.echo("Bash", ToolCapability.MUTATING, "")));
        registry.registerTool(TestTools.echo("Grep", ToolCapability.READ_ONLY, ""));

        assertEquals(List.of("Read", "Bash", "Grep"), names(registry));
        assertTrue(registry.findTool("Bash").isPresent());
        assertTrue(registry.findTool(null).isEmpty());
    }

    @Test
    void shouldReplaceToolWithSameNameInPlace() {
        InMemoryToolRegistry registry = new InMemoryToolRegistry(null);
        registry.registerTool(TestTools.echo("Read", ToolCapability.READ_ONLY, "v1"));
        registry.registerTool(TestTools.echo("Bash", ToolCapability.MUTATING, ""));
        TestTools.RecordingTool replacement = TestTools.echo("Read", ToolCapability.READ_ONLY, "v2");
        registry.registerTool(replacement);

        assertEquals(List.of("Read", "Bash"), names(registry));
        assertSame(replacement, registry.findTool("Read").orElseThrow());
    }

    @Test
    void shouldUnregisterTools() {
        InMemoryToolRegistry registry = new InMemoryToolRegistry(List.of(
                TestTools.echo("Read", ToolCapability.READ_ONLY, ""),
                TestTools.echo("Bash", ToolCapability.MUTATING, "")));

        registry.unregisterTools(List.of("Bash"));

        assertEquals(List.of("Read"), names(registry));
        assertTrue(registry.findTool("Bash").isEmpty());
    }

    @Test
    void shouldExcludeCapabilityInLiveView() {
        InMemoryToolRegistry registry = new InMemoryToolRegistry(List.of(
                TestTools.echo("Read", ToolCapability.READ_ONLY, "")));
        ToolRegistry view = registry.excluding(ToolCapability.AGENT);

        registry.registerTool(TestTools.echo("agent__helper", ToolCapability.AGENT, ""));
        registry.registerTool(TestTools.echo("Bash", ToolCapability.MUTATING, ""));

        assertEquals(List.of("Read", "Bash"), names(view));
        assertTrue(view.findTool("agent__helper").isEmpty());
        assertTrue(registry.findTool("agent__helper").isPresent());
    }

    private static List<String> names(ToolRegistry registry) {
        return registry.listTools().stream().map(ToolDescriptor::getName).toList();
    }
}
