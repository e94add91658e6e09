package me.golemcore.runtime.infrastructure.config;

import me.golemcore.runtime.adapter.outbound.llm.ProviderAdapter;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.compaction.TranscriptRenderer;
import me.golemcore.runtime.domain.context.ContextWindowManager;
import me.golemcore.runtime.domain.loop.AgentLoop;
import me.golemcore.runtime.domain.model.PermissionDecision;
import me.golemcore.runtime.domain.model.RetentionConfig;
import me.golemcore.runtime.domain.model.RetentionStrategy;
import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolDescriptor;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.tool.InMemoryToolRegistry;
import me.golemcore.runtime.domain.tool.ToolExecutionContext;
import me.golemcore.runtime.port.outbound.PermissionPort;
import me.golemcore.runtime.port.outbound.ProviderPort;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentRuntimeConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AgentRuntimeConfiguration.class))
            .withPropertyValues("runtime.provider.api-key=test-key");

    @Test
    void shouldWireRuntimeWithDefaults() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertInstanceOf(ProviderAdapter.class, context.getBean(ProviderPort.class));
            assertEquals("anthropic", context.getBean(ProviderPort.class).getProviderId());
            assertNotNull(context.getBean(AgentLoop.class));

            RetentionConfig retention = context.getBean(RetentionConfig.class);
            assertEquals(RetentionStrategy.AUTO_COMPACT, retention.getStrategy());
            assertEquals(170000, context.getBean(ContextWindowManager.class).thresholdTokens());
            assertNotNull(context.getBean(TranscriptRenderer.class));
        });
    }

    @Test
    void shouldBindProviderAndContextProperties() {
        contextRunner
                .withPropertyValues(
                        "runtime.provider.type=openai-compatible",
                        "runtime.provider.model=gpt-4o-mini",
                        "runtime.provider.base-url=http://localhost:8000/v1",
                        "runtime.context.context-length=100000",
                        "runtime.context.strategy=preserve_recent",
                        "runtime.context.preserve-count=12")
                .run(context -> {
                    ProviderPort provider = context.getBean(ProviderPort.class);
                    assertEquals("openai-compatible", provider.getProviderId());
                    assertEquals("gpt-4o-mini", provider.getCurrentModel());

                    RetentionConfig retention = context.getBean(RetentionConfig.class);
                    assertEquals(RetentionStrategy.PRESERVE_RECENT, retention.getStrategy());
                    assertEquals(12, retention.getPreserveCount());
                    assertEquals(85000, context.getBean(ContextWindowManager.class).thresholdTokens());
                });
    }

    @Test
    void shouldRegisterToolBeansAndNestedAgents() {
        contextRunner
                .withUserConfiguration(ToolsConfiguration.class)
                .withPropertyValues(
                        "runtime.agents[0].id=reviewer",
                        "runtime.agents[0].description=Reviews changes",
                        "runtime.agents[0].system-prompt=You review code.")
                .run(context -> {
                    InMemoryToolRegistry registry = context.getBean(InMemoryToolRegistry.class);
                    assertTrue(registry.findTool("clock").isPresent());
                    ToolComponent reviewer = registry.findTool("agent__reviewer").orElseThrow();
                    assertTrue(reviewer.getDescriptor().hasCapability(ToolCapability.AGENT));
                    assertEquals(2, context.getBean(AgentLoop.class).getToolRegistry().listTools().size());
                });
    }

    @Test
    void shouldFailStartupForUnknownProvider() {
        contextRunner
                .withPropertyValues("runtime.provider.type=smoke-signals")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }

    @Test
    void shouldBackOffWhenApplicationDefinesPermissionPolicy() {
        PermissionPort custom = mock(PermissionPort.class);
        contextRunner
                .withBean(PermissionPort.class, () -> custom)
                .run(context -> assertSame(custom, context.getBean(PermissionPort.class)));
    }

    @Test
    void shouldAllowReadOnlyToolsAndAskForOthers() {
        contextRunner
                .withUserConfiguration(ToolsConfiguration.class)
                .run(context -> {
                    PermissionPort permissions = context.getBean(PermissionPort.class);
                    assertEquals(PermissionDecision.ALLOW, permissions.checkPermission("clock", Map.of()));
                    assertEquals(PermissionDecision.ASK, permissions.checkPermission("deploy", Map.of()));
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class ToolsConfiguration {

        @Bean
        ToolComponent clockTool() {
            ToolDescriptor descriptor = ToolDescriptor.builder()
                    .name("clock")
                    .description("Current time")
                    .inputSchema(Map.of("type", "object"))
                    .capability(ToolCapability.READ_ONLY)
                    .build();
            return new ToolComponent() {
                @Override
                public ToolDescriptor getDescriptor() {
                    return descriptor;
                }

                @Override
                public CompletableFuture<ToolResult> execute(Map<String, Object> input,
                        ToolExecutionContext context) {
                    return CompletableFuture.completedFuture(ToolResult.success("12:00"));
                }
            };
        }
    }
}
