package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.compaction.CompactionPipeline;
import me.golemcore.runtime.domain.compaction.TranscriptRenderer;
import me.golemcore.runtime.domain.context.ContextWindowManager;
import me.golemcore.runtime.domain.context.TokenAccountant;
import me.golemcore.runtime.domain.model.CancellationToken;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.PermissionDecision;
import me.golemcore.runtime.domain.model.ProviderError;
import me.golemcore.runtime.domain.model.ProviderException;
import me.golemcore.runtime.domain.model.ProviderRequest;
import me.golemcore.runtime.domain.model.ProviderUsage;
import me.golemcore.runtime.domain.model.RetentionStrategy;
import me.golemcore.runtime.domain.model.StopReason;
import me.golemcore.runtime.domain.model.TextBlock;
import me.golemcore.runtime.domain.model.ToolCapability;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ToolUseBlock;
import me.golemcore.runtime.domain.tool.InMemoryToolRegistry;
import me.golemcore.runtime.domain.tool.MatchingToolHooks;
import me.golemcore.runtime.domain.tool.TestTools;
import me.golemcore.runtime.domain.tool.ToolExecutionContext;
import me.golemcore.runtime.domain.tool.ToolExecutor;
import me.golemcore.runtime.domain.tool.ToolOutputLimiter;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.ApprovalPort;
import me.golemcore.runtime.port.outbound.PermissionPort;
import me.golemcore.runtime.port.outbound.ProviderPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SubAgentToolTest {

    private ProviderPort providerPort;
    private InMemoryToolRegistry registry;
    private AgentLoop parentLoop;
    private SubAgentTool reviewer;

    @BeforeEach
    void setUp() {
        providerPort = mock(ProviderPort.class);
        registry = new InMemoryToolRegistry(List.of());
        registry.registerTool(TestTools.echo("bash", ToolCapability.MUTATING, "src/\npom.xml"));

        PermissionPort permissionPort = mock(PermissionPort.class);
        when(permissionPort.checkPermission(anyString(), anyMap())).thenReturn(PermissionDecision.ALLOW);
        ToolExecutor executor = new ToolExecutor(registry, permissionPort, mock(ApprovalPort.class),
                new MatchingToolHooks(), new ToolOutputLimiter(10000, Map.of(), 4.0), Duration.ofSeconds(5));
        ContextWindowManager windowManager = new ContextWindowManager(200000, 0.85, 3, 150);
        TokenAccountant accountant = new TokenAccountant();
        CompactionPipeline pipeline = new CompactionPipeline(providerPort, accountant, windowManager,
                new TranscriptRenderer(new ObjectMapper(), 2000, 400000),
                new RuntimeProperties.CompactionProperties(), Clock.systemUTC());
        parentLoop = new AgentLoop(providerPort, executor, windowManager, pipeline, accountant,
                new ImagePayloadCompactor(0), windowManager.retentionFor(RetentionStrategy.AUTO_COMPACT, 0), 20,
                Clock.systemUTC());

        reviewer = new SubAgentTool("reviewer", "Reviews changes", "You review code.", parentLoop, Runnable::run);
        registry.registerTool(reviewer);
    }

    @Test
    void shouldDescribeItselfAsAgentTool() {
        assertEquals("agent__reviewer", reviewer.getDescriptor().getName());
        assertEquals("Reviews changes", reviewer.getDescriptor().getDescription());
        assertTrue(reviewer.getDescriptor().hasCapability(ToolCapability.AGENT));
        assertEquals(List.of("prompt"), reviewer.getDescriptor().getInputSchema().get("required"));
        assertEquals("reviewer", reviewer.getAgentId());
    }

    @Test
    void shouldRejectInvalidAgentId() {
        assertThrows(IllegalArgumentException.class,
                () -> new SubAgentTool("bad id!", "desc", "prompt", parentLoop, Runnable::run));
        assertThrows(IllegalArgumentException.class,
                () -> new SubAgentTool(null, "desc", "prompt", parentLoop, Runnable::run));
    }

    @Test
    void shouldReturnFinalAnswerOfNestedRun() {
        when(providerPort.chat(any())).thenReturn(reply(text("Looks good to me.")));
        ArgumentCaptor<ProviderRequest> captor = ArgumentCaptor.forClass(ProviderRequest.class);

        ToolResult result = reviewer.execute(Map.of("prompt", "Review the diff"), context(null)).join();

        assertTrue(result.isSuccess());
        assertEquals("Looks good to me.", result.getOutput());
        verify(providerPort).chat(captor.capture());
        ProviderRequest sent = captor.getValue();
        assertEquals("You review code.", sent.getSystemPrompt());
        assertEquals(1, sent.getMessages().size());
        assertEquals("Review the diff", sent.getMessages().get(0).text());
    }

    @Test
    void shouldNotExposeAgentToolsToNestedRun() {
        when(providerPort.chat(any())).thenReturn(reply(text("done")));
        ArgumentCaptor<ProviderRequest> captor = ArgumentCaptor.forClass(ProviderRequest.class);

        reviewer.execute(Map.of("prompt", "check"), context(null)).join();

        verify(providerPort).chat(captor.capture());
        assertEquals(List.of("bash"), captor.getValue().getTools().stream().map(tool -> tool.getName()).toList());
        assertEquals(2, parentLoop.getToolRegistry().listTools().size());
    }

    @Test
    void shouldReportNestedToolCallsAsProgress() {
        when(providerPort.chat(any())).thenReturn(
                reply(Message.assistant(List.of(new ToolUseBlock("n1", "bash", Map.of("command", "ls"))),
                        ProviderUsage.EMPTY, StopReason.TOOL_USE)),
                reply(text("Two entries")));
        List<String> progress = new CopyOnWriteArrayList<>();

        ToolResult result = reviewer.execute(Map.of("prompt", "look around"), context(progress::add)).join();

        assertEquals("Two entries", result.getOutput());
        assertEquals(List.of("[reviewer] bash"), progress);
    }

    @Test
    void shouldMapNestedFailureToErrorResult() {
        when(providerPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new ProviderException(
                ProviderError.permanentError("provider.invalid_request", 400, "bad request"), 1, null)));

        ToolResult result = reviewer.execute(Map.of("prompt", "review"), context(null)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().startsWith("Agent reviewer failed:"));
    }

    @Test
    void shouldFailWithoutPrompt() {
        ToolResult result = reviewer.execute(Map.of("prompt", "  "), context(null)).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_INPUT, result.getFailureKind());
        verifyNoInteractions(providerPort);
    }

    @Test
    void shouldPropagateCancellation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        ToolExecutionContext context = new ToolExecutionContext("t1", "agent__reviewer", token, null);

        CompletableFuture<ToolResult> future = reviewer.execute(Map.of("prompt", "review"), context);

        CompletionException exception = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(CancellationException.class, exception.getCause());
        verifyNoInteractions(providerPort);
    }

    private static ToolExecutionContext context(Consumer<String> progress) {
        return new ToolExecutionContext("t1", "agent__reviewer", CancellationToken.create(), progress);
    }

    private static Message text(String text) {
        return Message.assistant(List.of(new TextBlock(text)), ProviderUsage.EMPTY, StopReason.END_TURN);
    }

    private static CompletableFuture<Message> reply(Message message) {
        return CompletableFuture.completedFuture(message);
    }
}
