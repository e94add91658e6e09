package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProviderAdapterFactoryTest {

    private RuntimeProperties properties;
    private ProviderAdapterFactory factory;

    @BeforeEach
    void setUp() {
        properties = new RuntimeProperties();
        properties.getProvider().setApiKey("test-key");
        factory = new ProviderAdapterFactory(properties, new ObjectMapper(), mock(FeignClientFactory.class),
                Runnable::run, Clock.systemUTC());
    }

    @Test
    void shouldDefaultToAnthropic() {
        ProviderBackend backend = factory.createBackend();

        assertInstanceOf(AnthropicBackend.class, backend);
        assertEquals(0, factory.minRequestIntervalMs(backend));
    }

    @Test
    void shouldCreateOpenAiCompatibleBackendWithPacing() {
        properties.getProvider().setType("OpenAI-Compatible");
        properties.getProvider().setModel("gpt-4o-mini");

        ProviderBackend backend = factory.createBackend();

        assertInstanceOf(OpenAiCompatibleBackend.class, backend);
        assertEquals(1000, factory.minRequestIntervalMs(backend));
    }

    @Test
    void shouldAcceptOpenAiAliases() {
        properties.getProvider().setType("custom");

        assertInstanceOf(OpenAiCompatibleBackend.class, factory.createBackend());
    }

    @Test
    void shouldPreferConfiguredPacingInterval() {
        properties.getProvider().setType("openai-compatible");
        properties.getProvider().setMinRequestIntervalMs(250L);

        assertEquals(250, factory.minRequestIntervalMs(factory.createBackend()));
    }

    @Test
    void shouldRejectUnknownProviderType() {
        properties.getProvider().setType("carrier-pigeon");

        IllegalStateException exception = assertThrows(IllegalStateException.class, factory::createBackend);
        assertTrue(exception.getMessage().contains("carrier-pigeon"));
    }

    @Test
    void shouldWrapBackendInAdapter() {
        ProviderAdapter adapter = factory.create();

        assertEquals("anthropic", adapter.getProviderId());
        assertEquals("claude-sonnet-4-20250514", adapter.getCurrentModel());
    }
}
