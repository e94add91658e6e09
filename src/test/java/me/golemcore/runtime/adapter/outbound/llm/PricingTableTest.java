package me.golemcore.runtime.adapter.outbound.llm;

import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PricingTableTest {

    private static final double EPSILON = 1e-9;

    @Test
    void shouldPriceByModelFamily() {
        PricingTable table = new PricingTable(Map.of());

        assertEquals(3.0, table.rateFor("anthropic", "claude-sonnet-4-20250514").getInput(), EPSILON);
        assertEquals(4.0, table.rateFor("anthropic", "claude-haiku-4-5-20251001").getOutput(), EPSILON);
        assertEquals(75.0, table.rateFor("anthropic", "claude-opus-4-1").getOutput(), EPSILON);
    }

    @Test
    void shouldFallBackToBackendProfile() {
        PricingTable table = new PricingTable(null);

        assertEquals(2.0, table.rateFor("openai-compatible", "llama-3.1-70b").getInput(), EPSILON);
        assertEquals(0.0, table.rateFor("unknown", "mystery").getInput(), EPSILON);
    }

    @Test
    void shouldComputeCostPerMillionTokens() {
        PricingTable table = new PricingTable(Map.of());

        double cost = table.cost("anthropic", "claude-sonnet-4", 1_000_000, 100_000, 500_000);

        assertEquals(3.0 + 1.5 + 0.15, cost, EPSILON);
    }

    @Test
    void shouldPreferConfiguredAndLongerKeys() {
        RuntimeProperties.ModelPricing custom = new RuntimeProperties.ModelPricing();
        custom.setInput(1.0);
        custom.setOutput(5.0);
        PricingTable table = new PricingTable(Map.of("Claude-Haiku-4-5", custom));

        assertEquals(1.0, table.rateFor("anthropic", "claude-haiku-4-5-20251001").getInput(), EPSILON);
        assertEquals(0.8, table.rateFor("anthropic", "claude-haiku-3").getInput(), EPSILON);
        assertEquals(5.0, table.rateFor("anthropic", "CLAUDE-HAIKU-4-5").getOutput(), EPSILON);
    }
}
