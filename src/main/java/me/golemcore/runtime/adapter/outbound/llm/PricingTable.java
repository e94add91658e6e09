package me.golemcore.runtime.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.runtime.infrastructure.config.RuntimeProperties.ModelPricing;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Per-million-token rates used to price each call.
 *
 * <p>
 * Lookup order: exact model name, then the longest key contained in the
 * model name (so {@code claude-haiku} prices
 * {@code claude-haiku-4-5-20251001}), then the backend id. Configured entries
 * override built-in ones with the same key.
 */
public class PricingTable {

    private static final double PER_MILLION = 1_000_000.0;

    private final Map<String, ModelPricing> rates = new LinkedHashMap<>();

    public PricingTable(Map<String, ModelPricing> overrides) {
        rates.put("claude-opus", pricing(15.0, 75.0, 1.5));
        rates.put("claude-sonnet", pricing(3.0, 15.0, 0.3));
        rates.put("claude-haiku", pricing(0.8, 4.0, 0.08));
        rates.put(ProviderAdapterFactory.ANTHROPIC, pricing(3.0, 15.0, 0.3));
        rates.put(ProviderAdapterFactory.OPENAI_COMPATIBLE, pricing(2.0, 2.0, 2.0));
        if (overrides != null) {
            overrides.forEach((key, value) -> rates.put(key.toLowerCase(Locale.ROOT), value));
        }
    }

    public ModelPricing rateFor(String backendId, String model) {
        if (model != null) {
            String normalized = model.toLowerCase(Locale.ROOT);
            ModelPricing exact = rates.get(normalized);
            if (exact != null) {
                return exact;
            }
            String bestKey = null;
            for (String key : rates.keySet()) {
                if (normalized.contains(key) && (bestKey == null || key.length() > bestKey.length())) {
                    bestKey = key;
                }
            }
            if (bestKey != null) {
                return rates.get(bestKey);
            }
        }
        ModelPricing fallback = backendId != null ? rates.get(backendId.toLowerCase(Locale.ROOT)) : null;
        return fallback != null ? fallback : pricing(0, 0, 0);
    }

    public double cost(String backendId, String model, long inputTokens, long outputTokens, long cachedTokens) {
        ModelPricing rate = rateFor(backendId, model);
        return (inputTokens * rate.getInput()
                + outputTokens * rate.getOutput()
                + cachedTokens * rate.getCached()) / PER_MILLION;
    }

    private static ModelPricing pricing(double input, double output, double cached) {
        ModelPricing pricing = new ModelPricing();
        pricing.setInput(input);
        pricing.setOutput(output);
        pricing.setCached(cached);
        return pricing;
    }
}
