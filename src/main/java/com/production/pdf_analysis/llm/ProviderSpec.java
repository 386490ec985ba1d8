package com.production.pdf_analysis.llm;

/**
 * Static description of a provider. The order of specs in the router is the failover order.
 *
 * @param usesDirectClient {@code true} when the provider is called through its own HTTP
 *                         client rather than an OpenAI-compatible endpoint
 */
public record ProviderSpec(String name, String model, String baseUrl, String credential, boolean usesDirectClient) {

    @Override
    public String toString() {
        return "ProviderSpec[name=" + name + ", model=" + model + ", baseUrl=" + baseUrl
                + ", usesDirectClient=" + usesDirectClient + "]";
    }
}
