package com.tonelparser.json;

import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for the Smalltalk AST. Implementations are
 * registered through {@link ServiceLoader}; putting {@code tonel-parser-jackson}
 * on the classpath makes the Jackson binding available.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(Parser.parse("^ x + 1"));
 * Sequence tree = provider.getDeserializer().deserializeSequence(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /** Short provider name, matched case-insensitively by {@link #getProvider(String)}. */
    String getName();

    /**
     * First provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : load()) {
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add tonel-parser-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Provider with the given name.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : load()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "' found on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        return load().iterator().hasNext();
    }

    private static ServiceLoader<AstJsonProvider> load() {
        return ServiceLoader.load(AstJsonProvider.class);
    }
}
