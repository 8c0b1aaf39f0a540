package com.goparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for generic tree JSON serialization and deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * GenericJsonProvider provider = GenericJsonProvider.getProvider();
 * String json = provider.getSerializer().render(NodeDispatcher.classify(file));
 * GenericNode tree = provider.getDeserializer().deserialize(json);
 * }</pre>
 */
public interface GenericJsonProvider {

    GenericTreeSerializer getSerializer();

    GenericTreeDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available provider via ServiceLoader.
     *
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static GenericJsonProvider getProvider() {
        ServiceLoader<GenericJsonProvider> loader = ServiceLoader.load(GenericJsonProvider.class);
        Iterator<GenericJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No GenericJsonProvider found on the classpath. " +
            "Add gotree-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets a provider by name via ServiceLoader.
     *
     * @throws IllegalStateException if no matching provider is found
     */
    static GenericJsonProvider getProvider(String name) {
        ServiceLoader<GenericJsonProvider> loader = ServiceLoader.load(GenericJsonProvider.class);
        for (GenericJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No GenericJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<GenericJsonProvider> loader = ServiceLoader.load(GenericJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
