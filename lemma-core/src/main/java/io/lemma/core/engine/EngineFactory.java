package io.lemma.core.engine;

import io.lemma.core.LemmaConfig;
import io.lemma.core.engine.spi.EngineProvider;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Creates engines using discovered {@link EngineProvider}s.
///
/// Providers are loaded with {@link ServiceLoader} unless given explicitly. Selection
/// uses {@link LemmaConfig#getEngineName()} when set, otherwise the highest-priority
/// provider.
///
/// @implNote Thread-safe after construction. The provider list is immutable.
public class EngineFactory {

    private static final Logger logger = Logger.getLogger(EngineFactory.class.getName());

    private final List<EngineProvider> providers;

    /// Creates a factory from providers discovered on the class path.
    public EngineFactory() {
        this(loadProviders());
    }

    /// Creates a factory from an explicit provider list.
    ///
    /// @param providers available providers, not null
    public EngineFactory(List<EngineProvider> providers) {
        this.providers = List.copyOf(providers);
        logger.fine(
                "Loaded "
                        + this.providers.size()
                        + " engine providers: "
                        + this.providers.stream().map(EngineProvider::getName).toList());
    }

    /// Creates an engine for the given configuration.
    ///
    /// @param config session configuration, not null
    /// @return the created engine, never null
    /// @throws IllegalStateException if no provider matches
    public ProofEngine createEngine(LemmaConfig config) {
        EngineProvider provider = selectProvider(config.getEngineName());
        logger.info("Creating engine with provider: " + provider.getName());
        return provider.createEngine(config);
    }

    private EngineProvider selectProvider(String engineName) {
        if (engineName != null && !engineName.isBlank()) {
            return providers.stream()
                    .filter(p -> p.getName().equals(engineName))
                    .findFirst()
                    .orElseThrow(
                            () ->
                                    new IllegalStateException(
                                            "No engine provider named '"
                                                    + engineName
                                                    + "'. Available providers: "
                                                    + providerNames()));
        }
        return providers.stream()
                .max(Comparator.comparingInt(EngineProvider::getPriority))
                .orElseThrow(() -> new IllegalStateException("No engine providers available"));
    }

    private List<String> providerNames() {
        return providers.stream().map(EngineProvider::getName).toList();
    }

    private static List<EngineProvider> loadProviders() {
        List<EngineProvider> discovered = new ArrayList<>();
        for (EngineProvider provider : ServiceLoader.load(EngineProvider.class)) {
            discovered.add(provider);
        }
        return discovered;
    }

    /// Returns an unmodifiable view of all loaded providers.
    ///
    /// @return providers, never null
    public List<EngineProvider> getProviders() {
        return Collections.unmodifiableList(providers);
    }
}
