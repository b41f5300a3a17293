package org.cnext.compiler.frontend.headers;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping foreign header languages to their collectors.
 */
public final class HeaderCollectorRegistry {

    private final Map<SourceLanguage, IHeaderCollector> collectors = new EnumMap<>(SourceLanguage.class);

    /**
     * Registers the collector for a language.
     *
     * @param language  The header language.
     * @param collector The collector instance.
     */
    public void register(SourceLanguage language, IHeaderCollector collector) {
        collectors.put(language, collector);
    }

    /**
     * Resolves the collector for a language.
     *
     * @param language The header language.
     * @return Optional collector if registered.
     */
    public Optional<IHeaderCollector> resolve(SourceLanguage language) {
        return Optional.ofNullable(collectors.get(language));
    }

    /**
     * Creates a registry with the C and C++ grammars.
     */
    public static HeaderCollectorRegistry initializeWithDefaults() {
        HeaderCollectorRegistry registry = new HeaderCollectorRegistry();
        registry.register(SourceLanguage.C, new CHeaderCollector());
        registry.register(SourceLanguage.CPP, new CppHeaderCollector());
        return registry;
    }
}
