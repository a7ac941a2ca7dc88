package io.lemma.core;

import io.lemma.core.engine.SourcePosition;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/// Configuration options for a proof session and the engine behind it.
///
/// Use the {@link Builder} for fluent configuration, {@link #fromProperties(Properties)}
/// to read a properties file, or construct directly and use setters.
///
/// ### Default Values
/// - `defaultBudget`: `200000` engine steps per `applyStep` when the request omits one
/// - `engineName`: `null` (highest-priority provider)
/// - `sourcePosition`: `null` (session not attached to a source)
/// - `openNamespaces`: empty
///
/// ### Property Keys
/// - `lemma.budget`
/// - `lemma.engine`
/// - `lemma.position.file`, `lemma.position.line`, `lemma.position.column`
/// - `lemma.namespaces` (comma separated)
///
/// @implNote **Not thread-safe**. Configure before creating the engine and session.
public class LemmaConfig {

    public static final long DEFAULT_BUDGET = 200_000L;

    public static final String BUDGET_KEY = "lemma.budget";
    public static final String ENGINE_KEY = "lemma.engine";
    public static final String POSITION_FILE_KEY = "lemma.position.file";
    public static final String POSITION_LINE_KEY = "lemma.position.line";
    public static final String POSITION_COLUMN_KEY = "lemma.position.column";
    public static final String NAMESPACES_KEY = "lemma.namespaces";

    private long defaultBudget = DEFAULT_BUDGET;
    private String engineName;
    private SourcePosition sourcePosition;
    private List<String> openNamespaces = new ArrayList<>();

    /// Creates a configuration with default values.
    public LemmaConfig() {}

    /// Reads a configuration from properties. Absent keys keep their defaults.
    ///
    /// @param properties source properties, not null
    /// @return new configuration, never null
    /// @throws IllegalArgumentException if a numeric property is malformed
    public static LemmaConfig fromProperties(Properties properties) {
        LemmaConfig config = new LemmaConfig();

        String budget = properties.getProperty(BUDGET_KEY);
        if (budget != null) {
            config.setDefaultBudget(parseLong(BUDGET_KEY, budget));
        }

        config.setEngineName(properties.getProperty(ENGINE_KEY));

        String line = properties.getProperty(POSITION_LINE_KEY);
        if (line != null) {
            String column = properties.getProperty(POSITION_COLUMN_KEY, "0");
            config.setSourcePosition(
                    new SourcePosition(
                            properties.getProperty(POSITION_FILE_KEY),
                            (int) parseLong(POSITION_LINE_KEY, line),
                            (int) parseLong(POSITION_COLUMN_KEY, column)));
        }

        String namespaces = properties.getProperty(NAMESPACES_KEY);
        if (namespaces != null && !namespaces.isBlank()) {
            config.setOpenNamespaces(
                    Arrays.stream(namespaces.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList());
        }
        return config;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Property " + key + " must be a number, was '" + value + "'", e);
        }
    }

    /// Returns the budget used when a step request does not carry one.
    ///
    /// @return engine step budget, `0` for unlimited
    public long getDefaultBudget() {
        return defaultBudget;
    }

    /// Sets the default step budget.
    ///
    /// @param defaultBudget engine step budget, `0` for unlimited, must not be negative
    public void setDefaultBudget(long defaultBudget) {
        if (defaultBudget < 0) {
            throw new IllegalArgumentException("defaultBudget must not be negative");
        }
        this.defaultBudget = defaultBudget;
    }

    /// Returns the name of the engine provider to use.
    ///
    /// @return provider name, or null to select by priority
    public String getEngineName() {
        return engineName;
    }

    public void setEngineName(String engineName) {
        this.engineName = engineName;
    }

    /// Returns the ambient source position reported by the `position` operation.
    ///
    /// @return position, or null when not attached to a source
    public SourcePosition getSourcePosition() {
        return sourcePosition;
    }

    public void setSourcePosition(SourcePosition sourcePosition) {
        this.sourcePosition = sourcePosition;
    }

    /// Returns the namespaces consulted when resolving names.
    ///
    /// @return immutable namespace list, never null
    public List<String> getOpenNamespaces() {
        return List.copyOf(openNamespaces);
    }

    public void setOpenNamespaces(List<String> openNamespaces) {
        this.openNamespaces = new ArrayList<>(openNamespaces);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link LemmaConfig}.
    public static class Builder {
        private final LemmaConfig config = new LemmaConfig();

        public Builder defaultBudget(long defaultBudget) {
            config.setDefaultBudget(defaultBudget);
            return this;
        }

        public Builder engineName(String engineName) {
            config.engineName = engineName;
            return this;
        }

        public Builder sourcePosition(SourcePosition sourcePosition) {
            config.sourcePosition = sourcePosition;
            return this;
        }

        public Builder openNamespaces(List<String> openNamespaces) {
            config.setOpenNamespaces(openNamespaces);
            return this;
        }

        public LemmaConfig build() {
            return config;
        }
    }
}
