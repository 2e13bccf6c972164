package com.dbmodel.converter.mapping;

import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed trigger configuration: sections of key/value entries. The {@code [Triggers]}
 * section maps trigger names to fully-qualified function signatures.
 */
@Getter
public class TriggerConfig {
    public static final String TRIGGERS_SECTION = "Triggers";

    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    public void put(String section, String key, String value) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>())
                .put(key.toLowerCase(Locale.ROOT), value);
    }

    public void addSection(String section) {
        sections.computeIfAbsent(section, s -> new LinkedHashMap<>());
    }

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasTriggersSection() {
        return sections.containsKey(TRIGGERS_SECTION);
    }

    /**
     * Function signature to call from the named trigger. Names match case-insensitively.
     */
    public Optional<String> getFunctionForTrigger(String triggerName) {
        Map<String, String> triggers = sections.get(TRIGGERS_SECTION);
        if (triggers == null || triggerName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(triggers.get(triggerName.toLowerCase(Locale.ROOT)));
    }

    public int size() {
        Map<String, String> triggers = sections.get(TRIGGERS_SECTION);
        return triggers == null ? 0 : triggers.size();
    }
}
