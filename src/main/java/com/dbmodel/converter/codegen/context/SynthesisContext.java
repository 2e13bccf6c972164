package com.dbmodel.converter.codegen.context;

import com.dbmodel.converter.codegen.ConverterConfig;
import lombok.Getter;
import lombok.NonNull;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one synthesis run: the destination document, the names already taken by
 * enums and domains, and the elements held back until every table exists.
 *
 * Deferred elements are appended by the orchestrator in a fixed order: relationships,
 * indexes, timestamp functions, timestamp triggers, then source triggers.
 */
@Getter
public final class SynthesisContext {

    @NonNull
    private final ConverterConfig config;

    @NonNull
    private final Document document;

    @NonNull
    private final Element root;

    private final ConversionDiagnostics diagnostics = new ConversionDiagnostics();

    private final Set<String> enumNames = new LinkedHashSet<>();
    private final Set<String> domainNames = new LinkedHashSet<>();

    private final List<Element> relationships = new ArrayList<>();
    private final List<Element> indexes = new ArrayList<>();
    private final Map<String, Element> timestampFunctions = new LinkedHashMap<>();
    private final List<Element> timestampTriggers = new ArrayList<>();
    private final List<Element> sourceTriggers = new ArrayList<>();

    private int columnCount;

    public SynthesisContext(@NonNull ConverterConfig config, @NonNull Document document, @NonNull Element root) {
        this.config = config;
        this.document = document;
        this.root = root;
    }

    public void countColumn() {
        columnCount++;
    }

    public SynthesisStats toStats(int tableCount) {
        return SynthesisStats.builder()
                .tableCount(tableCount)
                .columnCount(columnCount)
                .relationshipCount(relationships.size())
                .indexCount(indexes.size())
                .domainCount(domainNames.size())
                .enumCount(enumNames.size())
                .triggerCount(timestampTriggers.size() + sourceTriggers.size())
                .build();
    }
}
