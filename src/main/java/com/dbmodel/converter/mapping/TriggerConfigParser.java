package com.dbmodel.converter.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for trigger configuration files.
 *
 * Format:
 * - Section: [Triggers]
 * - Entry:   orders_before_insert = public.orders_before_insert()
 * - Entry:   orders_after_update: public.audit_update()
 * - Comments: # comment, ; comment
 */
public class TriggerConfigParser {
    private static final Logger log = LoggerFactory.getLogger(TriggerConfigParser.class);

    private static final Pattern SECTION_PATTERN = Pattern.compile("^\\[([^\\]]+)]$");

    // Key ends at the first '=' or ':'; signatures may contain both later on
    private static final Pattern ENTRY_PATTERN = Pattern.compile("^([^=:]+?)\\s*[=:]\\s*(.*)$");

    public TriggerConfig parse(Path configFile) throws IOException {
        List<String> lines = Files.readAllLines(configFile, StandardCharsets.UTF_8);
        TriggerConfig config = parse(lines);
        if (!config.hasTriggersSection()) {
            log.warn("Trigger configuration {} has no [{}] section, no trigger will be converted",
                    configFile, TriggerConfig.TRIGGERS_SECTION);
        }
        return config;
    }

    public TriggerConfig parse(List<String> lines) {
        TriggerConfig config = new TriggerConfig();
        String section = null;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            Matcher sectionMatcher = SECTION_PATTERN.matcher(trimmed);
            if (sectionMatcher.matches()) {
                section = sectionMatcher.group(1).trim();
                config.addSection(section);
                continue;
            }

            Matcher entryMatcher = ENTRY_PATTERN.matcher(trimmed);
            if (!entryMatcher.matches()) {
                config.addError("Line " + lineNum + ": invalid entry: " + trimmed);
                log.warn("Failed to parse trigger config line {}: {}", lineNum, trimmed);
                continue;
            }
            if (section == null) {
                config.addError("Line " + lineNum + ": entry outside of any section");
                log.warn("Trigger config line {} is outside of any section", lineNum);
                continue;
            }

            String key = entryMatcher.group(1).trim();
            String value = entryMatcher.group(2).trim();
            config.put(section, key, value);
            log.debug("Parsed trigger mapping [{}] {} -> {}", section, key, value);
        }

        return config;
    }
}
