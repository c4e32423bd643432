package org.pragmatica.yieldguard.config;

import org.pragmatica.yieldguard.classify.ClassificationTables;
import org.pragmatica.yieldguard.config.ConfigDocument.ClassificationSection;
import org.pragmatica.yieldguard.config.ConfigDocument.MitigationSection;
import org.pragmatica.yieldguard.lint.DiagnosticSeverity;
import org.pragmatica.yieldguard.lint.LintConfig;
import org.pragmatica.yieldguard.lint.rules.RuleCatalog;
import org.pragmatica.yieldguard.shared.LintError;
import org.pragmatica.yieldguard.shared.LintException;
import org.pragmatica.yieldguard.source.MitigationStatements;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.dataformat.toml.TomlMapper;

/// Loads linter configuration from `yieldguard.toml`.
///
/// Values found in the file are layered over [LintConfig#DEFAULT]; name lists extend
/// the built-in tables rather than replacing them.
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_FILE_NAME = "yieldguard.toml";
    private static final String RULE_OFF = "off";

    private static final TomlMapper MAPPER = TomlMapper.builder()
                                                       .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                                       .build();

    private ConfigLoader() {}

    /// Load configuration from file path.
    ///
    /// @throws LintException carrying [LintError.ConfigError] if the file is unreadable or invalid
    public static LintConfig load(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new LintException(LintError.configError(path.toString(), e.getMessage()), e);
        }
    }

    /// Load configuration from TOML string content.
    public static LintConfig loadFromString(String content) {
        return parse(content, "<string>");
    }

    /// `yieldguard.toml` in the given directory, if there is one.
    public static Optional<Path> discover(Path directory) {
        var candidate = directory.resolve(CONFIG_FILE_NAME);
        return Files.isRegularFile(candidate)
               ? Optional.of(candidate)
               : Optional.empty();
    }

    private static LintConfig parse(String content, String source) {
        if (content.isBlank()) {
            return LintConfig.defaultConfig();
        }
        ConfigDocument document;

        try {
            document = MAPPER.readValue(content, ConfigDocument.class);
        } catch (JacksonException e) {
            throw new LintException(LintError.configError(source, e.getOriginalMessage()), e);
        }
        if (document == null) {
            return LintConfig.defaultConfig();
        }
        return fromDocument(document, source);
    }

    private static LintConfig fromDocument(ConfigDocument document, String source) {
        var config = LintConfig.defaultConfig();

        if (document.failOnWarning() != null) {
            config = config.withFailOnWarning(document.failOnWarning());
        }
        if (document.exclude() != null) {
            config = config.withExcludePaths(document.exclude());
        }
        config = populateRules(config, orEmpty(document.rules()), source);
        config = populateMitigation(config, document.mitigation(), source);

        if (document.classification() != null) {
            config = config.withClassification(populateClassification(config.classification(),
                                                                      document.classification(),
                                                                      source));
        }
        return config;
    }

    private static LintConfig populateRules(LintConfig config, Map<String, String> rules, String source) {
        for (var entry : rules.entrySet()) {
            var ruleId = entry.getKey();
            var value = entry.getValue();

            if (RuleCatalog.find(ruleId).isEmpty()) {
                log.warn("{}: unknown rule '{}'", source, ruleId);
            }
            if (RULE_OFF.equalsIgnoreCase(value.trim())) {
                config = config.withDisabledRule(ruleId);
                continue;
            }
            var severity = DiagnosticSeverity.fromLabel(value)
                                             .orElseThrow(() -> invalid(source, "unknown severity '" + value
                                                                                + "' for rule " + ruleId));
            config = config.withRuleSeverity(ruleId, severity);
        }
        return config;
    }

    private static LintConfig populateMitigation(LintConfig config, MitigationSection mitigation, String source) {
        if (mitigation == null) {
            return config;
        }
        if (mitigation.calls() != null) {
            config = config.withMitigationCalls(new HashSet<>(mitigation.calls()));
        }
        if (mitigation.statement() != null && !mitigation.statement().isBlank()) {
            var statement = mitigation.statement().trim();

            if (MitigationStatements.callName(statement).isEmpty()) {
                throw invalid(source, "mitigation statement must be a single method call: " + statement);
            }
            config = config.withMitigationStatement(statement);
        }
        return config;
    }

    private static ClassificationTables populateClassification(ClassificationTables tables,
                                                               ClassificationSection section,
                                                               String source) {
        tables = tables.withWriteNames(new HashSet<>(orEmpty(section.writeNames())))
                       .withBulkReadNames(new HashSet<>(orEmpty(section.bulkReadNames())))
                       .withSingleReadNames(new HashSet<>(orEmpty(section.singleReadNames())))
                       .withWriteKeywords(orEmpty(section.writeKeywords()))
                       .withReadKeywords(orEmpty(section.readKeywords()))
                       .withKnownReceivers(new HashSet<>(orEmpty(section.receivers())));

        if (section.prefix() != null) {
            if (section.prefix().isBlank()) {
                throw invalid(source, "prefix must not be empty");
            }
            tables = tables.withPrefixMarker(section.prefix());
        }
        if (section.maxReceiverDepth() != null) {
            if (section.maxReceiverDepth() < 0) {
                throw invalid(source, "max-receiver-depth must not be negative");
            }
            tables = tables.withMaxReceiverDepth(section.maxReceiverDepth());
        }
        return tables;
    }

    private static LintException invalid(String source, String detail) {
        return new LintException(LintError.configError(source, detail));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null
               ? List.of()
               : list;
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map == null
               ? Map.of()
               : map;
    }
}
