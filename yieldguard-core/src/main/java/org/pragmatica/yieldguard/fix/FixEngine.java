package org.pragmatica.yieldguard.fix;

import org.pragmatica.yieldguard.lint.Diagnostic;
import org.pragmatica.yieldguard.lint.LintConfig;
import org.pragmatica.yieldguard.lint.rules.FixKind;
import org.pragmatica.yieldguard.lint.rules.LintRule;
import org.pragmatica.yieldguard.mitigation.SuccessorChecker;
import org.pragmatica.yieldguard.source.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/// Applies every available fix for a file's diagnostics in a single pass.
public final class FixEngine {
    private static final Logger log = LoggerFactory.getLogger(FixEngine.class);

    private final FixSynthesizer synthesizer;
    private final Map<String, FixKind> fixKinds;

    private FixEngine(FixSynthesizer synthesizer, Map<String, FixKind> fixKinds) {
        this.synthesizer = synthesizer;
        this.fixKinds = fixKinds;
    }

    public static FixEngine fixEngine(LintConfig config, List<LintRule> rules) {
        var synthesizer = FixSynthesizer.fixSynthesizer(config.mitigationStatement(),
                                                        SuccessorChecker.successorChecker(config.mitigationCalls()));
        return new FixEngine(synthesizer,
                             rules.stream()
                                  .collect(Collectors.toUnmodifiableMap(LintRule::ruleId,
                                                                        LintRule::fixKind,
                                                                        (first, second) -> first)));
    }

    public Optional<TextEdit> fixFor(Diagnostic diagnostic, SourceUnit unit) {
        return Optional.ofNullable(fixKinds.get(diagnostic.ruleId()))
                       .flatMap(kind -> synthesizer.synthesize(diagnostic, unit, kind));
    }

    public FixOutcome fixAll(SourceUnit unit, List<Diagnostic> diagnostics) {
        var edits = new ArrayList<TextEdit>();

        for (var diagnostic : diagnostics) {
            fixFor(diagnostic, unit).ifPresentOrElse(edits::add,
                                                     () -> log.debug("No fix for {} at {}:{}",
                                                                     diagnostic.ruleId(),
                                                                     unit.fileName(),
                                                                     diagnostic.line()));
        }

        var compatible = TextEdits.compatible(edits);
        var skipped = diagnostics.size() - compatible.size();

        if (compatible.size() < edits.size()) {
            log.debug("{}: {} conflicting fix(es) deferred", unit.fileName(), edits.size() - compatible.size());
        }
        return FixOutcome.fixOutcome(TextEdits.apply(unit.content(), compatible), compatible.size(), skipped);
    }
}
