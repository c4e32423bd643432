package org.pragmatica.yieldguard.classify;

import org.pragmatica.yieldguard.tree.Expression;
import org.pragmatica.yieldguard.tree.Expression.CallExpression;
import org.pragmatica.yieldguard.tree.Expression.Identifier;
import org.pragmatica.yieldguard.tree.HasReceiver;

import java.util.Locale;

/// Maps a call expression to an [OperationCategory] using name heuristics only.
///
/// Order of evaluation:
///
///   1. exact write / bulk-read / single-read name tables;
///   2. prefix convention (`dbSomething`);
///   3. known I/O receiver at the base of the call chain, bounded by
///      [ClassificationTables#maxReceiverDepth()];
///   4. keyword scoring over the lower-cased name for calls admitted by (2) or (3),
///      write keywords first, falling back to [OperationCategory#WRITE].
///
/// The fallback to `WRITE` for admitted but ambiguous names is intentional: a missed
/// blocking operation costs more than a spurious suggestion.
public final class OperationClassifier {
    private final ClassificationTables tables;

    private OperationClassifier(ClassificationTables tables) {
        this.tables = tables;
    }

    public static OperationClassifier operationClassifier() {
        return new OperationClassifier(ClassificationTables.defaultTables());
    }

    public static OperationClassifier operationClassifier(ClassificationTables tables) {
        return new OperationClassifier(tables);
    }

    public OperationCategory classify(CallExpression call) {
        var name = call.name();

        if (tables.writeNames().contains(name)) {
            return OperationCategory.WRITE;
        }
        if (tables.bulkReadNames().contains(name)) {
            return OperationCategory.BULK_READ;
        }
        if (tables.singleReadNames().contains(name)) {
            return OperationCategory.SINGLE_READ;
        }
        if (matchesPrefixConvention(name)) {
            return scoreKeywords(name);
        }
        if (call.receiver().filter(receiver -> hasKnownIoReceiver(receiver, 0)).isPresent()) {
            return scoreKeywords(name);
        }
        return OperationCategory.UNCLASSIFIED;
    }

    /// `db`, `dbSave`, `db_save` match; `dbx`, `debug` don't.
    boolean matchesPrefixConvention(String name) {
        var marker = tables.prefixMarker();

        if (!name.startsWith(marker)) {
            return false;
        }
        return name.length() == marker.length() || !Character.isLowerCase(name.charAt(marker.length()));
    }

    boolean hasKnownIoReceiver(Expression receiver, int depth) {
        if (depth > tables.maxReceiverDepth()) {
            return false;
        }
        if (receiver instanceof Identifier identifier) {
            return tables.knownReceivers().contains(identifier.name());
        }
        if (receiver instanceof HasReceiver chained) {
            return chained.receiver()
                          .filter(next -> hasKnownIoReceiver(next, depth + 1))
                          .isPresent();
        }
        return false;
    }

    private OperationCategory scoreKeywords(String name) {
        var lowerName = name.toLowerCase(Locale.ROOT);

        if (tables.writeKeywords().stream().anyMatch(lowerName::contains)) {
            return OperationCategory.WRITE;
        }
        if (tables.readKeywords().stream().anyMatch(lowerName::contains)) {
            return OperationCategory.BULK_READ;
        }
        return OperationCategory.WRITE;
    }
}
