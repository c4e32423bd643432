package org.pragmatica.yieldguard.classify;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Name tables and limits driving the layered call classification.
///
/// Evaluation order is fixed by [OperationClassifier]: exact names first, then the
/// prefix convention, then the receiver heuristic, with keyword scoring deciding
/// the category for the latter two.
public record ClassificationTables(Set<String> writeNames,
                                   Set<String> bulkReadNames,
                                   Set<String> singleReadNames,
                                   List<String> writeKeywords,
                                   List<String> readKeywords,
                                   Set<String> knownReceivers,
                                   String prefixMarker,
                                   int maxReceiverDepth) {
    public static final int DEFAULT_MAX_RECEIVER_DEPTH = 6;

    public static final ClassificationTables DEFAULT = new ClassificationTables(
            Set.of(// Isar
                   "writeTxn", "writeTxnSync", "deleteAll", "putAll", "clear",
                   // sqflite
                   "rawInsert", "rawUpdate", "rawDelete", "execute",
                   // File I/O
                   "writeAsString", "writeAsBytes"),
            Set.of("findAll", "getAll", "rawQuery", "query",
                   "readAsString", "readAsBytes", "readAsLines", "loadJsonFromAsset"),
            Set.of("findFirst", "findById", "getById", "count"),
            List.of("write", "save", "insert", "update", "delete", "put", "remove", "clear", "upsert"),
            List.of("find", "read", "load", "query", "get", "fetch", "select"),
            Set.of("isar", "database", "db", "box", "store", "collection"),
            "db",
            DEFAULT_MAX_RECEIVER_DEPTH);

    public ClassificationTables {
        writeNames = Set.copyOf(writeNames);
        bulkReadNames = Set.copyOf(bulkReadNames);
        singleReadNames = Set.copyOf(singleReadNames);
        writeKeywords = lowerCased(writeKeywords);
        readKeywords = lowerCased(readKeywords);
        knownReceivers = Set.copyOf(knownReceivers);
        if (prefixMarker == null || prefixMarker.isEmpty()) {
            throw new IllegalArgumentException("Prefix marker must not be empty");
        }
        if (maxReceiverDepth < 0) {
            throw new IllegalArgumentException("Receiver depth must not be negative: " + maxReceiverDepth);
        }
    }

    public static ClassificationTables defaultTables() {
        return DEFAULT;
    }

    public ClassificationTables withWriteNames(Set<String> names) {
        return new ClassificationTables(union(writeNames, names), bulkReadNames, singleReadNames,
                                        writeKeywords, readKeywords, knownReceivers, prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withBulkReadNames(Set<String> names) {
        return new ClassificationTables(writeNames, union(bulkReadNames, names), singleReadNames,
                                        writeKeywords, readKeywords, knownReceivers, prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withSingleReadNames(Set<String> names) {
        return new ClassificationTables(writeNames, bulkReadNames, union(singleReadNames, names),
                                        writeKeywords, readKeywords, knownReceivers, prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withWriteKeywords(List<String> keywords) {
        return new ClassificationTables(writeNames, bulkReadNames, singleReadNames,
                                        appended(writeKeywords, keywords), readKeywords, knownReceivers,
                                        prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withReadKeywords(List<String> keywords) {
        return new ClassificationTables(writeNames, bulkReadNames, singleReadNames,
                                        writeKeywords, appended(readKeywords, keywords), knownReceivers,
                                        prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withKnownReceivers(Set<String> receivers) {
        return new ClassificationTables(writeNames, bulkReadNames, singleReadNames,
                                        writeKeywords, readKeywords, union(knownReceivers, receivers),
                                        prefixMarker, maxReceiverDepth);
    }

    public ClassificationTables withPrefixMarker(String marker) {
        return new ClassificationTables(writeNames, bulkReadNames, singleReadNames,
                                        writeKeywords, readKeywords, knownReceivers, marker, maxReceiverDepth);
    }

    public ClassificationTables withMaxReceiverDepth(int depth) {
        return new ClassificationTables(writeNames, bulkReadNames, singleReadNames,
                                        writeKeywords, readKeywords, knownReceivers, prefixMarker, depth);
    }

    private static Set<String> union(Set<String> base, Set<String> extra) {
        var merged = new HashSet<>(base);
        merged.addAll(extra);
        return merged;
    }

    private static List<String> appended(List<String> base, List<String> extra) {
        return Stream.concat(base.stream(), extra.stream())
                     .distinct()
                     .toList();
    }

    private static List<String> lowerCased(List<String> keywords) {
        return keywords.stream()
                       .map(String::toLowerCase)
                       .collect(Collectors.toUnmodifiableList());
    }
}
