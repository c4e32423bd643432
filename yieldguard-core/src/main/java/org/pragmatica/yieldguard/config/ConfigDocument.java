package org.pragmatica.yieldguard.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/// Raw shape of `yieldguard.toml`. Absent keys stay `null`.
record ConfigDocument(@JsonProperty("fail-on-warning") Boolean failOnWarning,
                      @JsonProperty("exclude") List<String> exclude,
                      @JsonProperty("rules") Map<String, String> rules,
                      @JsonProperty("mitigation") MitigationSection mitigation,
                      @JsonProperty("classification") ClassificationSection classification) {

    record MitigationSection(@JsonProperty("calls") List<String> calls,
                             @JsonProperty("statement") String statement) {}

    record ClassificationSection(@JsonProperty("write-names") List<String> writeNames,
                                 @JsonProperty("bulk-read-names") List<String> bulkReadNames,
                                 @JsonProperty("single-read-names") List<String> singleReadNames,
                                 @JsonProperty("write-keywords") List<String> writeKeywords,
                                 @JsonProperty("read-keywords") List<String> readKeywords,
                                 @JsonProperty("receivers") List<String> receivers,
                                 @JsonProperty("prefix") String prefix,
                                 @JsonProperty("max-receiver-depth") Integer maxReceiverDepth) {}
}
