package org.pragmatica.yieldguard.source;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceUnitTest {

    @Test
    void lineSeparator_followsTheBuffer() {
        assertThat(unit("a();\nb();\n").lineSeparator()).isEqualTo("\n");
        assertThat(unit("a();\r\nb();\r\n").lineSeparator()).isEqualTo("\r\n");
        assertThat(unit("a();\rb();\r").lineSeparator()).isEqualTo("\r");
        assertThat(unit("a();").lineSeparator()).isEqualTo("\n");
    }

    private static SourceUnit unit(String content) {
        return SourceUnit.sourceUnit("Store.java", content, SourceDialect.JAVA, List.of());
    }
}
