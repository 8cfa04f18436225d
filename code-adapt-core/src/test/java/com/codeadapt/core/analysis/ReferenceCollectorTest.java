package com.codeadapt.core.analysis;

import com.codeadapt.core.parser.JavaScriptAstParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReferenceCollector}.
 */
class ReferenceCollectorTest {

    private static List<String> collect(String source) {
        return ReferenceCollector.collect(JavaScriptAstParser.parse(source));
    }

    @Test
    void collect_parameterDefaults_visitsDefaultsOnly() {
        List<String> references = collect("""
            function load(page_size = default_size, { retry_count = max_retries } = {}) {
              return page_size;
            }
            """);

        assertThat(references).containsExactly("default_size", "max_retries", "page_size");
    }

    @Test
    void collect_destructuringDefaults_visitsDefaultsOnly() {
        List<String> references = collect("""
            const { user_name = fallback_name, ...rest_props } = props;
            const [first_item = empty_item] = items;
            const show = (label = default_label) => label;
            """);

        assertThat(references).containsExactly(
            "fallback_name", "props", "empty_item", "items", "default_label", "label");
    }
}
