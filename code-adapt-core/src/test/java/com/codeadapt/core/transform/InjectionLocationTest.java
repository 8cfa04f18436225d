package com.codeadapt.core.transform;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InjectionLocation}.
 */
class InjectionLocationTest {

    @Test
    void parse_functionWithAnchor_splitsNameAndAnchor() {
        assertThat(InjectionLocation.parse("function:login:end"))
            .contains(new InjectionLocation(InjectionLocation.Kind.FUNCTION, "login", "end"));
    }

    @Test
    void parse_methodWithoutAnchor_hasNullAnchor() {
        assertThat(InjectionLocation.parse("method:render"))
            .contains(new InjectionLocation(InjectionLocation.Kind.METHOD, "render", null));
    }

    @Test
    void parse_commentMarker_keepsColonsInMarker() {
        assertThat(InjectionLocation.parse("comment:TODO: inject here"))
            .contains(new InjectionLocation(InjectionLocation.Kind.COMMENT, "TODO: inject here", null));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"login", "function:", ":login", "line:12", "function:login:middle"})
    void parse_malformed_returnsEmpty(String location) {
        assertThat(InjectionLocation.parse(location)).isEmpty();
    }
}
