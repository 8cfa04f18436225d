package com.codeadapt.core.catalog;

import com.codeadapt.core.ast.JavaScriptAst.ArrayExpression;
import com.codeadapt.core.ast.JavaScriptAst.Identifier;
import com.codeadapt.core.ast.JavaScriptAst.Literal;
import com.codeadapt.core.ast.JavaScriptAst.LiteralKind;
import com.codeadapt.core.model.Component;
import com.codeadapt.core.model.ConfigurableVariable;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.InjectionPoint;
import com.codeadapt.core.model.InjectionPosition;
import com.codeadapt.core.model.PatternType;
import com.codeadapt.core.model.VariableType;
import com.codeadapt.core.parser.JavaScriptParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link ComponentCataloger}.
 */
class ComponentCatalogerTest {

    private static final String LOGIN_FORM = """
        import React, { useState } from 'react';
        import axios from 'axios';
        import { debounce } from 'lodash/fp';
        import { Button } from './Button';

        const config = { apiUrl: 'https://api.example.com', timeout: 5000, retry: true, scopes: ['read'] };

        function login(user) {
          return axios.post(config.apiUrl, user, { headers: { key: process.env.API_KEY } });
        }

        class Session {
          start() { return login(process.env['DEFAULT_USER']); }
          get active() { return true; }
        }

        // @inject analytics
        export default login;
        """;

    private final ComponentCataloger cataloger = new ComponentCataloger();

    @Test
    void discover_configObject_extractsTypedVariables() {
        CustomizationMetadata metadata = cataloger.discover(LOGIN_FORM);

        assertThat(metadata.variables())
            .filteredOn(v -> v.type() != VariableType.ENV)
            .extracting(ConfigurableVariable::name, ConfigurableVariable::type, ConfigurableVariable::defaultValue)
            .containsExactly(
                tuple("apiUrl", VariableType.STRING, "https://api.example.com"),
                tuple("timeout", VariableType.NUMBER, "5000"),
                tuple("retry", VariableType.BOOLEAN, "true"),
                tuple("scopes", VariableType.ARRAY, null));
        assertThat(metadata.findVariable("timeout")).get()
            .extracting(ConfigurableVariable::description).isEqualTo("Configuration option: timeout");
    }

    @Test
    void discover_processEnv_extractsEnvironmentVariables() {
        CustomizationMetadata metadata = cataloger.discover(LOGIN_FORM);

        assertThat(metadata.variables())
            .filteredOn(ConfigurableVariable::isEnvironment)
            .extracting(ConfigurableVariable::name)
            .containsExactly("API_KEY", "DEFAULT_USER");
    }

    @Test
    void discover_functionsMethodsAndMarkers_numbersInjectionPoints() {
        CustomizationMetadata metadata = cataloger.discover(LOGIN_FORM);

        assertThat(metadata.injectionPoints())
            .extracting(InjectionPoint::id, InjectionPoint::kind, InjectionPoint::location)
            .containsExactly(
                tuple("injection-1", InjectionPosition.BEFORE, "function:login:start"),
                tuple("injection-2", InjectionPosition.AFTER, "function:login:end"),
                tuple("injection-3", InjectionPosition.BEFORE, "method:start:start"),
                tuple("injection-4", InjectionPosition.REPLACE, "comment:@inject analytics"));
        assertThat(metadata.injectionPoints().get(3).description()).isEqualTo("analytics");
    }

    @Test
    void discover_imports_collectsPackageNamesAndFramework() {
        CustomizationMetadata metadata = cataloger.discover(LOGIN_FORM);

        assertThat(metadata.dependencies()).containsExactly("react", "axios", "lodash");
        assertThat(metadata.framework()).isEqualTo("react");
    }

    @Test
    void discover_requireCalls_countAsDependencies() {
        CustomizationMetadata metadata = cataloger.discover("""
            const express = require('express');
            const { join } = require('path');
            """);

        assertThat(metadata.dependencies()).containsExactly("express", "path");
        assertThat(metadata.framework()).isEqualTo("express");
    }

    @Test
    void discover_globalVueAccess_detectsVue() {
        assertThat(cataloger.discover("Vue.component('x', {});").framework()).isEqualTo("vue");
    }

    @Test
    void discover_patterns_includeDetectedConventions() {
        CustomizationMetadata metadata = cataloger.discover(LOGIN_FORM);

        assertThat(metadata.findPattern(PatternType.IMPORTS)).isPresent();
        assertThat(metadata.findPattern(PatternType.NAMING)).get()
            .satisfies(p -> assertThat(p.current()).isEqualTo("camelCase"));
    }

    @Test
    void catalog_component_replacesMetadata() {
        Component component = new Component("login-form", "LoginForm", LOGIN_FORM, null, "auth",
            null, null, null, null, null);

        Component cataloged = cataloger.catalog(component);

        assertThat(cataloged.id()).isEqualTo("login-form");
        assertThat(cataloged.metadata().injectionPoints()).isNotEmpty();
    }

    @Test
    void catalog_invalidSource_throwsParseException() {
        Component component = new Component("broken", "Broken", "function (", null, null,
            null, null, null, null, null);

        assertThatThrownBy(() -> cataloger.catalog(component)).isInstanceOf(JavaScriptParseException.class);
    }

    @ParameterizedTest
    @CsvSource(value = {
        "lodash/fp, lodash",
        "@scope/pkg/sub, @scope/pkg",
        "react, react",
        "./local, NULL",
        "/abs/path, NULL"
    }, nullValues = "NULL")
    void packageName_variousSpecifiers_returnsPackage(String module, String expected) {
        assertThat(ComponentCataloger.packageName(module)).isEqualTo(expected);
    }

    @Test
    void inferType_nonLiteral_defaultsToString() {
        assertThat(ComponentCataloger.inferType(new Identifier("value"))).isEqualTo(VariableType.STRING);
        assertThat(ComponentCataloger.inferType(new ArrayExpression(List.of()))).isEqualTo(VariableType.ARRAY);
        assertThat(ComponentCataloger.inferType(new Literal(LiteralKind.NUMBER, "1.5"))).isEqualTo(VariableType.NUMBER);
    }
}
