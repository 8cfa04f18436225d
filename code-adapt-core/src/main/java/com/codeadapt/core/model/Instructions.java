package com.codeadapt.core.model;

import java.util.List;

/**
 * Steps a consumer follows to use an adapted component.
 *
 * @param install package manager commands
 * @param setup setup steps such as environment variables to define
 * @param usage usage example
 */
public record Instructions(
    List<String> install,
    List<String> setup,
    String usage
) {
    public Instructions {
        install = install != null ? List.copyOf(install) : List.of();
        setup = setup != null ? List.copyOf(setup) : List.of();
        if (usage == null) {
            usage = "";
        }
    }
}
