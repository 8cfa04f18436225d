package com.codeadapt.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A cataloged source snippet together with its customization metadata.
 *
 * <p>The source is parsed again for every adaptation; no parsed tree is kept here.
 *
 * @param id unique identifier
 * @param name component name, used for the adapted file name and usage example
 * @param source raw source text
 * @param language source language ({@code javascript} or {@code typescript})
 * @param category catalog category, e.g. {@code auth}
 * @param repository source repository, or null
 * @param url source URL, or null
 * @param license license identifier, or null
 * @param commit commit the snippet was taken from, or null
 * @param metadata customization metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Component(
    String id,
    String name,
    String source,
    String language,
    String category,
    String repository,
    String url,
    String license,
    String commit,
    CustomizationMetadata metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        if (language == null) {
            language = "javascript";
        }
        if (metadata == null) {
            metadata = CustomizationMetadata.empty();
        }
    }

    /**
     * Returns a copy with the given metadata.
     */
    public Component withMetadata(CustomizationMetadata newMetadata) {
        return new Component(id, name, source, language, category, repository, url, license, commit, newMetadata);
    }
}
