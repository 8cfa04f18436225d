package com.codeadapt.core.transform;

import com.codeadapt.core.model.AdaptationWarning;
import com.codeadapt.core.model.CustomizationMetadata;
import com.codeadapt.core.model.WarningType;
import com.codeadapt.core.util.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * State shared by the passes of one transformation run.
 *
 * <p>Holds the component metadata the passes resolve against and accumulates warnings.
 * A context belongs to a single run and is not shared between threads.
 */
public class TransformContext {

    private static final Logger log = LoggerFactory.getLogger(TransformContext.class);

    private final CustomizationMetadata metadata;
    private final Set<String> extraBuiltins;
    private final List<AdaptationWarning> warnings = new ArrayList<>();

    public TransformContext(CustomizationMetadata metadata, Set<String> extraBuiltins) {
        this.metadata = Objects.requireNonNull(metadata, "metadata must not be null");
        this.extraBuiltins = extraBuiltins != null ? Set.copyOf(extraBuiltins) : Set.of();
    }

    public CustomizationMetadata metadata() {
        return metadata;
    }

    /**
     * Returns true for builtin names and names configured as builtins.
     */
    public boolean isBuiltin(String name) {
        return Identifiers.isBuiltin(name) || extraBuiltins.contains(name);
    }

    public void warn(WarningType type, String message) {
        log.warn("{}: {}", type, message);
        warnings.add(new AdaptationWarning(type, message));
    }

    public List<AdaptationWarning> warnings() {
        return List.copyOf(warnings);
    }
}
