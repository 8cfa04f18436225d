package com.codeadapt.core.analysis;

import com.codeadapt.core.model.ErrorHandlingStyle;
import com.codeadapt.core.model.ImportStyle;
import com.codeadapt.core.model.NamingConvention;
import com.codeadapt.core.model.PatternDescriptor;
import com.codeadapt.core.model.PatternType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conventions detected in a program. {@code UNDETERMINED} values mean no conversion is needed.
 *
 * @param naming dominant naming convention of referenced identifiers
 * @param importStyle dominant import style
 * @param errorHandling error-handling idiom
 */
public record PatternAnalysis(
    NamingConvention naming,
    ImportStyle importStyle,
    ErrorHandlingStyle errorHandling
) {
    public PatternAnalysis {
        Objects.requireNonNull(naming, "naming must not be null");
        Objects.requireNonNull(importStyle, "importStyle must not be null");
        Objects.requireNonNull(errorHandling, "errorHandling must not be null");
    }

    /**
     * Returns one descriptor per determined pattern.
     */
    public List<PatternDescriptor> toDescriptors() {
        List<PatternDescriptor> descriptors = new ArrayList<>();
        if (naming != NamingConvention.UNDETERMINED) {
            descriptors.add(new PatternDescriptor(PatternType.NAMING, naming.id(),
                "Identifiers use " + naming.id()));
        }
        if (importStyle != ImportStyle.UNDETERMINED) {
            descriptors.add(new PatternDescriptor(PatternType.IMPORTS, importStyle.id(),
                "Modules are imported with " + importStyle.id() + " imports"));
        }
        if (errorHandling != ErrorHandlingStyle.UNDETERMINED) {
            descriptors.add(new PatternDescriptor(PatternType.ERROR_HANDLING, errorHandling.id(),
                "Errors are handled with " + errorHandling.id()));
        }
        return List.copyOf(descriptors);
    }
}
