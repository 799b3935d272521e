package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.exceptions.UserException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The interchangeable annotation tools. Both produce one GFF3 annotation record per sample.
 */
public enum AnnotatorVariant {
    PROKKA("prokka"),
    DFAST("dfast");

    private final String configName;

    AnnotatorVariant(final String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses the value of the {@code annotator} configuration key, ignoring case.
     */
    public static AnnotatorVariant fromConfigName(final String value) {
        final String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (final AnnotatorVariant variant : values()) {
            if (variant.configName.equals(normalized)) {
                return variant;
            }
        }
        throw new UserException.BadInput(String.format("unknown annotator '%s'; expected one of %s", value,
                Arrays.stream(values()).map(AnnotatorVariant::getConfigName).collect(Collectors.joining(", "))));
    }
}
