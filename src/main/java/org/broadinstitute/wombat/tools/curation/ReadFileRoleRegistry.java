package org.broadinstitute.wombat.tools.curation;

import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.utils.Utils;

import java.util.*;

/**
 * How to recognize the files a read-filtering tool leaves behind, by name alone.
 * <p>
 * A file belongs to the tool when its name contains the tool marker. It is discarded when its name also contains
 * one of the discard markers. Otherwise its role is the first declared role whose prefix, the sample id followed by
 * the role's suffix, starts the file name; files with no matching role are kept without a role.
 * </p>
 */
public final class ReadFileRoleRegistry {

    /**
     * Prinseq keeps the input name and adds {@code prinseq}; reads whose mate was filtered out carry {@code singletons}.
     */
    public static final ReadFileRoleRegistry PRINSEQ = new ReadFileRoleRegistry("prinseq",
            Collections.singletonList("singletons"),
            roleSuffixes(ArtifactRole.R1_PAIRED, "_R1", ArtifactRole.R2_PAIRED, "_R2"));

    private final String toolMarker;
    private final List<String> discardMarkers;
    private final LinkedHashMap<ArtifactRole, String> roleSuffixes;

    public ReadFileRoleRegistry(final String toolMarker, final List<String> discardMarkers,
                                final LinkedHashMap<ArtifactRole, String> roleSuffixes) {
        this.toolMarker = Utils.nonEmpty(toolMarker, "tool marker");
        this.discardMarkers = Collections.unmodifiableList(new ArrayList<>(Utils.nonNull(discardMarkers)));
        Utils.nonEmpty(Utils.nonNull(roleSuffixes, "role suffixes").keySet(), "role suffixes");
        this.roleSuffixes = new LinkedHashMap<>(roleSuffixes);
    }

    public boolean isProducedByTool(final String fileName) {
        return fileName.contains(toolMarker);
    }

    public boolean isDiscarded(final String fileName) {
        return discardMarkers.stream().anyMatch(fileName::contains);
    }

    /**
     * @return the role of a kept file of {@code sampleId}, if any
     */
    public Optional<ArtifactRole> roleOf(final String fileName, final String sampleId) {
        for (final Map.Entry<ArtifactRole, String> entry : roleSuffixes.entrySet()) {
            if (fileName.startsWith(sampleId + entry.getValue())) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    /**
     * @return the roles this registry can assign, in declaration order
     */
    public Set<ArtifactRole> getRoles() {
        return Collections.unmodifiableSet(roleSuffixes.keySet());
    }

    private static LinkedHashMap<ArtifactRole, String> roleSuffixes(final ArtifactRole first, final String firstSuffix,
                                                                    final ArtifactRole second, final String secondSuffix) {
        final LinkedHashMap<ArtifactRole, String> result = new LinkedHashMap<>();
        result.put(first, firstSuffix);
        result.put(second, secondSuffix);
        return result;
    }
}
