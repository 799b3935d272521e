package org.broadinstitute.wombat.tools.curation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.exceptions.WombatException;
import org.broadinstitute.wombat.utils.Utils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects a read-filtering tool's outputs for one sample: walks the directory the tool wrote into, deletes
 * discarded files, moves the rest into the sample's destination directory under their own names and reports which
 * file plays which role.
 * <p>
 * The returned map holds only the roles actually found. A missing role is for the caller to treat as a failure.
 * </p>
 */
public final class FilteredReadReclassifier {
    private static final Logger logger = LogManager.getLogger(FilteredReadReclassifier.class);

    private final ReadFileRoleRegistry registry;

    public FilteredReadReclassifier(final ReadFileRoleRegistry registry) {
        this.registry = Utils.nonNull(registry, "the registry cannot be null");
    }

    /**
     * @param sourceDirectory tree the tool wrote into; walked recursively
     * @param sampleId the sample whose files are collected
     * @param destinationDirectory where kept files are moved, created if needed
     * @return kept files by role, in role order
     */
    public Map<ArtifactRole, Path> reclassify(final Path sourceDirectory, final String sampleId, final Path destinationDirectory) {
        Utils.nonNull(sourceDirectory, "the source directory cannot be null");
        Utils.nonEmpty(sampleId, "sample id");
        Utils.nonNull(destinationDirectory, "the destination directory cannot be null");

        final List<Path> candidates;
        try (final Stream<Path> files = Files.walk(sourceDirectory)) {
            candidates = files.filter(Files::isRegularFile)
                    .filter(file -> registry.isProducedByTool(file.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(sourceDirectory, e);
        }

        final EnumMap<ArtifactRole, Path> roles = new EnumMap<>(ArtifactRole.class);
        try {
            Files.createDirectories(destinationDirectory);
            for (final Path file : candidates) {
                final String name = file.getFileName().toString();
                if (registry.isDiscarded(name)) {
                    logger.debug("Deleting discarded read file " + file);
                    Files.delete(file);
                    continue;
                }
                final Path destination = destinationDirectory.resolve(name);
                Files.move(file, destination, StandardCopyOption.REPLACE_EXISTING);
                final Optional<ArtifactRole> role = registry.roleOf(name, sampleId);
                if (role.isPresent()) {
                    final Path previous = roles.put(role.get(), destination);
                    if (previous != null) {
                        throw new WombatException(String.format("Both %s and %s match role %s of sample %s",
                                previous.getFileName(), name, role.get().getName(), sampleId));
                    }
                }
            }
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(destinationDirectory,
                    "cannot move filtered reads of sample " + sampleId, e);
        }
        return Collections.unmodifiableMap(roles);
    }
}
