package org.broadinstitute.wombat.engine;

import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.tsv.TableColumnCollection;
import org.broadinstitute.wombat.utils.tsv.TableReader;
import org.broadinstitute.wombat.utils.tsv.TableUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The three auxiliary files of a run, read from a one-column ({@value #ROUTE_COLUMN}) manifest whose rows are,
 * in order: adapter sequences, reference genome (optional), reference protein database.
 */
public final class AuxiliaryFiles {

    public static final String ROUTE_COLUMN = "Route";

    /**
     * Values of the reference genome row meaning there is no reference.
     */
    public static final List<String> ABSENT_MARKERS = Arrays.asList("", "NA", "None", "-");

    private final Path adapters;
    private final Path referenceGenome;
    private final Path proteinDatabase;

    public AuxiliaryFiles(final Path adapters, final Path referenceGenome, final Path proteinDatabase) {
        this.adapters = adapters;
        this.referenceGenome = referenceGenome;
        this.proteinDatabase = proteinDatabase;
    }

    public Optional<Path> getAdapters() {
        return Optional.ofNullable(adapters);
    }

    public Optional<Path> getReferenceGenome() {
        return Optional.ofNullable(referenceGenome);
    }

    public Optional<Path> getProteinDatabase() {
        return Optional.ofNullable(proteinDatabase);
    }

    /**
     * Reads the auxiliary manifest. Relative routes resolve against the manifest's directory.
     *
     * @param needsAdapters whether trimming runs, making the adapter route mandatory
     * @param needsProteinDatabase whether the homology search runs, making the protein database route mandatory
     */
    public static AuxiliaryFiles read(final Path manifest, final boolean needsAdapters, final boolean needsProteinDatabase) {
        Utils.nonNull(manifest, "the auxiliary manifest path cannot be null");
        if (!Files.isReadable(manifest)) {
            throw new UserException.CouldNotReadInputFile(manifest, "the auxiliary manifest does not exist or is not readable");
        }
        final List<String> routes;
        try (final TableReader<String> reader = TableUtils.reader(manifest, (columns, formatExceptionFactory) -> {
            TableUtils.checkMandatoryColumns(columns, new TableColumnCollection(ROUTE_COLUMN), formatExceptionFactory);
            return dataLine -> dataLine.get(ROUTE_COLUMN).trim();
        })) {
            routes = reader.toList();
        } catch (final UserException.BadInput e) {
            throw new UserException.MalformedManifest(manifest, e.getMessage(), e);
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(manifest, e);
        }
        if (routes.size() != 3) {
            throw new UserException.MalformedManifest(manifest, String.format(
                    "expected exactly 3 routes (adapters, reference genome, protein database) but found %d", routes.size()));
        }

        final Path baseDirectory = manifest.toAbsolutePath().getParent();
        final Path adapters = resolve(manifest, baseDirectory, routes.get(0), "adapter sequences", needsAdapters);
        final Path reference = resolve(manifest, baseDirectory, routes.get(1), "reference genome", false);
        final Path proteins = resolve(manifest, baseDirectory, routes.get(2), "reference protein database", needsProteinDatabase);
        return new AuxiliaryFiles(adapters, reference, proteins);
    }

    private static Path resolve(final Path manifest, final Path baseDirectory, final String route,
                                final String what, final boolean required) {
        if (ABSENT_MARKERS.contains(route)) {
            if (required) {
                throw new UserException.MalformedManifest(manifest, "no route given for the " + what);
            }
            return null;
        }
        final Path path = baseDirectory.resolve(route);
        if (!Files.isRegularFile(path)) {
            throw new UserException.MalformedManifest(manifest, String.format("the %s file %s does not exist", what, path));
        }
        return path;
    }
}
