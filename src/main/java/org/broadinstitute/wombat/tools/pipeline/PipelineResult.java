package org.broadinstitute.wombat.tools.pipeline;

import org.broadinstitute.wombat.engine.layout.ArtifactRole;
import org.broadinstitute.wombat.utils.Utils;

import java.nio.file.Path;
import java.util.*;

/**
 * What a successful run produced: the per-sample contigs and annotation records, in manifest order, the reference
 * annotation when there is one, and the cross-sample reports.
 */
public final class PipelineResult {

    private final Path outputRoot;
    private final List<SampleResult> samples;
    private final SampleResult reference;
    private final Map<ArtifactRole, Path> reports;

    PipelineResult(final Path outputRoot, final List<SampleResult> samples, final SampleResult reference,
                   final Map<ArtifactRole, Path> reports) {
        this.outputRoot = Utils.nonNull(outputRoot);
        this.samples = Collections.unmodifiableList(new ArrayList<>(samples));
        this.reference = reference;
        this.reports = Collections.unmodifiableMap(new EnumMap<>(reports));
    }

    public Path getOutputRoot() {
        return outputRoot;
    }

    public List<SampleResult> getSamples() {
        return samples;
    }

    public Optional<SampleResult> getReference() {
        return Optional.ofNullable(reference);
    }

    /**
     * @return the annotation records fed to the pan-genome stage, the reference last
     */
    public List<Path> getPangenomeInputs() {
        final List<Path> result = new ArrayList<>(samples.size() + 1);
        samples.forEach(s -> result.add(s.getAnnotation()));
        getReference().ifPresent(r -> result.add(r.getAnnotation()));
        return result;
    }

    public Optional<Path> getReport(final ArtifactRole role) {
        return Optional.ofNullable(reports.get(role));
    }

    public Map<ArtifactRole, Path> getReports() {
        return reports;
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append(String.format("Output in %s%n", outputRoot));
        for (final SampleResult sample : samples) {
            builder.append(String.format("  %s: %s%s%n", sample.getSampleId(), sample.getAnnotation().getFileName(),
                    sample.isResumed() ? " (from a previous run)" : ""));
        }
        getReference().ifPresent(r -> builder.append(String.format("  %s: %s%n", r.getSampleId(), r.getAnnotation().getFileName())));
        reports.forEach((role, path) -> builder.append(String.format("  %s: %s%n", role.getName(), path)));
        return builder.toString();
    }

    /**
     * The outputs of one sample chain that reached the annotated state.
     */
    public static final class SampleResult {
        private final String sampleId;
        private final Path contigs;
        private final Path annotation;
        private final boolean resumed;

        SampleResult(final String sampleId, final Path contigs, final Path annotation, final boolean resumed) {
            this.sampleId = Utils.nonNull(sampleId);
            this.contigs = Utils.nonNull(contigs);
            this.annotation = Utils.nonNull(annotation);
            this.resumed = resumed;
        }

        public String getSampleId() {
            return sampleId;
        }

        /**
         * @return the curated contigs, or the reference genome itself for the reference
         */
        public Path getContigs() {
            return contigs;
        }

        public Path getAnnotation() {
            return annotation;
        }

        /**
         * @return whether the sample was found complete in the output tree and not run again
         */
        public boolean isResumed() {
            return resumed;
        }
    }
}
