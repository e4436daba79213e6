package com.logsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of the classification model for one message body.
 *
 * <p>
 * Instances are validated at construction: the class id must be in
 * {@code [0, 6]}, the probability vector must hold exactly seven finite,
 * non-negative values summing to roughly one, and the anomaly score must lie
 * in {@code [0, 1]}. {@code isAnomaly} is derived, never supplied.
 * </p>
 *
 * @since 1.0.0
 */
public final class ClassificationResult {

    /** Allowed deviation of the probability sum from 1.0. */
    static final double PROBABILITY_SUM_TOLERANCE = 0.01;

    private final int classId;
    private final String className;
    private final List<Double> probabilities;
    private final double anomalyScore;
    private final Severity severity;

    private ClassificationResult(int classId, String className, List<Double> probabilities,
            double anomalyScore, Severity severity) {
        this.classId = classId;
        this.className = className;
        this.probabilities = probabilities;
        this.anomalyScore = anomalyScore;
        this.severity = severity;
    }

    /**
     * Create a validated result.
     *
     * @param classId       class id in {@code [0, 6]}
     * @param className     human label; the class's default label when blank
     * @param probabilities seven class probabilities in class-id order
     * @param anomalyScore  score in {@code [0, 1]}
     * @param severity      severity; the class's default when {@code null}
     * @return a new result
     * @throws IllegalArgumentException if any value is out of range
     * @throws NullPointerException     if {@code probabilities} is {@code null}
     */
    public static ClassificationResult of(int classId, String className, List<Double> probabilities,
            double anomalyScore, Severity severity) {
        LogClass logClass = LogClass.fromId(classId).orElseThrow(() -> new IllegalArgumentException(
                "classId must be in [0, " + (LogClass.COUNT - 1) + "], got: " + classId));
        Objects.requireNonNull(probabilities, "probabilities must not be null");
        if (probabilities.size() != LogClass.COUNT) {
            throw new IllegalArgumentException(
                    "probabilities must have " + LogClass.COUNT + " entries, got: " + probabilities.size());
        }
        double sum = 0;
        for (Double p : probabilities) {
            if (p == null || !Double.isFinite(p) || p < 0) {
                throw new IllegalArgumentException("probabilities must be finite and non-negative: " + probabilities);
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > PROBABILITY_SUM_TOLERANCE) {
            throw new IllegalArgumentException("probabilities must sum to 1.0, got: " + sum);
        }
        if (!Double.isFinite(anomalyScore) || anomalyScore < 0 || anomalyScore > 1) {
            throw new IllegalArgumentException("anomalyScore must be in [0, 1], got: " + anomalyScore);
        }
        String label = className == null || className.isBlank() ? logClass.label() : className;
        Severity resolved = severity != null ? severity : logClass.defaultSeverity();
        return new ClassificationResult(classId, label,
                Collections.unmodifiableList(new ArrayList<>(probabilities)), anomalyScore, resolved);
    }

    /**
     * Create a result from a report that carries no probability distribution
     * (for example a collector payload). The reported class receives the full
     * probability mass.
     *
     * @param classId      class id in {@code [0, 6]}
     * @param className    human label
     * @param anomalyScore score in {@code [0, 1]}
     * @param severity     severity, may be {@code null}
     * @return a new result
     * @throws IllegalArgumentException if any value is out of range
     */
    public static ClassificationResult reported(int classId, String className, double anomalyScore,
            Severity severity) {
        List<Double> oneHot = new ArrayList<>(Collections.nCopies(LogClass.COUNT, 0.0));
        if (classId >= 0 && classId < LogClass.COUNT) {
            oneHot.set(classId, 1.0);
        }
        return of(classId, className, oneHot, anomalyScore, severity);
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public int getClassId() {
        return classId;
    }

    public String getClassName() {
        return className;
    }

    /**
     * @return unmodifiable probability vector in class-id order
     */
    public List<Double> getProbabilities() {
        return probabilities;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    /**
     * @return {@code true} iff the class is not {@link LogClass#NORMAL}
     */
    public boolean isAnomaly() {
        return classId != LogClass.NORMAL.id();
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationResult that))
            return false;
        return classId == that.classId
                && Double.compare(anomalyScore, that.anomalyScore) == 0
                && className.equals(that.className)
                && probabilities.equals(that.probabilities)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(classId, className, probabilities, anomalyScore, severity);
    }

    @Override
    public String toString() {
        return "ClassificationResult{" +
                "classId=" + classId +
                ", className='" + className + '\'' +
                ", anomalyScore=" + anomalyScore +
                ", severity=" + severity +
                '}';
    }
}
