package org.rentalrepairs.engine.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable scored suggestion of a worker for a request.
 */
public final class Recommendation implements Comparable<Recommendation> {

    private final Worker worker;
    private final int score;
    private final double confidence;
    private final String reasoning;
    private final Duration estimatedCompletionTime;

    private Recommendation(Builder builder) {
        this.worker = Objects.requireNonNull(builder.worker, "worker must not be null");
        this.score = builder.score;
        if (builder.confidence < 0.0 || builder.confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
        this.confidence = builder.confidence;
        this.reasoning = builder.reasoning != null ? builder.reasoning : "";
        this.estimatedCompletionTime = builder.estimatedCompletionTime != null
                ? builder.estimatedCompletionTime
                : Duration.ZERO;
    }

    public Worker getWorker() {
        return worker;
    }

    public int getScore() {
        return score;
    }

    public double getConfidence() {
        return confidence;
    }

    public String getReasoning() {
        return reasoning;
    }

    public Duration getEstimatedCompletionTime() {
        return estimatedCompletionTime;
    }

    @Override
    public int compareTo(Recommendation other) {
        // Higher score first
        return Integer.compare(other.score, this.score);
    }

    @Override
    public String toString() {
        return String.format("Recommendation{worker='%s', score=%d, confidence=%.2f, eta=%s}",
                worker.getEmail(), score, confidence, estimatedCompletionTime);
    }

    /**
     * Builder for Recommendation.
     */
    public static final class Builder {
        private Worker worker;
        private int score;
        private double confidence;
        private String reasoning;
        private Duration estimatedCompletionTime;

        public Builder worker(Worker worker) {
            this.worker = worker;
            return this;
        }

        public Builder score(int score) {
            this.score = score;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder estimatedCompletionTime(Duration estimatedCompletionTime) {
            this.estimatedCompletionTime = estimatedCompletionTime;
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }
}
