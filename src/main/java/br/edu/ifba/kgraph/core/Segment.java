package br.edu.ifba.kgraph.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A fixed-size window of consecutive sentences.
 */
public final class Segment {

    /**
     * Nominal playback offset between consecutive segments.
     */
    public static final long TIMECODE_STEP_MS = 1000L;

    @JsonProperty("segmentId")
    @NotNull
    private final String segmentId;

    @JsonProperty("order")
    private final int order;

    @JsonProperty("timecodeMs")
    private final long timecodeMs;

    @JsonProperty("keyTerms")
    @NotNull
    private final List<String> keyTerms;

    @JsonProperty("lengthHint")
    private final int lengthHint;

    @JsonProperty("sentenceIds")
    @NotNull
    private final List<String> sentenceIds;

    /**
     * Constructs a new Segment. The timecode and length hint are derived.
     *
     * @param segmentId   allocated identifier (required)
     * @param order       ordinal within the document, from 0
     * @param keyTerms    most salient terms of the segment
     * @param sentenceIds member sentences in order (required, non-empty)
     */
    public Segment(
            @NotNull String segmentId,
            int order,
            @NotNull List<String> keyTerms,
            @NotNull List<String> sentenceIds) {
        this.segmentId = Objects.requireNonNull(segmentId, "segmentId must not be null");
        if (order < 0) {
            throw new IllegalArgumentException("order must be non-negative, got: " + order);
        }
        this.order = order;
        this.timecodeMs = order * TIMECODE_STEP_MS;
        this.keyTerms = List.copyOf(Objects.requireNonNull(keyTerms, "keyTerms must not be null"));
        this.sentenceIds = List.copyOf(Objects.requireNonNull(sentenceIds, "sentenceIds must not be null"));
        if (this.sentenceIds.isEmpty()) {
            throw new IllegalArgumentException("Segment " + segmentId + " has no sentences");
        }
        this.lengthHint = this.sentenceIds.size();
    }

    @NotNull
    public String getSegmentId() {
        return segmentId;
    }

    public int getOrder() {
        return order;
    }

    public long getTimecodeMs() {
        return timecodeMs;
    }

    @NotNull
    public List<String> getKeyTerms() {
        return keyTerms;
    }

    public int getLengthHint() {
        return lengthHint;
    }

    @NotNull
    public List<String> getSentenceIds() {
        return sentenceIds;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Segment segment = (Segment) obj;
        return order == segment.order &&
               Objects.equals(segmentId, segment.segmentId) &&
               Objects.equals(keyTerms, segment.keyTerms) &&
               Objects.equals(sentenceIds, segment.sentenceIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentId, order, keyTerms, sentenceIds);
    }

    @Override
    public String toString() {
        return "Segment{" +
                "segmentId='" + segmentId + '\'' +
                ", order=" + order +
                ", keyTerms=" + keyTerms +
                ", sentences=" + sentenceIds.size() +
                '}';
    }
}
