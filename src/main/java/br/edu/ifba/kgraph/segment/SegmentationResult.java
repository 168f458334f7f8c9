package br.edu.ifba.kgraph.segment;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sentences of a document and their partition into segments.
 *
 * <p>Each segment is a list of sentence indices into {@link #sentences()}.
 * Segments are contiguous, non-overlapping and cover every sentence once.</p>
 *
 * @param sentences trimmed sentence texts in document order
 * @param segments  sentence indices grouped per segment, in document order
 */
public record SegmentationResult(
    @NotNull List<String> sentences,
    @NotNull List<List<Integer>> segments
) {

    public SegmentationResult {
        Objects.requireNonNull(sentences, "sentences must not be null");
        Objects.requireNonNull(segments, "segments must not be null");
        sentences = List.copyOf(sentences);
        List<List<Integer>> copy = new ArrayList<>(segments.size());
        for (List<Integer> group : segments) {
            copy.add(List.copyOf(group));
        }
        segments = List.copyOf(copy);
    }

    public int sentenceCount() {
        return sentences.size();
    }

    public int segmentCount() {
        return segments.size();
    }

    /**
     * Sentence texts of one segment.
     *
     * @param segmentIndex zero-based segment ordinal
     * @return sentence texts in order
     */
    @NotNull
    public List<String> sentencesOf(int segmentIndex) {
        List<String> texts = new ArrayList<>();
        for (int index : segments.get(segmentIndex)) {
            texts.add(sentences.get(index));
        }
        return texts;
    }
}
