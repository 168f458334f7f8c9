package br.edu.ifba.kgraph.segment;

import br.edu.ifba.kgraph.core.IngestionConfig;
import br.edu.ifba.kgraph.exception.EmptyInputException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw text into sentences and groups them into fixed-size segments.
 *
 * <p>Line breaks are treated as spaces, so a sentence may span several lines.
 * Sentence boundaries are runs of Latin or CJK sentence-final punctuation; the
 * punctuation itself is not kept. The last segment may be shorter than the window.</p>
 */
@ApplicationScoped
public class Segmenter {

    private static final Logger logger = LoggerFactory.getLogger(Segmenter.class);

    private final Pattern boundary;
    private final int sentencesPerSegment;

    @Inject
    public Segmenter(IngestionConfig config) {
        this(config.segment().boundaryPattern(), config.segment().sentencesPerSegment());
    }

    public Segmenter(@NotNull String boundaryPattern, int sentencesPerSegment) {
        if (sentencesPerSegment < 1) {
            throw new IllegalArgumentException("sentencesPerSegment must be positive, got: " + sentencesPerSegment);
        }
        this.boundary = Pattern.compile(boundaryPattern);
        this.sentencesPerSegment = sentencesPerSegment;
    }

    /**
     * Segments a document.
     *
     * @param text raw document text
     * @return sentences and their segment partition
     * @throws EmptyInputException if the text contains no sentence
     */
    @NotNull
    public SegmentationResult segment(@Nullable String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException("Document text is empty");
        }

        List<String> sentences = splitSentences(text);
        if (sentences.isEmpty()) {
            throw new EmptyInputException("Document text contains no sentences");
        }

        List<List<Integer>> segments = new ArrayList<>();
        for (int start = 0; start < sentences.size(); start += sentencesPerSegment) {
            int end = Math.min(start + sentencesPerSegment, sentences.size());
            List<Integer> group = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                group.add(i);
            }
            segments.add(group);
        }

        logger.debug("Segmented text into {} sentences and {} segments", sentences.size(), segments.size());
        return new SegmentationResult(sentences, segments);
    }

    @NotNull
    List<String> splitSentences(@NotNull String text) {
        String normalized = text.replace('\r', ' ').replace('\n', ' ');
        List<String> sentences = new ArrayList<>();
        for (String fragment : boundary.split(normalized)) {
            String trimmed = fragment.strip();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return sentences;
    }
}
