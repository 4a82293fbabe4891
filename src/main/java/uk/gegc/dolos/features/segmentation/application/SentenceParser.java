package uk.gegc.dolos.features.segmentation.application;

import org.springframework.stereotype.Component;
import uk.gegc.dolos.shared.exception.EmptyInputException;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw text into an ordered list of non-empty sentences.
 */
@Component
public class SentenceParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile(
            "(?<!\\w\\.\\w.)(?<![A-Z][a-z]\\.)(?<=[.?!])\\s+(?=[A-Z])|(?<=[.?!])$");

    private static final Pattern TERMINAL_PUNCTUATION = Pattern.compile("[.!?]+");

    public List<String> parse(String text) {
        return parse(text, SegmentationMethod.REGEX);
    }

    /**
     * @throws EmptyInputException when the text is blank or yields no sentence
     */
    public List<String> parse(String text, SegmentationMethod method) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException("Text content is empty");
        }

        List<String> sentences = switch (method == null ? SegmentationMethod.REGEX : method) {
            case REGEX -> splitOnBoundaries(text);
            case SIMPLE -> splitOnPunctuation(text);
        };

        if (sentences.isEmpty()) {
            throw new EmptyInputException("Text contains no sentences");
        }
        return sentences;
    }

    private List<String> splitOnBoundaries(String text) {
        String normalized = WHITESPACE.matcher(text.strip()).replaceAll(" ");
        List<String> sentences = Arrays.stream(SENTENCE_BOUNDARY.split(normalized))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
        return sentences.isEmpty() ? List.of(normalized) : sentences;
    }

    private List<String> splitOnPunctuation(String text) {
        return Arrays.stream(TERMINAL_PUNCTUATION.split(text))
                .map(s -> WHITESPACE.matcher(s.strip()).replaceAll(" "))
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
