package uk.gegc.dolos.features.timeline.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.dolos.features.revision.domain.model.SentenceRecord;
import uk.gegc.dolos.features.timeline.domain.InvalidIntervalException;
import uk.gegc.dolos.shared.exception.EmptyInputException;
import uk.gegc.dolos.shared.util.XmlText;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Produces a per-sentence edit timeline: monotonically increasing timestamps with gaps drawn
 * uniformly from {@code [min, max]} seconds, and revision ids 1..N in sentence order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TimelineGenerator {

    private final Clock clock;
    private final RandomGenerator timelineRandom;

    /**
     * @param sentences  sentence texts in document order
     * @param start      instant of the first sentence, or {@code null} for now
     * @param minSeconds lower gap bound, inclusive
     * @param maxSeconds upper gap bound, inclusive
     * @param author     revision author for every sentence
     */
    public List<SentenceRecord> generate(List<String> sentences, Instant start,
                                         long minSeconds, long maxSeconds, String author) {
        validateInterval(minSeconds, maxSeconds);
        if (sentences == null || sentences.isEmpty()) {
            throw new EmptyInputException("Cannot build a timeline for zero sentences");
        }

        Instant current = (start != null ? start : clock.instant()).truncatedTo(ChronoUnit.SECONDS);
        requireRepresentable(current, sentences.size(), maxSeconds);
        String revisionAuthor = XmlText.author(author);
        List<SentenceRecord> records = new ArrayList<>(sentences.size());

        for (int i = 0; i < sentences.size(); i++) {
            if (i > 0) {
                current = current.plusSeconds(nextGap(minSeconds, maxSeconds));
            }
            String text = XmlText.clean(sentences.get(i));
            if (text.isEmpty()) {
                throw new EmptyInputException("Sentence " + i + " is empty");
            }
            records.add(new SentenceRecord(i, text, current, current, revisionAuthor, i + 1));
        }

        log.debug("Generated timeline of {} sentences from {} to {}",
                records.size(), records.get(0).createdAt(), current);
        return records;
    }

    private long nextGap(long minSeconds, long maxSeconds) {
        if (minSeconds == maxSeconds) {
            return minSeconds;
        }
        // upper bound of nextLong(origin, bound) is exclusive
        return timelineRandom.nextLong(minSeconds, maxSeconds + 1);
    }

    /**
     * Rejects intervals whose largest possible timeline would run past {@link Instant#MAX}.
     */
    private static void requireRepresentable(Instant start, int sentences, long maxSeconds) {
        if (sentences < 2) {
            return;
        }
        long room = Instant.MAX.getEpochSecond() - start.getEpochSecond();
        if (maxSeconds > room / (sentences - 1)) {
            throw new InvalidIntervalException(String.format(
                    "Maximum interval %d is too large for %d sentences starting at %s", maxSeconds, sentences, start));
        }
    }

    static void validateInterval(long minSeconds, long maxSeconds) {
        if (minSeconds < 0 || maxSeconds < 0) {
            throw new InvalidIntervalException(String.format(
                    "Interval bounds must not be negative (min=%d, max=%d)", minSeconds, maxSeconds));
        }
        if (minSeconds > maxSeconds) {
            throw new InvalidIntervalException(String.format(
                    "Minimum interval %d exceeds maximum interval %d", minSeconds, maxSeconds));
        }
    }
}
