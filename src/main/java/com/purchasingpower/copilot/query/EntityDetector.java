package com.purchasingpower.copilot.query;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic scan for stock symbols in free text.
 *
 * <p>Any word of 2 to 5 letters is a candidate once the text is uppercased, unless it is one of
 * the common English words listed in {@code ticker-stoplist.txt}. Candidates keep their order of
 * appearance and are not deduplicated. There is no scoring, so {@link #firstCandidate(String)}
 * is simply the earliest survivor, not necessarily the symbol the user cares about most.
 */
@Slf4j
@Component
public class EntityDetector {

    static final String STOPLIST_RESOURCE = "ticker-stoplist.txt";

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("\\b[A-Z]{2,5}\\b");

    private final Set<String> stopWords;

    public EntityDetector() {
        this(loadStopWords());
    }

    EntityDetector(Set<String> stopWords) {
        this.stopWords = ImmutableSet.copyOf(stopWords);
    }

    public List<CandidateSymbol> scan(String text) {
        Preconditions.checkNotNull(text, "Text cannot be null");

        ImmutableList.Builder<CandidateSymbol> candidates = ImmutableList.builder();
        Matcher matcher = SYMBOL_PATTERN.matcher(text.toUpperCase(Locale.ROOT));
        while (matcher.find()) {
            String token = matcher.group();
            if (!stopWords.contains(token)) {
                candidates.add(new CandidateSymbol(token, matcher.start()));
            }
        }
        return candidates.build();
    }

    public Optional<CandidateSymbol> firstCandidate(String text) {
        List<CandidateSymbol> candidates = scan(text);
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() > 1) {
            log.debug("Multiple symbol candidates {}, using the first", candidates);
        }
        return Optional.of(candidates.get(0));
    }

    private static Set<String> loadStopWords() {
        try {
            URL resource = Resources.getResource(STOPLIST_RESOURCE);
            ImmutableSet<String> words = Resources.readLines(resource, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .map(line -> line.toUpperCase(Locale.ROOT))
                    .collect(ImmutableSet.toImmutableSet());
            log.info("Loaded {} ticker stop words", words.size());
            return words;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + STOPLIST_RESOURCE, e);
        }
    }
}
