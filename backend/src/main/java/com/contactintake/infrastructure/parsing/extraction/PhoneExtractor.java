package com.contactintake.infrastructure.parsing.extraction;

import com.contactintake.domain.parse.model.PhoneMatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds phone-number-shaped substrings in a normalized line.
 *
 * Shapes are tried in order, from country-aware to a generic digit run, and the first
 * shape that matches anywhere in the line wins: a "+27 ..." match later in the line beats
 * a bare digit run earlier in it.
 */
@Component
public class PhoneExtractor {

    private record PhonePattern(String name, Pattern pattern) {}

    private final List<PhonePattern> patterns;
    private final PhoneNumberNormalizer normalizer;

    public PhoneExtractor() {
        this(new PhoneNumberNormalizer());
    }

    @Autowired
    public PhoneExtractor(PhoneNumberNormalizer normalizer) {
        this.normalizer = normalizer;
        this.patterns = patternsFor(normalizer.getCountryCode(), normalizer.getTrunkPrefix(),
                normalizer.getNationalNumberLength());
    }

    /**
     * Shape table for one country. Every repetition is bounded.
     */
    private static List<PhonePattern> patternsFor(String countryCode, String trunkPrefix, int nationalLength) {
        String cc = Pattern.quote("+" + countryCode);
        String trunk = Pattern.quote(trunkPrefix);
        // Local shapes must cover a whole digit run; longer runs fall through to the digit-run shape
        String head = "(?<![\\d+])";
        String tail = "(?!\\d)";
        return List.of(
                // +27 82 123 4567; not the head of a longer number
                new PhonePattern("international-grouped",
                        Pattern.compile(cc + "\\s?\\d{2}\\s?\\d{3}\\s?\\d{4}" + tail)),
                // +27821234567, +27 821234567
                new PhonePattern("international-compact",
                        Pattern.compile(cc + "\\s?\\d{" + nationalLength + "}" + tail)),
                // 082 123 4567, 0821234567
                new PhonePattern("trunk-grouped",
                        Pattern.compile(head + trunk + "\\d{2}\\s?\\d{3}\\s?\\d{4}" + tail)),
                new PhonePattern("ten-digits", Pattern.compile(head + "\\d{10}" + tail)),
                new PhonePattern("nine-digits", Pattern.compile(head + "\\d{9}" + tail)),
                // (082) 123-4567
                new PhonePattern("parenthesized-area",
                        Pattern.compile("\\(\\d{3}\\)\\s?\\d{3}[-\\s]?\\d{4}" + tail)),
                // 082-123-4567
                new PhonePattern("dashed-groups",
                        Pattern.compile(head + "\\d{3}[-\\s]?\\d{3}[-\\s]?\\d{4}" + tail)),
                // Fallback: 9-13 digits with short separator runs ("(082) 555 - 1234", "+4479111234567")
                new PhonePattern("digit-run",
                        Pattern.compile(head + "[+(]?\\d(?:[\\s\\-().]{0,3}\\d){8,12}" + tail))
        );
    }

    /**
     * Every substring matched by any shape, grouped by shape order.
     *
     * @param text normalized line
     * @return raw matches; the first element is the one callers use
     */
    public List<String> findAll(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> matches = new ArrayList<>();
        for (PhonePattern entry : patterns) {
            Matcher matcher = entry.pattern().matcher(text);
            while (matcher.find()) {
                matches.add(matcher.group());
            }
        }
        return matches;
    }

    /**
     * Pick the phone number of a line: the first match of the most specific shape.
     *
     * @param text normalized line
     * @return the chosen match with its span and normalized form, or empty if no shape matched
     */
    public Optional<PhoneMatch> extract(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (PhonePattern entry : patterns) {
            Matcher matcher = entry.pattern().matcher(text);
            if (matcher.find()) {
                String raw = matcher.group();
                return Optional.of(new PhoneMatch(
                        raw,
                        normalizer.normalize(raw),
                        matcher.start(),
                        matcher.end(),
                        findAll(text)
                ));
            }
        }
        return Optional.empty();
    }
}
