package com.contactintake.infrastructure.parsing.extraction;

import java.util.Locale;
import java.util.Set;

/**
 * Words that label a field ("Room 814", "Phone: ...") but are never part of its value.
 */
public final class LabelWords {

    /**
     * Labels that introduce a room/unit token.
     */
    public static final Set<String> ROOM_LABELS = Set.of(
            "room", "rm", "apt", "apartment", "flat", "unit",
            "block", "blk", "bldg", "building", "no", "number", "num"
    );

    /**
     * Every label word, room labels included.
     */
    public static final Set<String> ALL = Set.of(
            "room", "rm", "apt", "apartment", "flat", "unit",
            "block", "blk", "bldg", "building", "no", "number", "num",
            "phone", "tel", "cell", "mobile", "name", "contact", "contacts"
    );

    private LabelWords() {
    }

    public static boolean isLabel(String word) {
        return word != null && ALL.contains(word.toLowerCase(Locale.ROOT));
    }

    static String alternation(Set<String> words) {
        return String.join("|", words.stream().sorted((a, b) -> b.length() - a.length()).toList());
    }
}
