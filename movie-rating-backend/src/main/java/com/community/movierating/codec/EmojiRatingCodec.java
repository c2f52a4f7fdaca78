package com.community.movierating.codec;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Maps keycap emoji to rating values and back.
 * <p>
 * Eleven symbols are known: 0️⃣ through 9️⃣ and 🔟. The zero keycap decodes to 0 but is not a valid
 * rating on the 1-10 scale, so the router rejects it like any unknown symbol.
 */
@Component
public class EmojiRatingCodec {

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 10;

    private static final String VARIATION_SELECTOR = "\uFE0F";
    private static final String KEYCAP_SUFFIX = VARIATION_SELECTOR + "\u20E3";

    /** Index == decoded value. */
    private static final List<String> SYMBOLS = List.of(
            "0" + KEYCAP_SUFFIX,
            "1" + KEYCAP_SUFFIX,
            "2" + KEYCAP_SUFFIX,
            "3" + KEYCAP_SUFFIX,
            "4" + KEYCAP_SUFFIX,
            "5" + KEYCAP_SUFFIX,
            "6" + KEYCAP_SUFFIX,
            "7" + KEYCAP_SUFFIX,
            "8" + KEYCAP_SUFFIX,
            "9" + KEYCAP_SUFFIX,
            "\uD83D\uDD1F" // 🔟
    );

    private static final Map<String, Integer> VALUES;

    static {
        Map<String, Integer> values = new HashMap<>();
        for (int i = 0; i < SYMBOLS.size(); i++) {
            values.put(normalize(SYMBOLS.get(i)), i);
        }
        VALUES = Collections.unmodifiableMap(values);
    }

    public OptionalInt decode(String symbol) {
        if (symbol == null) {
            return OptionalInt.empty();
        }
        Integer value = VALUES.get(normalize(symbol));
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public Optional<String> encode(int rating) {
        if (rating < 0 || rating >= SYMBOLS.size()) {
            return Optional.empty();
        }
        return Optional.of(SYMBOLS.get(rating));
    }

    /**
     * Decodes a symbol and keeps it only if it is a valid rating on the 1-10 scale.
     */
    public OptionalInt decodeRating(String symbol) {
        OptionalInt value = decode(symbol);
        if (value.isPresent() && isRatingValue(value.getAsInt())) {
            return value;
        }
        return OptionalInt.empty();
    }

    /**
     * Canonical spelling of a known symbol (with the variation selector); unknown symbols are
     * returned unchanged.
     */
    public String canonical(String symbol) {
        OptionalInt value = decode(symbol);
        return value.isPresent() ? SYMBOLS.get(value.getAsInt()) : symbol;
    }

    // some clients send keycaps without the variation selector
    private static String normalize(String symbol) {
        return symbol.replace(VARIATION_SELECTOR, "").trim();
    }

    public boolean isRatingValue(int value) {
        return value >= MIN_RATING && value <= MAX_RATING;
    }

    public List<String> symbols() {
        return SYMBOLS;
    }
}
