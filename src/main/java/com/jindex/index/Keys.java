package com.jindex.index;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Key validation and normalization shared by every index.
 */
public final class Keys {

    private Keys() {
    }

    /**
     * Parses a rating out of a raw attribute value. Numbers are taken as is,
     * strings must hold a decimal number.
     *
     * @param raw The attribute value
     * @return The rating
     * @throws InvalidKeyException If the value is missing, not numeric, NaN or infinite
     */
    public static double rating(Object raw) {
        if (raw instanceof Number) {
            return checkRating(((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            String text = ((String) raw).trim();
            try {
                return checkRating(Double.parseDouble(text));
            } catch (NumberFormatException e) {
                throw new InvalidKeyException("Rating is not numeric: '" + raw + "'", e);
            }
        }
        throw new InvalidKeyException("Rating is not numeric: " + raw);
    }

    public static double checkRating(double rating) {
        if (Double.isNaN(rating) || Double.isInfinite(rating)) {
            throw new InvalidKeyException("Rating must be a finite number, got " + rating);
        }
        return rating;
    }

    /**
     * Lower-cases and trims a name key. Null becomes the empty string.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Normalizes a name key that is about to be inserted.
     *
     * @throws InvalidKeyException If nothing is left after normalization
     */
    public static String requireName(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            throw new InvalidKeyException("Name key must not be blank: '" + name + "'");
        }
        return normalized;
    }

    /**
     * Renders a rating as its one-decimal digit string with the decimal point
     * removed: 4.5 becomes "45", 3.0 becomes "30", 10.0 becomes "100".
     */
    public static String ratingDigits(double rating) {
        checkRating(rating);
        String plain = new BigDecimal(rating)
            .setScale(1, RoundingMode.HALF_EVEN)
            .toPlainString();
        return plain.replace(".", "");
    }
}
