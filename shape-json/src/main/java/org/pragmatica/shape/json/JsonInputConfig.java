package org.pragmatica.shape.json;

/**
 * Options of the JSON reader.
 *
 * @param useBigDecimalForFloats read fractional numbers as {@link java.math.BigDecimal} instead of {@link Double}
 * @param useBigIntegerForInts   read all integral numbers as {@link java.math.BigInteger}
 * @param allowComments          accept Java style comments
 * @param failOnTrailingTokens   reject content after the first complete JSON value
 */
public record JsonInputConfig(boolean useBigDecimalForFloats,
                              boolean useBigIntegerForInts,
                              boolean allowComments,
                              boolean failOnTrailingTokens) {
    public static final JsonInputConfig DEFAULT = new JsonInputConfig(false, false, false, true);

    public static JsonInputConfig defaults() {
        return DEFAULT;
    }

    public JsonInputConfig withUseBigDecimalForFloats(boolean useBigDecimalForFloats) {
        return new JsonInputConfig(useBigDecimalForFloats, useBigIntegerForInts, allowComments, failOnTrailingTokens);
    }

    public JsonInputConfig withUseBigIntegerForInts(boolean useBigIntegerForInts) {
        return new JsonInputConfig(useBigDecimalForFloats, useBigIntegerForInts, allowComments, failOnTrailingTokens);
    }

    public JsonInputConfig withAllowComments(boolean allowComments) {
        return new JsonInputConfig(useBigDecimalForFloats, useBigIntegerForInts, allowComments, failOnTrailingTokens);
    }

    public JsonInputConfig withFailOnTrailingTokens(boolean failOnTrailingTokens) {
        return new JsonInputConfig(useBigDecimalForFloats, useBigIntegerForInts, allowComments, failOnTrailingTokens);
    }
}
