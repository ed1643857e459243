package org.pragmatica.shape.parser;

import org.pragmatica.shape.lang.Result;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.INVALID_DATE;
import static org.pragmatica.shape.error.Reason.INVALID_FORMAT;
import static org.pragmatica.shape.error.Reason.INVALID_TIME;
import static org.pragmatica.shape.error.Reason.MISSING_OFFSET;
import static org.pragmatica.shape.error.Reason.NOT_AN_INTEGER;
import static org.pragmatica.shape.error.Reason.NOT_AN_INTEGER_STRING;
import static org.pragmatica.shape.error.Reason.NOT_A_BOOLEAN;
import static org.pragmatica.shape.error.Reason.NOT_A_DATE;
import static org.pragmatica.shape.error.Reason.NOT_A_DATETIME;
import static org.pragmatica.shape.error.Reason.NOT_A_DECIMAL_STRING;
import static org.pragmatica.shape.error.Reason.NOT_A_NAIVE_DATETIME;
import static org.pragmatica.shape.error.Reason.NOT_A_STRING;
import static org.pragmatica.shape.error.Reason.NOT_NIL;

/**
 * Parsers for the primitive value types usually found in decoded input.
 *
 * <p>Every failure is a {@link org.pragmatica.shape.error.DomainError} with the offending value
 * under the {@code input} detail.
 */
public final class BuiltIn {
    private BuiltIn() {}

    private static final Pattern DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DATE_TIME = Pattern.compile(
        "^(\\d{4}-\\d{2}-\\d{2})[T ](\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?)(Z|[+-]\\d{2}:\\d{2})?$");
    private static final Pattern INTEGER_TEXT = Pattern.compile("^[+-]?\\d+$");

    private static final Parser<Integer> INTEGER = input -> input instanceof Integer value
                                                            ? Result.success(value)
                                                            : reject(NOT_AN_INTEGER, input);

    private static final Parser<Long> LONG_INTEGER = input -> {
        if (input instanceof Long value) {
            return Result.success(value);
        }
        if (input instanceof Integer value) {
            return Result.success(value.longValue());
        }
        return reject(NOT_AN_INTEGER, input);
    };

    private static final Parser<String> STRING = input -> input instanceof String value
                                                          ? Result.success(value)
                                                          : reject(NOT_A_STRING, input);

    private static final Parser<Boolean> BOOL = input -> input instanceof Boolean value
                                                         ? Result.success(value)
                                                         : reject(NOT_A_BOOLEAN, input);

    private static final Parser<Object> NIL = input -> input == null
                                                       ? Result.success(null)
                                                       : reject(NOT_NIL, input);

    public static Parser<Integer> integer() {
        return INTEGER;
    }

    /**
     * Accepts {@link Long} and widens {@link Integer}, which is what JSON readers produce for small numbers.
     */
    public static Parser<Long> longInteger() {
        return LONG_INTEGER;
    }

    public static Parser<String> string() {
        return STRING;
    }

    public static Parser<Boolean> bool() {
        return BOOL;
    }

    /**
     * Accepts {@code null} only.
     */
    public static Parser<Object> nil() {
        return NIL;
    }

    /**
     * Accepts a {@link LocalDate} or its ISO-8601 text form {@code yyyy-MM-dd}.
     */
    public static Parser<LocalDate> date() {
        return input -> {
            if (input instanceof LocalDate value) {
                return Result.success(value);
            }
            if (!(input instanceof String text)) {
                return reject(NOT_A_DATE, input);
            }
            if (!DATE.matcher(text).matches()) {
                return reject(INVALID_FORMAT, input);
            }
            return parseDate(text, input);
        };
    }

    /**
     * Accepts an {@link OffsetDateTime} or ISO-8601 text with either {@code T} or a space between date
     * and time, and a mandatory {@code Z} or {@code +hh:mm} offset. The offset is kept as given.
     */
    public static Parser<OffsetDateTime> dateTime() {
        return input -> {
            if (input instanceof OffsetDateTime value) {
                return Result.success(value);
            }
            if (!(input instanceof String text)) {
                return reject(NOT_A_DATETIME, input);
            }
            var matcher = DATE_TIME.matcher(text);
            if (!matcher.matches()) {
                return reject(INVALID_FORMAT, input);
            }
            return localDateTime(matcher, input)
                .flatMap(local -> matcher.group(3) == null
                                  ? reject(MISSING_OFFSET, input)
                                  : offset(matcher.group(3), input).map(local::atOffset));
        };
    }

    /**
     * Like {@link #dateTime()}, but produces a {@link LocalDateTime}. An offset, when present, is ignored.
     */
    public static Parser<LocalDateTime> naiveDateTime() {
        return input -> {
            if (input instanceof LocalDateTime value) {
                return Result.success(value);
            }
            if (!(input instanceof String text)) {
                return reject(NOT_A_NAIVE_DATETIME, input);
            }
            var matcher = DATE_TIME.matcher(text);
            if (!matcher.matches()) {
                return reject(INVALID_FORMAT, input);
            }
            return localDateTime(matcher, input);
        };
    }

    /**
     * Accepts decimal integer text of arbitrary length, such as {@code "-42"}.
     */
    public static Parser<BigInteger> integerString() {
        return STRING.flatMap(text -> INTEGER_TEXT.matcher(text).matches()
                                      ? Result.success(new BigInteger(text))
                                      : reject(NOT_AN_INTEGER_STRING, text));
    }

    /**
     * Accepts decimal number text, such as {@code "1.50"} or {@code "2e3"}, keeping its scale.
     */
    public static Parser<BigDecimal> decimalString() {
        return STRING.flatMap(text -> Result.lift(exception -> domainError(NOT_A_DECIMAL_STRING, details(INPUT, text)),
                                                  () -> new BigDecimal(text)));
    }

    private static Result<LocalDateTime> localDateTime(Matcher matcher, Object input) {
        return parseDate(matcher.group(1), input)
            .flatMap(date -> Result.lift(exception -> domainError(INVALID_TIME, details(INPUT, input)),
                                         () -> LocalTime.parse(matcher.group(2)))
                                   .map(date::atTime));
    }

    private static Result<LocalDate> parseDate(String text, Object input) {
        return Result.lift(exception -> domainError(INVALID_DATE, details(INPUT, input)),
                           () -> LocalDate.parse(text));
    }

    private static Result<ZoneOffset> offset(String text, Object input) {
        return Result.lift(exception -> domainError(INVALID_FORMAT, details(INPUT, input)),
                           () -> ZoneOffset.of(text));
    }

    private static <T> Result<T> reject(String reason, Object input) {
        return domainError(reason, details(INPUT, input)).result();
    }
}
