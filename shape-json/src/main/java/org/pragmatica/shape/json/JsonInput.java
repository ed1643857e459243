package org.pragmatica.shape.json;

import org.pragmatica.shape.error.DomainError;
import org.pragmatica.shape.lang.Causes;
import org.pragmatica.shape.lang.Result;
import org.pragmatica.shape.parser.BuiltIn;
import org.pragmatica.shape.parser.Parser;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import static org.pragmatica.shape.error.DomainError.details;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.Reason.INPUT;
import static org.pragmatica.shape.error.Reason.MALFORMED_JSON;
import static org.pragmatica.shape.lang.Result.lift;

/**
 * Reader of JSON text into plain values: {@link java.util.Map} with {@link String} keys,
 * {@link java.util.List}, numbers, strings, booleans and {@code null}.
 */
public interface JsonInput {
    Result<Object> read(String json);

    /**
     * Parser accepting JSON text. Non-text input fails with {@code not_a_string}.
     */
    default Parser<Object> parser() {
        return BuiltIn.string()
                      .flatMap(this::read);
    }

    /**
     * Parser reading JSON text and passing the decoded value to {@code next}.
     */
    default <T> Parser<T> then(Parser<T> next) {
        return parser().then(next);
    }

    static JsonInput jsonInput(JsonInputConfig config) {
        record jsonInput(ObjectMapper objectMapper) implements JsonInput {
            @Override
            public Result<Object> read(String json) {
                return lift(throwable -> malformed(json, throwable), () -> objectMapper.readValue(json, Object.class));
            }

            private static DomainError malformed(String json, Throwable throwable) {
                return DomainError.wrap(Causes.fromThrowable(throwable), domainError(MALFORMED_JSON, details(INPUT, json)));
            }
        }
        return new jsonInput(objectMapper(config));
    }

    static JsonInput defaultInput() {
        return jsonInput(JsonInputConfig.defaults());
    }

    private static ObjectMapper objectMapper(JsonInputConfig config) {
        return JsonMapper.builder()
                         .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, config.useBigDecimalForFloats())
                         .configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, config.useBigIntegerForInts())
                         .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, config.failOnTrailingTokens())
                         .configure(JsonReadFeature.ALLOW_JAVA_COMMENTS, config.allowComments())
                         .build();
    }
}
