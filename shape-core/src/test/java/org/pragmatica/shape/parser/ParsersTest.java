package org.pragmatica.shape.parser;

import org.pragmatica.shape.lang.Causes;
import org.pragmatica.shape.lang.Option;
import org.pragmatica.shape.lang.Result;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.shape.error.DomainError.domainError;
import static org.pragmatica.shape.error.DomainErrors.errorOf;
import static org.pragmatica.shape.error.Reason.EMPTY_LIST;
import static org.pragmatica.shape.error.Reason.FOREIGN_CAUSE;
import static org.pragmatica.shape.error.Reason.NOT_AN_INTEGER;
import static org.pragmatica.shape.error.Reason.NOT_AN_OPTION;
import static org.pragmatica.shape.error.Reason.NOT_A_LIST;
import static org.pragmatica.shape.error.Reason.NOT_A_MAP;
import static org.pragmatica.shape.error.Reason.NOT_A_SET;
import static org.pragmatica.shape.error.Reason.NOT_A_STRING;
import static org.pragmatica.shape.error.Reason.NO_PARSER_APPLIES;
import static org.pragmatica.shape.error.Reason.PREDICATE_NOT_SATISFIED;
import static org.pragmatica.shape.parser.BuiltIn.integer;
import static org.pragmatica.shape.parser.BuiltIn.string;
import static org.pragmatica.shape.parser.Parsers.list;
import static org.pragmatica.shape.parser.Parsers.map;
import static org.pragmatica.shape.parser.Parsers.maybe;
import static org.pragmatica.shape.parser.Parsers.nonEmptyList;
import static org.pragmatica.shape.parser.Parsers.oneOf;
import static org.pragmatica.shape.parser.Parsers.predicate;
import static org.pragmatica.shape.parser.Parsers.set;
import static org.pragmatica.shape.parser.Parsers.union;

class ParsersTest {
    @Nested
    class Predicates {
        @Test
        void predicate_acceptsMatchingInput() {
            predicate(input -> input instanceof Integer number && number > 0)
                .parse(5)
                .onFailureRun(Assertions::fail)
                .onSuccess(value -> assertThat(value).isEqualTo(5));
        }

        @Test
        void predicate_reportsInput_whenNotSatisfied() {
            var error = errorOf(predicate(input -> false).parse("x"));

            assertThat(error.reason()).isEqualTo(PREDICATE_NOT_SATISFIED);
            assertThat(error.detail("input")).isEqualTo("x");
            assertThat(error.details()).containsKey("predicate");
        }

        @Test
        void predicate_usesStaticError() {
            var custom = domainError("too_small");

            predicate(input -> false, custom)
                .parse(1)
                .onSuccessRun(Assertions::fail)
                .onFailure(cause -> assertThat(cause).isSameAs(custom));
        }

        @Test
        void predicate_computesErrorFromInput() {
            predicate(input -> false, input -> Causes.cause("rejected " + input))
                .parse(7)
                .onSuccessRun(Assertions::fail)
                .onFailure(cause -> assertThat(cause.message()).isEqualTo("rejected 7"));
        }

        @Test
        void oneOf_acceptsMembersIncludingNull() {
            var parser = oneOf(Arrays.asList("a", null));

            assertThat(parser.parse("a").isSuccess()).isTrue();
            assertThat(parser.parse(null).isSuccess()).isTrue();

            var error = errorOf(parser.parse("b"));
            assertThat(error.reason()).isEqualTo(PREDICATE_NOT_SATISFIED);
            assertThat(error.detail("elements")).isEqualTo(Arrays.asList("a", null));
        }

        @Test
        void equalTo_acceptsOnlyGivenValue() {
            assertThat(Parsers.equalTo(10).parse(10).isSuccess()).isTrue();
            assertThat(Parsers.equalTo(10).parse(10L).isFailure()).isTrue();
        }
    }

    @Nested
    class Lists {
        @Test
        void list_parsesEveryElementInOrder() {
            list(integer()).parse(List.of(1, 2, 3))
                           .onFailureRun(Assertions::fail)
                           .onSuccess(values -> assertThat(values).containsExactly(1, 2, 3));
        }

        @Test
        void list_acceptsEmptyInput() {
            list(integer()).parse(List.of())
                           .onFailureRun(Assertions::fail)
                           .onSuccess(values -> assertThat(values).isEmpty());
        }

        @Test
        void list_failsOnFirstBadElement() {
            var error = errorOf(list(integer()).parse(List.of(1, "x", "y")));

            assertThat(error.reason()).isEqualTo(NOT_AN_INTEGER);
            assertThat(error.detail("failed_element")).isEqualTo("x");
        }

        @Test
        void list_stopsAfterFailure() {
            var calls = new AtomicInteger();
            Parser<Integer> counting = input -> {
                calls.incrementAndGet();
                return integer().parse(input);
            };

            list(counting).parse(List.of("x", 2, 3));

            assertThat(calls).hasValue(1);
        }

        @Test
        void list_rejectsNonList() {
            assertThat(errorOf(list(integer()).parse(Set.of(1))).reason()).isEqualTo(NOT_A_LIST);
        }

        @Test
        void list_enrichesForeignCause() {
            Parser<Object> custom = input -> Causes.cause("custom").result();

            var error = errorOf(list(custom).parse(List.of(1)));

            assertThat(error.reason()).isEqualTo(FOREIGN_CAUSE);
            assertThat(error.detail("failed_element")).isEqualTo(1);
            assertThat(error.causedBy().unwrap().message()).isEqualTo("custom");
        }

        @Test
        void nonEmptyList_rejectsEmptyInput() {
            assertThat(errorOf(nonEmptyList(integer()).parse(List.of())).reason()).isEqualTo(EMPTY_LIST);
            assertThat(nonEmptyList(integer()).parse(List.of(1)).isSuccess()).isTrue();
            assertThat(errorOf(nonEmptyList(integer()).parse("x")).reason()).isEqualTo(NOT_A_LIST);
        }
    }

    @Nested
    class Sets {
        @Test
        void set_acceptsEmptyInput_withoutInvokingParser() {
            var calls = new AtomicInteger();
            Parser<Object> rejecting = input -> {
                calls.incrementAndGet();
                return Causes.cause("never accepted").result();
            };

            set(rejecting).parse(Set.of())
                          .onFailureRun(Assertions::fail)
                          .onSuccess(values -> assertThat(values).isEmpty());
            assertThat(calls).hasValue(0);
        }

        @Test
        void set_keepsIterationOrder() {
            var input = new LinkedHashSet<Object>(List.of(3, 1, 2));

            set(integer()).parse(input)
                          .onFailureRun(Assertions::fail)
                          .onSuccess(values -> assertThat(values).containsExactly(3, 1, 2));
        }

        @Test
        void set_reportsFailedElement() {
            var error = errorOf(set(integer()).parse(new LinkedHashSet<Object>(List.of(1, "two"))));

            assertThat(error.reason()).isEqualTo(NOT_AN_INTEGER);
            assertThat(error.detail("failed_element")).isEqualTo("two");
        }

        @Test
        void set_rejectsNonSet() {
            assertThat(errorOf(set(integer()).parse(List.of(1))).reason()).isEqualTo(NOT_A_SET);
        }
    }

    @Nested
    class Maps {
        @Test
        void map_parsesKeysAndValues() {
            map(string(), integer()).parse(Map.of("a", 1))
                                    .onFailureRun(Assertions::fail)
                                    .onSuccess(values -> assertThat(values).containsEntry("a", 1));
        }

        @Test
        void map_reportsKeyFailureBeforeValueFailure() {
            var input = new LinkedHashMap<Object, Object>();
            input.put("a", "not an integer");
            input.put(2, 2);

            var error = errorOf(map(string(), integer()).parse(input));

            assertThat(error.reason()).isEqualTo(NOT_A_STRING);
            assertThat(error.detail("failed_key")).isEqualTo(2);
        }

        @Test
        void map_reportsFailedValue() {
            var error = errorOf(map(string(), integer()).parse(Map.of("a", "x")));

            assertThat(error.reason()).isEqualTo(NOT_AN_INTEGER);
            assertThat(error.detail("failed_value")).isEqualTo("x");
        }

        @Test
        void map_rejectsNonMap() {
            assertThat(errorOf(map(string(), integer()).parse(List.of())).reason()).isEqualTo(NOT_A_MAP);
        }
    }

    @Nested
    class Maybe {
        @Test
        void maybe_parsesPresentValue() {
            maybe(integer()).parse(Option.some(1))
                            .onFailureRun(Assertions::fail)
                            .onSuccess(value -> assertThat(value).isEqualTo(Option.some(1)));
        }

        @Test
        void maybe_returnsInnerErrorUnchanged() {
            var error = errorOf(maybe(integer()).parse(Option.some("x")));

            assertThat(error.reason()).isEqualTo(NOT_AN_INTEGER);
            assertThat(error.details()).containsOnlyKeys("input");
        }

        @Test
        void maybe_neverInvokesParserOnNone() {
            var calls = new AtomicInteger();
            Parser<Object> counting = input -> {
                calls.incrementAndGet();
                return Result.success(input);
            };

            maybe(counting).parse(Option.none())
                           .onFailureRun(Assertions::fail)
                           .onSuccess(value -> assertThat(value.isEmpty()).isTrue());
            assertThat(calls).hasValue(0);
        }

        @Test
        void maybe_rejectsPlainValue() {
            assertThat(errorOf(maybe(integer()).parse(1)).reason()).isEqualTo(NOT_AN_OPTION);
        }
    }

    @Nested
    class Union {
        @Test
        void union_returnsFirstSuccess() {
            var parser = Parsers.<Object>union(integer(), string());

            assertThat(parser.parse(1).unwrap()).isEqualTo(1);
            assertThat(parser.parse("a").unwrap()).isEqualTo("a");
        }

        @Test
        void union_reportsAllParsers_whenNoneApplies() {
            var alternatives = new ArrayList<Parser<?>>(List.of(integer(), string()));

            var error = errorOf(Parsers.<Object>union(integer(), string()).parse(true));

            assertThat(error.reason()).isEqualTo(NO_PARSER_APPLIES);
            assertThat(error.detail("input")).isEqualTo(true);
            assertThat(error.detail("parsers")).isEqualTo(alternatives);
        }
    }
}
