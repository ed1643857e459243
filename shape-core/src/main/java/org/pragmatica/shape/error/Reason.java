package org.pragmatica.shape.error;

/**
 * Reasons and detail keys used by the errors produced in Shape.
 */
public final class Reason {
    private Reason() {}

    // Input shape
    public static final String NOT_A_LIST = "not_a_list";
    public static final String NOT_A_SET = "not_a_set";
    public static final String NOT_A_MAP = "not_a_map";
    public static final String NOT_AN_OPTION = "not_an_option";
    public static final String EMPTY_LIST = "empty_list";
    public static final String INVALID_INPUT = "invalid_input";

    // Field specifications
    public static final String INVALID_FIELD_SPEC = "invalid_field_spec";

    // Resolution
    public static final String FIELD_NOT_FOUND_IN_INPUT = "field_not_found_in_input";
    public static final String FAILED_TO_PARSE_FIELD = "failed_to_parse_field";
    public static final String PREDICATE_NOT_SATISFIED = "predicate_not_satisfied";
    public static final String NO_PARSER_APPLIES = "no_parser_applies";
    public static final String FOREIGN_CAUSE = "foreign_cause";

    // Struct construction and update
    public static final String INVALID_PARAMETER = "invalid_parameter";
    public static final String STRUCT_TYPE_MISMATCH = "struct_type_mismatch";
    public static final String STRUCT_CONSTRUCTION_FAILED = "struct_construction_failed";

    // Keys
    public static final String UNKNOWN_KEY = "unknown_key";
    public static final String NOT_A_STRING_KEY = "not_a_string_key";

    // Built-in parsers
    public static final String NOT_AN_INTEGER = "not_an_integer";
    public static final String NOT_A_STRING = "not_a_string";
    public static final String NOT_A_BOOLEAN = "not_a_boolean";
    public static final String NOT_NIL = "not_nil";
    public static final String NOT_A_DATE = "not_a_date";
    public static final String NOT_A_DATETIME = "not_a_datetime";
    public static final String NOT_A_NAIVE_DATETIME = "not_a_naive_datetime";
    public static final String INVALID_FORMAT = "invalid_format";
    public static final String INVALID_DATE = "invalid_date";
    public static final String INVALID_TIME = "invalid_time";
    public static final String MISSING_OFFSET = "missing_offset";
    public static final String NOT_AN_INTEGER_STRING = "not_an_integer_string";
    public static final String NOT_A_DECIMAL_STRING = "not_a_decimal_string";

    // JSON input
    public static final String MALFORMED_JSON = "malformed_json";

    // Detail keys
    public static final String INPUT = "input";
    public static final String FIELD = "field";
    public static final String SPEC = "spec";
    public static final String KEY = "key";
    public static final String VALUE = "value";
    public static final String TYPE = "type";
    public static final String PREDICATE = "predicate";
    public static final String ELEMENTS = "elements";
    public static final String PARSERS = "parsers";
    public static final String FAILED_ELEMENT = "failed_element";
    public static final String FAILED_KEY = "failed_key";
    public static final String FAILED_VALUE = "failed_value";
    public static final String EXPECTING = "expecting";
    public static final String GOT = "got";
}
