package org.pragmatica.aether.builtins;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.aether.builtins.BuiltinFunction.Category;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Read-only catalog of the built-in functions, built once per process.
 */
public final class BuiltinCatalog {
    private static final List<BuiltinFunction> FUNCTIONS = ImmutableList.of(
        // IO
        entry("PRINTLN", "PRINTLN(value...)", Category.IO,
              "Print values to the console followed by a newline",
              "PRINTLN(\"Hello World\")", "PRINTLN(MY_VAR, MY_VAR2)"),
        entry("PRINT", "PRINT(value...)", Category.IO,
              "Print values to the console without a newline",
              "PRINT(\"Result: \")", "PRINT(RESULT)"),
        entry("INPUT", "INPUT(prompt)", Category.IO,
              "Read a line of user input",
              "Set NAME INPUT(\"Enter your name: \")"),

        // Array
        entry("MAP", "MAP(array, function)", Category.ARRAY,
              "Apply a function to every element of an array",
              "Set DOUBLED MAP(NUMBERS, Lambda X -> (X * 2))"),
        entry("FILTER", "FILTER(array, predicate)", Category.ARRAY,
              "Keep the array elements that satisfy a predicate",
              "Set EVENS FILTER(NUMBERS, Lambda X -> ((X % 2) == 0))"),
        entry("REDUCE", "REDUCE(array, function, initial)", Category.ARRAY,
              "Fold an array into a single value",
              "Set SUM REDUCE(NUMBERS, Lambda (ACC, X) -> (ACC + X), 0)"),
        entry("LENGTH", "LENGTH(array_or_string)", Category.ARRAY,
              "Length of an array or string",
              "Set LEN LENGTH([1, 2, 3])", "Set STR_LEN LENGTH(\"hello\")"),
        entry("PUSH", "PUSH(array, element)", Category.ARRAY,
              "Append an element to the end of an array",
              "PUSH(MY_ARR, 42)"),
        entry("POP", "POP(array)", Category.ARRAY,
              "Remove and return the last element of an array",
              "Set LAST POP(MY_ARR)"),
        entry("SORT", "SORT(array)", Category.ARRAY,
              "Sort an array in ascending order",
              "Set SORTED SORT([3, 1, 4, 1, 5])"),
        entry("REVERSE", "REVERSE(array)", Category.ARRAY,
              "Reverse an array",
              "Set REVERSED REVERSE([1, 2, 3])"),
        entry("JOIN", "JOIN(array, separator)", Category.ARRAY,
              "Join array elements into a string with a separator",
              "Set CSV JOIN([\"a\", \"b\", \"c\"], \",\")"),
        entry("RANGE", "RANGE(start, end)", Category.ARRAY,
              "Array of the numbers from start up to end",
              "Set NUMS RANGE(1, 10)"),
        entry("SUM", "SUM(array)", Category.ARRAY,
              "Sum of the array elements",
              "Set TOTAL SUM([1, 2, 3, 4, 5])"),
        entry("MIN", "MIN(array)", Category.ARRAY,
              "Smallest array element",
              "Set MINIMUM MIN([3, 1, 4, 1, 5])"),
        entry("MAX", "MAX(array)", Category.ARRAY,
              "Largest array element",
              "Set MAXIMUM MAX([3, 1, 4, 1, 5])"),

        // String
        entry("SPLIT", "SPLIT(string, separator)", Category.STRING,
              "Split a string into an array at a separator",
              "Set PARTS SPLIT(\"a,b,c\", \",\")"),
        entry("UPPER", "UPPER(string)", Category.STRING,
              "Convert to upper case",
              "Set UPPER UPPER(\"hello\")"),
        entry("LOWER", "LOWER(string)", Category.STRING,
              "Convert to lower case",
              "Set LOWER LOWER(\"HELLO\")"),
        entry("TRIM", "TRIM(string)", Category.STRING,
              "Remove leading and trailing whitespace",
              "Set TRIMMED TRIM(\"  hello  \")"),
        entry("REPLACE", "REPLACE(string, old, new)", Category.STRING,
              "Replace occurrences of a substring",
              "Set REPLACED REPLACE(\"hello\", \"l\", \"r\")"),
        entry("STARTSWITH", "STARTSWITH(string, prefix)", Category.STRING,
              "Whether a string starts with a prefix",
              "Set IS_PREFIX STARTSWITH(\"hello\", \"he\")"),
        entry("ENDSWITH", "ENDSWITH(string, suffix)", Category.STRING,
              "Whether a string ends with a suffix",
              "Set IS_SUFFIX ENDSWITH(\"hello\", \"lo\")"),
        entry("SUBSTRING", "SUBSTRING(string, start, length)", Category.STRING,
              "Extract a substring",
              "Set SUB SUBSTRING(\"hello\", 1, 3)"),
        entry("FORMAT", "FORMAT(template, args...)", Category.STRING,
              "Fill the {} placeholders of a template",
              "Set MSG FORMAT(\"Hello {}, you are {} years old\", NAME, AGE)"),

        // Math
        entry("ABS", "ABS(number)", Category.MATH,
              "Absolute value",
              "Set ABSOLUTE ABS(-5)"),
        entry("FLOOR", "FLOOR(number)", Category.MATH,
              "Round down to an integer",
              "Set FLOORED FLOOR(3.7)"),
        entry("CEIL", "CEIL(number)", Category.MATH,
              "Round up to an integer",
              "Set CEILED CEIL(3.2)"),
        entry("ROUND", "ROUND(number)", Category.MATH,
              "Round to the nearest integer",
              "Set ROUNDED ROUND(3.5)"),
        entry("SQRT", "SQRT(number)", Category.MATH,
              "Square root",
              "Set ROOT SQRT(16)"),
        entry("POW", "POW(base, exponent)", Category.MATH,
              "Raise a base to an exponent",
              "Set POWER POW(2, 3)"),
        entry("LOG", "LOG(number)", Category.MATH,
              "Natural logarithm",
              "Set LN LOG(2.718)"),
        entry("LOG10", "LOG10(number)", Category.MATH,
              "Base 10 logarithm",
              "Set LG LOG10(100)"),
        entry("SIN", "SIN(radians)", Category.MATH,
              "Sine of an angle in radians",
              "Set SINE SIN(1.57)"),
        entry("COS", "COS(radians)", Category.MATH,
              "Cosine of an angle in radians",
              "Set COSINE COS(0)"),
        entry("TAN", "TAN(radians)", Category.MATH,
              "Tangent of an angle in radians",
              "Set TANGENT TAN(0.785)"),
        entry("RANDOM", "RANDOM()", Category.MATH,
              "Random number between 0 and 1",
              "Set RAND RANDOM()"),

        // Type
        entry("TYPE", "TYPE(value)", Category.TYPE,
              "Type name of a value",
              "Set T TYPE(42)"),
        entry("STRING", "STRING(value)", Category.TYPE,
              "Convert a value to a string",
              "Set STR STRING(42)"),
        entry("NUMBER", "NUMBER(string_or_value)", Category.TYPE,
              "Convert a value to a number",
              "Set NUM NUMBER(\"42\")"),
        entry("ISNUMBER", "ISNUMBER(value)", Category.TYPE,
              "Whether a value is a number",
              "Set IS_NUM ISNUMBER(42)"),
        entry("ISSTRING", "ISSTRING(value)", Category.TYPE,
              "Whether a value is a string",
              "Set IS_STR ISSTRING(\"hello\")"),
        entry("ISARRAY", "ISARRAY(value)", Category.TYPE,
              "Whether a value is an array",
              "Set IS_ARR ISARRAY([1, 2])"),
        entry("ISDICT", "ISDICT(value)", Category.TYPE,
              "Whether a value is a dictionary",
              "Set IS_DICT ISDICT({\"key\": \"value\"})"),

        // Dict
        entry("KEYS", "KEYS(dict)", Category.DICT,
              "All keys of a dictionary",
              "Set ALL_KEYS KEYS(MY_DICT)"),
        entry("VALUES", "VALUES(dict)", Category.DICT,
              "All values of a dictionary",
              "Set ALL_VALUES VALUES(MY_DICT)"),
        entry("ITEMS", "ITEMS(dict)", Category.DICT,
              "Key-value pairs of a dictionary as an array",
              "Set PAIRS ITEMS(MY_DICT)"),
        entry("HASKEY", "HASKEY(dict, key)", Category.DICT,
              "Whether a dictionary contains a key",
              "Set HAS HASKEY(MY_DICT, \"name\")"),

        // JSON
        entry("JSONPARSE", "JSONPARSE(json_string)", Category.JSON,
              "Parse a JSON string",
              "Set DATA JSONPARSE(\"{\\\"name\\\": \\\"Alice\\\"}\")"),
        entry("JSONSTRINGIFY", "JSONSTRINGIFY(value)", Category.JSON,
              "Serialize a value to a JSON string",
              "Set JSON JSONSTRINGIFY(MY_DATA)"),

        // DateTime
        entry("NOW", "NOW()", Category.DATE_TIME,
              "Current timestamp",
              "Set TIMESTAMP NOW()"),
        entry("FORMATDATE", "FORMATDATE(timestamp, format)", Category.DATE_TIME,
              "Format a timestamp",
              "Set DATE_STR FORMATDATE(NOW(), \"%Y-%m-%d\")"),
        entry("SLEEP", "SLEEP(seconds)", Category.DATE_TIME,
              "Pause execution for a number of seconds",
              "SLEEP(1)"));

    private static final ImmutableMap<String, BuiltinFunction> BY_NAME =
        FUNCTIONS.stream()
                 .collect(ImmutableMap.toImmutableMap(BuiltinFunction::name, Function.identity()));

    private BuiltinCatalog() {}

    /**
     * All built-ins in catalog order, grouped by category.
     */
    public static List<BuiltinFunction> all() {
        return FUNCTIONS;
    }

    /**
     * Look up a built-in by its exact (upper case) name.
     */
    public static Optional<BuiltinFunction> find(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    public static List<BuiltinFunction> byCategory(Category category) {
        return FUNCTIONS.stream()
                        .filter(function -> function.category() == category)
                        .collect(ImmutableList.toImmutableList());
    }

    private static BuiltinFunction entry(String name, String signature, Category category,
                                         String description, String... examples) {
        return new BuiltinFunction(name, signature, description, category, List.of(examples));
    }
}
