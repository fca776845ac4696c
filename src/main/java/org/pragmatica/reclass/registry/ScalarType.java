package org.pragmatica.reclass.registry;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.function.Function;

/**
 * Built-in field types with their default pattern, parser and formatter.
 */
public enum ScalarType implements FieldType {
    BOOLEAN("(?i:true|false|1|0)",
            text -> text.equalsIgnoreCase("true") || text.equals("1"),
            String::valueOf),
    INTEGER("[-+]?\\d+",
            ScalarType::parseInteger,
            String::valueOf),
    FLOAT("[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?",
          Double::parseDouble,
          String::valueOf),
    DECIMAL("[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)",
            BigDecimal::new,
            value -> value instanceof BigDecimal decimal
                     ? decimal.toPlainString()
                     : String.valueOf(value)),
    DATE("\\d{4}-\\d{2}-\\d{2}",
         LocalDate::parse,
         String::valueOf),
    DATETIME("\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?",
             text -> LocalDateTime.parse(text.replace(' ', 'T')),
             value -> Formats.DATE_TIME.format((LocalDateTime) value)),
    TIME("\\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,9})?",
         LocalTime::parse,
         value -> Formats.TIME.format((LocalTime) value)),
    UUID("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}",
         java.util.UUID::fromString,
         String::valueOf),
    TEXT(".+?",
         text -> text,
         String::valueOf);

    private final String defaultPattern;
    private final Function<String, Object> parser;
    private final Function<Object, String> formatter;

    ScalarType(String defaultPattern, Function<String, Object> parser, Function<Object, String> formatter) {
        this.defaultPattern = defaultPattern;
        this.parser = parser;
        this.formatter = formatter;
    }

    public String defaultPattern() {
        return defaultPattern;
    }

    /**
     * Convert matched text into the Java value of this type.
     *
     * @throws RuntimeException if the text is not acceptable for the type
     */
    public Object parse(String text) {
        return parser.apply(text);
    }

    /**
     * Write a value back in a form the default pattern accepts.
     */
    public String format(Object value) {
        return formatter.apply(value);
    }

    /**
     * Scalar type for a Java type, if it is one of the built-in ones.
     */
    public static Optional<ScalarType> forJavaType(Class<?> type) {
        if (type == boolean.class || type == Boolean.class) {
            return Optional.of(BOOLEAN);
        }
        if (type == int.class || type == Integer.class
            || type == long.class || type == Long.class
            || type == short.class || type == Short.class
            || type == byte.class || type == Byte.class
            || type == BigInteger.class) {
            return Optional.of(INTEGER);
        }
        if (type == double.class || type == Double.class || type == float.class || type == Float.class) {
            return Optional.of(FLOAT);
        }
        if (type == BigDecimal.class) {
            return Optional.of(DECIMAL);
        }
        if (type == LocalDate.class) {
            return Optional.of(DATE);
        }
        if (type == LocalDateTime.class) {
            return Optional.of(DATETIME);
        }
        if (type == LocalTime.class) {
            return Optional.of(TIME);
        }
        if (type == java.util.UUID.class) {
            return Optional.of(UUID);
        }
        if (type == String.class || type == CharSequence.class) {
            return Optional.of(TEXT);
        }
        return Optional.empty();
    }

    /**
     * {@code Long} when the value fits, {@code BigInteger} otherwise.
     */
    private static Object parseInteger(String text) {
        var value = new BigInteger(text);
        return value.bitLength() < Long.SIZE
               ? (Object) value.longValue()
               : value;
    }

    private static final class Formats {
        private static final DateTimeFormatter TIME = new DateTimeFormatterBuilder()
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .toFormatter();

        private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd ")
            .append(TIME)
            .toFormatter();
    }
}
