package org.pragmatica.reclass.construct;

import org.pragmatica.reclass.error.ReclassError;
import org.pragmatica.reclass.error.ReclassException;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Instantiates a record through its canonical constructor.
 * Values are adapted to the component types: integers narrowed with range checks,
 * {@code Optional} components wrapped, list elements adapted one by one and text mapped to enum constants.
 */
public final class RecordFactory<T> implements InstanceFactory<T> {
    private final String token;
    private final Class<T> type;
    private final RecordComponent[] components;
    private final String[] fieldNames;
    private final MethodHandle constructor;

    private RecordFactory(String token,
                          Class<T> type,
                          RecordComponent[] components,
                          String[] fieldNames,
                          MethodHandle constructor) {
        this.token = token;
        this.type = type;
        this.components = components;
        this.fieldNames = fieldNames;
        this.constructor = constructor;
    }

    /**
     * Create factory for a record type.
     *
     * @param token      token name, used in error messages
     * @param type       record class
     * @param fieldNames names of the token fields; every component must match one of them
     */
    public static <T> RecordFactory<T> forRecord(String token, Class<T> type, Collection<String> fieldNames) {
        if (!type.isRecord()) {
            throw new IllegalArgumentException(type.getName() + " is not a record");
        }
        var components = type.getRecordComponents();
        var names = new String[components.length];
        var parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            var component = components[i];
            names[i] = FieldNames.find(fieldNames, component.getName())
                                 .orElseThrow(() -> new IllegalArgumentException(
                                 "Record component '" + component.getName() + "' of " + type.getName()
                                 + " has no field"));
            parameterTypes[i] = component.getType();
        }
        try {
            var canonical = type.getDeclaredConstructor(parameterTypes);
            canonical.setAccessible(true);
            return new RecordFactory<>(token,
                                       type,
                                       components,
                                       names,
                                       MethodHandles.lookup()
                                                    .unreflectConstructor(canonical));
        } catch (NoSuchMethodException | IllegalAccessException | RuntimeException e) {
            throw new IllegalArgumentException("Cannot access canonical constructor of " + type.getName(), e);
        }
    }

    @Override
    public T create(FieldValues values) {
        var args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            args[i] = adapt(values.get(fieldNames[i]),
                            components[i].getGenericType(),
                            fieldNames[i]);
        }
        try {
            return type.cast(constructor.invokeWithArguments(args));
        } catch (ReclassException e) {
            throw e;
        } catch (Throwable t) {
            throw new ReclassException(new ReclassError.ReconstructionError(token,
                                                                            type.getSimpleName(),
                                                                            "constructor failed: " + t.getMessage()),
                                       t);
        }
    }

    private Object adapt(Object value, Type target, String field) {
        if (target instanceof ParameterizedType parameterized) {
            var raw = (Class<?>) parameterized.getRawType();
            var argument = parameterized.getActualTypeArguments()[0];
            if (raw == Optional.class) {
                return value == null
                       ? Optional.empty()
                       : Optional.of(adapt(value, argument, field));
            }
            if (value instanceof List<?> list && raw.isAssignableFrom(List.class)) {
                return list.stream()
                           .map(item -> adapt(item, argument, field))
                           .collect(Collectors.toUnmodifiableList());
            }
            return adapt(value, raw, field);
        }
        if (!(target instanceof Class<?> cls)) {
            return value;
        }
        if (value == null) {
            if (cls.isPrimitive()) {
                throw failure(field, "no value for primitive " + cls.getName());
            }
            return cls == Optional.class
                   ? Optional.empty()
                   : null;
        }
        if (cls == Optional.class) {
            return Optional.of(value);
        }
        if (boxed(cls).isInstance(value)) {
            return value;
        }
        try {
            return convert(value, cls, field);
        } catch (ArithmeticException e) {
            throw failure(field, value + " is out of range for " + cls.getName());
        }
    }

    private Object convert(Object value, Class<?> cls, String field) {
        if (value instanceof Long number) {
            if (cls == int.class || cls == Integer.class) {
                return Math.toIntExact(number);
            }
            if (cls == short.class || cls == Short.class) {
                return narrow(number, Short.MIN_VALUE, Short.MAX_VALUE).shortValue();
            }
            if (cls == byte.class || cls == Byte.class) {
                return narrow(number, Byte.MIN_VALUE, Byte.MAX_VALUE).byteValue();
            }
            if (cls == BigInteger.class) {
                return BigInteger.valueOf(number);
            }
            if (cls == double.class || cls == Double.class) {
                return number.doubleValue();
            }
            if (cls == BigDecimal.class) {
                return BigDecimal.valueOf(number);
            }
        }
        if (value instanceof BigInteger number) {
            if (cls == long.class || cls == Long.class) {
                return number.longValueExact();
            }
            if (cls == int.class || cls == Integer.class
                || cls == short.class || cls == Short.class || cls == byte.class || cls == Byte.class) {
                return convert(number.longValueExact(), cls, field);
            }
            if (cls == double.class || cls == Double.class) {
                return number.doubleValue();
            }
            if (cls == BigDecimal.class) {
                return new BigDecimal(number);
            }
        }
        if (value instanceof Double number) {
            if (cls == float.class || cls == Float.class) {
                return number.floatValue();
            }
            if (cls == BigDecimal.class) {
                return BigDecimal.valueOf(number);
            }
        }
        if (value instanceof BigDecimal number && (cls == double.class || cls == Double.class)) {
            return number.doubleValue();
        }
        if (value instanceof String text && cls.isEnum()) {
            return enumConstant(cls, text, field);
        }
        throw failure(field, "cannot convert " + value.getClass().getSimpleName() + " to " + cls.getSimpleName());
    }

    private Object enumConstant(Class<?> cls, String text, String field) {
        var constants = cls.getEnumConstants();
        for (var constant : constants) {
            if (((Enum<?>) constant).name().equals(text)) {
                return constant;
            }
        }
        for (var constant : constants) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(text.trim().replace(' ', '_'))) {
                return constant;
            }
        }
        throw failure(field, "'" + text + "' is not a constant of " + cls.getSimpleName());
    }

    private static Long narrow(Long value, long min, long max) {
        if (value < min || value > max) {
            throw new ArithmeticException("out of range");
        }
        return value;
    }

    private ReclassException failure(String field, String reason) {
        return new ReclassError.ReconstructionError(token, field, reason).exception();
    }

    private static Class<?> boxed(Class<?> cls) {
        if (!cls.isPrimitive()) {
            return cls;
        }
        if (cls == int.class) {
            return Integer.class;
        }
        if (cls == long.class) {
            return Long.class;
        }
        if (cls == double.class) {
            return Double.class;
        }
        if (cls == float.class) {
            return Float.class;
        }
        if (cls == boolean.class) {
            return Boolean.class;
        }
        if (cls == short.class) {
            return Short.class;
        }
        if (cls == byte.class) {
            return Byte.class;
        }
        return Character.class;
    }
}
