package org.pragmatica.reclass.construct;
/**
 * Builds an instance of a token's type from reconstructed field values.
 */
@FunctionalInterface
public interface InstanceFactory<T> {
    /**
     * Create the instance.
     *
     * @param values field values of one matched token occurrence
     * @return the instance
     */
    T create(FieldValues values);
}
