package org.labwire.core.id;

import lombok.experimental.StandardException;

/**
 * Bidirectional mapping contract between external string ids and internal dense integer ids.
 *
 * <p>Internal ids are assigned in registration order and form the range {@code [0, size)}.
 * Once assigned, an internal id never changes for the lifetime of the mapper.</p>
 */
public interface IDMapper {

    /**
     * Registers an external id, assigning the next dense internal index if it is new.
     *
     * @param externalId the client-facing ID.
     * @return the internal index, existing or newly assigned.
     * @throws IllegalArgumentException if the id is null or blank.
     */
    int register(String externalId);

    /**
     * Converts an external String ID to an internal integer index.
     * @param externalId The client-facing ID.
     * @return The internal integer index.
     * @throws UnknownIDException If the ID is not found.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal integer index to an external String ID.
     * @param internalId The internal index.
     * @return The client-facing String ID.
     * @throws IndexOutOfBoundsException If the internal ID is invalid.
     */
    String toExternal(int internalId);

    /**
     * Checks whether an external id has a mapped internal id.
     *
     * @param externalId external id to test.
     * @return true when the external id is present.
     */
    boolean containsExternal(String externalId);

    /**
     * Checks whether an internal id is within mapper bounds.
     *
     * @param internalId internal id to test.
     * @return true when the internal id is present.
     */
    boolean containsInternal(int internalId);

    /**
     * Returns number of id pairs in the mapping.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when an external ID cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Factory method for the default growable implementation.
     *
     * @return an empty mapper.
     */
    static IDMapper create() {
        return new FastUtilIDMapper();
    }
}
