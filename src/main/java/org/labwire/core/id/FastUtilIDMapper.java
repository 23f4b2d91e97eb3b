package org.labwire.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Growable {@link IDMapper} backed by the FastUtil library.
 * <p>
 * Forward lookups avoid boxing through {@link Object2IntOpenHashMap}; reverse lookups
 * are a plain list index. This class is NOT thread-safe; a station graph is built and
 * mutated from one thread.
 * </p>
 */
public class FastUtilIDMapper implements IDMapper {

    // String -> Int (forward lookup)
    private final Object2IntOpenHashMap<String> forward;
    // Int -> String (reverse lookup)
    private final ObjectArrayList<String> reverse;

    public FastUtilIDMapper() {
        this.forward = new Object2IntOpenHashMap<>();
        this.forward.defaultReturnValue(-1); // Sentinel value
        this.reverse = new ObjectArrayList<>();
    }

    /**
     * Creates a mapper pre-populated with the given ids in iteration order.
     */
    public FastUtilIDMapper(Iterable<String> externalIds) {
        this();
        if (externalIds == null) {
            throw new IllegalArgumentException("externalIds cannot be null");
        }
        for (String externalId : externalIds) {
            register(externalId);
        }
    }

    @Override
    public int register(String externalId) {
        requireValid(externalId);
        int existing = forward.getInt(externalId);
        if (existing != -1) {
            return existing;
        }
        int assigned = reverse.size();
        forward.put(externalId, assigned);
        reverse.add(externalId);
        return assigned;
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        requireValid(externalId);
        int id = forward.getInt(externalId);
        if (id == -1) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse.get(internalId);
    }

    @Override
    public boolean containsExternal(String externalId) {
        return externalId != null && forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.size();
    }

    @Override
    public int size() {
        return reverse.size();
    }

    private static void requireValid(String externalId) {
        if (externalId == null) {
            throw new IllegalArgumentException("External ID cannot be null");
        }
        if (externalId.isBlank()) {
            throw new IllegalArgumentException("External ID cannot be blank");
        }
    }
}
