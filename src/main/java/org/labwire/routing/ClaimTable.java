package org.labwire.routing;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;

/**
 * Terminal claims per graph element, keyed by store index.
 *
 * <p>An element without an entry has no claims. Sets keep claim insertion order.</p>
 */
final class ClaimTable {
    private final Int2ObjectOpenHashMap<ObjectLinkedOpenHashSet<String>> claims = new Int2ObjectOpenHashMap<>();

    void add(int index, String terminalId) {
        ObjectLinkedOpenHashSet<String> terminals = claims.get(index);
        if (terminals == null) {
            terminals = new ObjectLinkedOpenHashSet<>();
            claims.put(index, terminals);
        }
        terminals.add(terminalId);
    }

    /**
     * Removes a claim.
     *
     * @return whether the element is left without claims.
     * @throws ClaimUnderflowException if {@code terminalId} holds no claim on the element.
     */
    boolean remove(int index, String terminalId, Object element) {
        ObjectLinkedOpenHashSet<String> terminals = claims.get(index);
        if (terminals == null || !terminals.remove(terminalId)) {
            throw new ClaimUnderflowException(terminalId + " holds no claim on " + element);
        }
        if (terminals.isEmpty()) {
            claims.remove(index);
            return true;
        }
        return false;
    }

    boolean isClaimedBy(int index, String terminalId) {
        ObjectLinkedOpenHashSet<String> terminals = claims.get(index);
        return terminals != null && terminals.contains(terminalId);
    }

    /**
     * Whether the element is free or claimed by at least one of {@code terminalIds}.
     */
    boolean isAvailableTo(int index, Collection<String> terminalIds) {
        ObjectLinkedOpenHashSet<String> terminals = claims.get(index);
        if (terminals == null) {
            return true;
        }
        for (String terminalId : terminalIds) {
            if (terminals.contains(terminalId)) {
                return true;
            }
        }
        return false;
    }

    Set<String> terminalsAt(int index) {
        ObjectLinkedOpenHashSet<String> terminals = claims.get(index);
        return terminals == null ? Collections.emptySet() : Collections.unmodifiableSet(terminals);
    }

    void clear() {
        claims.clear();
    }
}
