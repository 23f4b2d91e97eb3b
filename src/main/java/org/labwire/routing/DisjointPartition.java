package org.labwire.routing;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.jgrapht.alg.util.UnionFind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Partition of keyed element sets into the maximal number of mutually disjoint parts.
 *
 * <p>Inserting a set merges it with every part it intersects. The merged part is keyed by
 * the new key followed by the keys of the merged parts in partition order, and moves to
 * the end of the partition. Every insert opens a part in a {@link UnionFind} forest; the
 * forest roots carry the contributing keys and elements.</p>
 *
 * @param <K> key type.
 * @param <E> element type.
 */
final class DisjointPartition<K, E> {
    private static final int NO_PART = -1;

    private final UnionFind<Integer> forest = new UnionFind<>(new HashSet<>());
    private final Int2ObjectOpenHashMap<List<K>> keysByRoot = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectOpenHashMap<Set<E>> elementsByRoot = new Int2ObjectOpenHashMap<>();
    private final Object2IntOpenHashMap<E> partOfElement = new Object2IntOpenHashMap<>();
    private final IntLinkedOpenHashSet roots = new IntLinkedOpenHashSet();
    private int nextPart;

    DisjointPartition() {
        partOfElement.defaultReturnValue(NO_PART);
    }

    /**
     * Adds {@code elements} under {@code key}.
     *
     * @return the key list of the part now holding {@code elements}.
     */
    List<K> insert(Collection<? extends E> elements, K key) {
        IntLinkedOpenHashSet touched = new IntLinkedOpenHashSet();
        for (E element : elements) {
            int part = partOfElement.getInt(element);
            if (part != NO_PART) {
                touched.add(forest.find(part).intValue());
            }
        }

        int part = nextPart++;
        forest.addElement(part);
        List<K> keys = new ArrayList<>();
        keys.add(key);
        Set<E> members = new LinkedHashSet<>(elements);

        IntArrayList merged = new IntArrayList();
        for (int existing : roots) {
            if (touched.contains(existing)) {
                merged.add(existing);
            }
        }
        for (int i = 0; i < merged.size(); i++) {
            int existing = merged.getInt(i);
            keys.addAll(keysByRoot.remove(existing));
            members.addAll(elementsByRoot.remove(existing));
            roots.remove(existing);
            forest.union(existing, part);
        }

        int root = forest.find(part);
        keysByRoot.put(root, keys);
        elementsByRoot.put(root, members);
        roots.add(root);
        for (E element : elements) {
            if (!partOfElement.containsKey(element)) {
                partOfElement.put(element, part);
            }
        }
        return Collections.unmodifiableList(keys);
    }

    /**
     * Key lists of the current parts, in partition order.
     */
    List<List<K>> keys() {
        List<List<K>> result = new ArrayList<>(roots.size());
        for (int root : roots) {
            result.add(Collections.unmodifiableList(keysByRoot.get(root)));
        }
        return result;
    }

    /**
     * Element sets of the current parts, aligned with {@link #keys()}.
     */
    List<Set<E>> values() {
        List<Set<E>> result = new ArrayList<>(roots.size());
        for (int root : roots) {
            result.add(Collections.unmodifiableSet(elementsByRoot.get(root)));
        }
        return result;
    }

    int size() {
        return roots.size();
    }
}
