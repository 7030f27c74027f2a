package com.gofixture.dump;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * References on the current traversal path (pointers and the objects behind Java slices,
 * maps and structs), each with the depth it was entered at.
 *
 * A reference is circular only when it is already on the path at a shallower depth; the
 * same object reached again through a sibling branch is rendered in full.
 */
final class PointerChain {

    private final Map<Object, Integer> entered = new IdentityHashMap<>();

    /** Forgets references entered at {@code depth} or deeper, i.e. those of finished branches. */
    void purgeFrom(int depth) {
        entered.values().removeIf(d -> d >= depth);
    }

    /**
     * Records {@code address} at {@code depth}.
     *
     * @return true if it was already entered at a shallower depth (a cycle)
     */
    boolean enter(Object address, int depth) {
        Integer seen = entered.get(address);
        if (seen != null && seen < depth) {
            return true;
        }
        entered.put(address, depth);
        return false;
    }

    int size() {
        return entered.size();
    }
}
