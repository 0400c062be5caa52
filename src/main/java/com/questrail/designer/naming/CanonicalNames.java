package com.questrail.designer.naming;

import com.questrail.designer.api.Node;
import com.questrail.designer.api.NodeKind;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Document-wide canonical naming of nodes.
 *
 * Fallback names are {@code "<kind>_<index>"}, where the index counts nodes of
 * the same kind in document order. The generator and the document validator
 * both name nodes through this class so that they always agree.
 */
public final class CanonicalNames
{
    private CanonicalNames() {}

    /**
     * Returns {@code nodeId -> canonical name} for every node of {@code kind}, in
     * document order.
     */
    public static Map<String, String> of(Collection<Node> nodes, NodeKind kind) {
        Map<String, String> names = new LinkedHashMap<>();
        int index = 0;
        for (Node n : nodes) {
            if (n.is(kind)) {
                names.put(n.id(), IdentifierNormalizer.normalize(n.label(), kind.wireName() + "_" + index));
                index++;
            }
        }
        return names;
    }

    /**
     * Returns the canonical names that occur more than once, in order of first
     * repetition.
     */
    public static Set<String> duplicates(Collection<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> dupes = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                dupes.add(name);
            }
        }
        return dupes;
    }
}
