package com.nesh.catalog.hierarchy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Arena of tariff nodes addressed by key. Parent and child links are keys, resolved once at build time.
 */
public class TariffTree {
    private static final Comparator<TariffNode> BY_SORT_KEY = Comparator.comparing(TariffNode::getSortKey)
        .thenComparing(TariffNode::getKey);
    private static final int MAX_DEPTH = 16;

    private final Map<String, TariffNode> byKey;
    private final List<TariffNode> ordered;
    private final Map<String, List<TariffNode>> children;
    private final List<TariffNode> roots;
    private final NavigableMap<String, List<TariffNode>> byCode;
    private final NavigableMap<String, List<TariffNode>> byDigits;

    public TariffTree(Collection<TariffNode> nodes) {
        List<TariffNode> sorted = new ArrayList<>(nodes);
        sorted.sort(BY_SORT_KEY);
        Map<String, TariffNode> keyed = new LinkedHashMap<>();
        for (TariffNode node : sorted) {
            keyed.put(node.getKey(), node);
        }
        Map<String, List<TariffNode>> childMap = new LinkedHashMap<>();
        List<TariffNode> rootList = new ArrayList<>();
        NavigableMap<String, List<TariffNode>> codeIndex = new TreeMap<>();
        NavigableMap<String, List<TariffNode>> digitIndex = new TreeMap<>();
        for (TariffNode node : keyed.values()) {
            if (node.getParentKey() != null && keyed.containsKey(node.getParentKey())) {
                childMap.computeIfAbsent(node.getParentKey(), key -> new ArrayList<>()).add(node);
            } else {
                rootList.add(node);
            }
            codeIndex.computeIfAbsent(node.getCode(), key -> new ArrayList<>()).add(node);
            digitIndex.computeIfAbsent(node.getDigits(), key -> new ArrayList<>()).add(node);
        }
        this.byKey = Collections.unmodifiableMap(keyed);
        this.ordered = List.copyOf(keyed.values());
        Map<String, List<TariffNode>> frozenChildren = new LinkedHashMap<>();
        childMap.forEach((key, value) -> frozenChildren.put(key, List.copyOf(value)));
        this.children = Collections.unmodifiableMap(frozenChildren);
        this.roots = List.copyOf(rootList);
        this.byCode = codeIndex;
        this.byDigits = digitIndex;
    }

    public static TariffTree empty() {
        return new TariffTree(List.of());
    }

    public TariffNode get(String key) {
        return key == null ? null : byKey.get(key);
    }

    public int size() {
        return ordered.size();
    }

    public List<TariffNode> ordered() {
        return ordered;
    }

    public List<TariffNode> roots() {
        return roots;
    }

    public List<TariffNode> children(String key) {
        return children.getOrDefault(key, List.of());
    }

    public TariffNode parent(TariffNode node) {
        return node == null ? null : byKey.get(node.getParentKey());
    }

    /**
     * Parent chain of the node, root first. The node itself is not included.
     */
    public List<TariffNode> ancestors(TariffNode node) {
        List<TariffNode> chain = new ArrayList<>();
        TariffNode current = parent(node);
        while (current != null && chain.size() < MAX_DEPTH) {
            chain.add(current);
            current = parent(current);
        }
        Collections.reverse(chain);
        return chain;
    }

    public List<TariffNode> siblings(TariffNode node) {
        if (node == null) {
            return List.of();
        }
        List<TariffNode> pool;
        TariffNode parent = parent(node);
        if (parent != null) {
            pool = children(parent.getKey());
        } else {
            pool = new ArrayList<>();
            for (TariffNode root : roots) {
                if (root.getChapter().equals(node.getChapter())) {
                    pool.add(root);
                }
            }
        }
        List<TariffNode> siblings = new ArrayList<>(pool.size());
        for (TariffNode candidate : pool) {
            if (!candidate.getKey().equals(node.getKey())) {
                siblings.add(candidate);
            }
        }
        return siblings;
    }

    public List<TariffNode> inChapter(String chapter) {
        return findByDigitsPrefix(chapter);
    }

    public List<TariffNode> findByCodePrefix(String prefix) {
        return collect(byCode, prefix);
    }

    public List<TariffNode> findByDigitsPrefix(String prefix) {
        return collect(byDigits, prefix);
    }

    private List<TariffNode> collect(NavigableMap<String, List<TariffNode>> index, String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return List.of();
        }
        List<TariffNode> found = new ArrayList<>();
        for (List<TariffNode> nodes : index.subMap(prefix, true, prefix + Character.MAX_VALUE, false).values()) {
            found.addAll(nodes);
        }
        found.sort(BY_SORT_KEY);
        return found;
    }
}
