package io.hearthwarrio.pinpoint.core;

import io.hearthwarrio.pinpoint.core.tree.DocumentTree;
import io.hearthwarrio.pinpoint.core.tree.InsertionListener;
import io.hearthwarrio.pinpoint.core.tree.MalformedSelectorException;
import io.hearthwarrio.pinpoint.core.tree.TreeNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Document with scripted selector answers. Any selector not scripted matches nothing.
 */
public final class FakeTree implements DocumentTree {

    private final Map<String, List<TreeNode>> answers = new HashMap<>();
    private final Set<String> malformed = new HashSet<>();
    private final List<String> queries = new ArrayList<>();
    private final List<InsertionListener> listeners = new ArrayList<>();

    public FakeTree answer(String selector, TreeNode... matches) {
        answers.put(selector, Arrays.asList(matches));
        return this;
    }

    public FakeTree malformed(String selector) {
        malformed.add(selector);
        return this;
    }

    public void insert(TreeNode node, Instant at) {
        for (InsertionListener l : new ArrayList<>(listeners)) {
            l.onInsertion(node, at);
        }
    }

    public List<String> queries() {
        return queries;
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public List<TreeNode> querySelectorAll(String selector) {
        queries.add(selector);
        if (malformed.contains(selector)) {
            throw new MalformedSelectorException("cannot parse '" + selector + "'");
        }
        return answers.getOrDefault(selector, List.of());
    }

    @Override
    public Object documentKey() {
        return this;
    }

    @Override
    public void addInsertionListener(InsertionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeInsertionListener(InsertionListener listener) {
        listeners.remove(listener);
    }
}
