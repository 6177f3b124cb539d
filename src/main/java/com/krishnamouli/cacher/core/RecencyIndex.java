package com.krishnamouli.cacher.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keys ordered by last touch, most recent at the front.
 * A doubly-linked list plus a key-to-node map keeps push, promote and
 * removal by key at O(1). Not thread-safe.
 */
public class RecencyIndex<K> {

    private final Map<K, Node<K>> nodes;
    private Node<K> head;
    private Node<K> tail;

    public RecencyIndex() {
        this.nodes = new HashMap<>();
    }

    /**
     * Adds the key at the front. A key that is already indexed is moved
     * instead, so every key appears at most once.
     */
    public void pushFront(K key) {
        if (moveToFront(key)) {
            return;
        }
        Node<K> node = new Node<>(key);
        nodes.put(key, node);
        linkFirst(node);
    }

    public boolean moveToFront(K key) {
        Node<K> node = nodes.get(key);
        if (node == null) {
            return false;
        }
        if (node != head) {
            unlink(node);
            linkFirst(node);
        }
        return true;
    }

    public boolean remove(K key) {
        Node<K> node = nodes.remove(key);
        if (node == null) {
            return false;
        }
        unlink(node);
        return true;
    }

    /**
     * @return the most recently touched key, or null when empty
     */
    public K front() {
        return head != null ? head.key : null;
    }

    /**
     * @return the least recently touched key, or null when empty
     */
    public K back() {
        return tail != null ? tail.key : null;
    }

    public boolean contains(K key) {
        return nodes.containsKey(key);
    }

    public int size() {
        return nodes.size();
    }

    public void clear() {
        nodes.clear();
        head = null;
        tail = null;
    }

    // Front to back
    public List<K> keys() {
        List<K> ordered = new ArrayList<>(nodes.size());
        for (Node<K> node = head; node != null; node = node.next) {
            ordered.add(node.key);
        }
        return ordered;
    }

    private void linkFirst(Node<K> node) {
        node.prev = null;
        node.next = head;
        if (head != null) {
            head.prev = node;
        } else {
            tail = node;
        }
        head = node;
    }

    private void unlink(Node<K> node) {
        if (node.prev != null) {
            node.prev.next = node.next;
        } else {
            head = node.next;
        }
        if (node.next != null) {
            node.next.prev = node.prev;
        } else {
            tail = node.prev;
        }
        node.prev = null;
        node.next = null;
    }

    private static final class Node<K> {
        private final K key;
        private Node<K> prev;
        private Node<K> next;

        private Node(K key) {
            this.key = key;
        }
    }
}
