/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.traverse.pathing;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Binary min-heap of nodes ordered by f. Every node remembers its heap slot, so a node whose f changes while queued is
 * re-sifted in place rather than removed and reinserted. Ties are broken by heap position.
 *
 * @author hal.hildebrand
 */
public class OpenList {

    private static final int DEFAULT_CAPACITY = 64;

    private Node[] heap;
    private int    size;

    public OpenList() {
        this(DEFAULT_CAPACITY);
    }

    public OpenList(int initialCapacity) {
        heap = new Node[Math.max(1, initialCapacity)];
    }

    public boolean contains(Node node) {
        int i = node.getHeapIndex();
        return i >= 0 && i < size && heap[i] == node;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return the node with the smallest f, without removing it
     */
    public Node peek() {
        if (size == 0) {
            throw new NoSuchElementException("Open list is empty");
        }
        return heap[0];
    }

    /**
     * Remove and return the node with the smallest f.
     */
    public Node pop() {
        Node top = peek();
        size--;
        if (size > 0) {
            place(heap[size], 0);
            heap[size] = null;
            siftDown(0);
        } else {
            heap[0] = null;
        }
        top.setHeapIndex(Node.NONE);
        return top;
    }

    public void push(Node node) {
        if (contains(node)) {
            throw new IllegalStateException("Already queued: " + node);
        }
        if (size == heap.length) {
            heap = Arrays.copyOf(heap, size * 2);
        }
        place(node, size++);
        siftUp(node.getHeapIndex());
    }

    public int size() {
        return size;
    }

    /**
     * Restore heap order after the node's f changed while it was queued.
     *
     * @throws IllegalArgumentException if the node is not queued
     */
    public void update(Node node) {
        if (!contains(node)) {
            throw new IllegalArgumentException("Not queued: " + node);
        }
        int i = node.getHeapIndex();
        siftUp(i);
        if (node.getHeapIndex() == i) {
            siftDown(i);
        }
    }

    private void place(Node node, int i) {
        heap[i] = node;
        node.setHeapIndex(i);
    }

    private void siftDown(int i) {
        Node node = heap[i];
        int half = size >>> 1;
        while (i < half) {
            int child = 2 * i + 1;
            int right = child + 1;
            if (right < size && heap[right].getF() < heap[child].getF()) {
                child = right;
            }
            if (node.getF() <= heap[child].getF()) {
                break;
            }
            place(heap[child], i);
            i = child;
        }
        place(node, i);
    }

    private void siftUp(int i) {
        Node node = heap[i];
        while (i > 0) {
            int parent = (i - 1) >>> 1;
            if (heap[parent].getF() <= node.getF()) {
                break;
            }
            place(heap[parent], i);
            i = parent;
        }
        place(node, i);
    }
}
