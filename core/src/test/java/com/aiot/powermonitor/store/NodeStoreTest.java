/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.aiot.powermonitor.store;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class NodeStoreTest {

    private int capacity;
    private NodeStore store;

    @BeforeEach
    public void setUp() {
        capacity = 3;
        store = new NodeStore(capacity);
    }

    @Test
    public void testNew() {
        assertEquals(capacity, store.getCapacity());
        assertEquals(0, store.size());
    }

    @Test
    public void testAddNodes() {
        int root = store.addNode(0, 1.5, 4);
        int left = store.addLeaf(3);
        int right = store.addLeaf(1);
        store.setChildren(root, left, right);

        assertEquals(3, store.size());
        assertFalse(store.isLeaf(root));
        assertTrue(store.isLeaf(left));
        assertTrue(store.isLeaf(right));
        assertEquals(left, store.getLeftIndex(root));
        assertEquals(right, store.getRightIndex(root));
        assertEquals(0, store.getCutDimension(root));
        assertEquals(1.5, store.getCutValue(root));
        assertEquals(4, store.getMass(root));
        assertEquals(3, store.getMass(left));
        assertEquals(NodeStore.NULL, store.getCutDimension(left));
    }

    @Test
    public void testFull() {
        store.addLeaf(1);
        store.addLeaf(1);
        store.addLeaf(1);
        assertThrows(IllegalStateException.class, () -> store.addLeaf(1));
    }

    @Test
    public void testChildrenMustFollowParent() {
        store.addLeaf(1);
        int node = store.addNode(0, 0.0, 2);
        assertThrows(IllegalArgumentException.class, () -> store.setChildren(node, 0, 2));
    }

    @Test
    public void testArraysAreTrimmedToSize() {
        NodeStore large = new NodeStore(10);
        large.addNode(0, 2.0, 2);
        large.addLeaf(1);
        large.addLeaf(1);
        large.setChildren(0, 1, 2);

        assertArrayEquals(new int[] { 1, -1, -1 }, large.getLeftIndex());
        assertArrayEquals(new int[] { 2, -1, -1 }, large.getRightIndex());
        assertArrayEquals(new int[] { 0, -1, -1 }, large.getCutDimension());
        assertArrayEquals(new double[] { 2.0, 0.0, 0.0 }, large.getCutValue());
        assertArrayEquals(new int[] { 2, 1, 1 }, large.getMass());
    }

    @Test
    public void testRestore() {
        NodeStore restored = new NodeStore(new int[] { 1, -1, -1 }, new int[] { 2, -1, -1 }, new int[] { 0, -1, -1 },
                new double[] { 2.0, 0.0, 0.0 }, new int[] { 2, 1, 1 });
        assertEquals(3, restored.size());
        assertEquals(3, restored.getCapacity());
        assertEquals(2.0, restored.getCutValue(0));
        assertTrue(restored.isLeaf(2));
    }

    @Test
    public void testRestoreRejectsMalformedArrays() {
        // different lengths
        assertThrows(IllegalArgumentException.class, () -> new NodeStore(new int[] { -1 }, new int[] { -1, -1 },
                new int[] { -1 }, new double[] { 0.0 }, new int[] { 1 }));
        // one child only
        assertThrows(IllegalArgumentException.class, () -> new NodeStore(new int[] { 1, -1 }, new int[] { -1, -1 },
                new int[] { 0, -1 }, new double[] { 1.0, 0.0 }, new int[] { 1, 1 }));
        // child before parent
        assertThrows(IllegalArgumentException.class,
                () -> new NodeStore(new int[] { -1, 0, -1 }, new int[] { -1, 2, -1 }, new int[] { -1, 0, -1 },
                        new double[] { 0.0, 1.0, 0.0 }, new int[] { 1, 2, 1 }));
        // child out of range
        assertThrows(IllegalArgumentException.class,
                () -> new NodeStore(new int[] { 1, -1, -1 }, new int[] { 5, -1, -1 }, new int[] { 0, -1, -1 },
                        new double[] { 1.0, 0.0, 0.0 }, new int[] { 2, 1, 1 }));
        // NaN cut
        assertThrows(IllegalArgumentException.class,
                () -> new NodeStore(new int[] { 1, -1, -1 }, new int[] { 2, -1, -1 }, new int[] { 0, -1, -1 },
                        new double[] { Double.NaN, 0.0, 0.0 }, new int[] { 2, 1, 1 }));
        // negative mass
        assertThrows(IllegalArgumentException.class, () -> new NodeStore(new int[] { -1 }, new int[] { -1 },
                new int[] { -1 }, new double[] { 0.0 }, new int[] { -3 }));
        assertThrows(IllegalArgumentException.class,
                () -> new NodeStore(new int[0], new int[0], new int[0], new double[0], new int[0]));
        assertThrows(NullPointerException.class,
                () -> new NodeStore(null, new int[0], new int[0], new double[0], new int[0]));
    }
}
