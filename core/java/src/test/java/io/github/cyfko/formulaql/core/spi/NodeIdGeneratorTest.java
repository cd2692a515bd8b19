package io.github.cyfko.formulaql.core.spi;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdGeneratorTest {

    @Test
    void sequentialIdsCountFromOne() {
        NodeIdGenerator ids = NodeIdGenerator.sequential("n");

        assertEquals("n1", ids.nextId());
        assertEquals("n2", ids.nextId());
        assertEquals("m1", NodeIdGenerator.sequential("m").nextId());
    }

    @Test
    void randomIdsAreDistinct() {
        NodeIdGenerator ids = NodeIdGenerator.random();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            assertTrue(seen.add(ids.nextId()));
        }
        assertTrue(seen.iterator().next().startsWith("node_"));
    }

    @Test
    void blankPrefixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeIdGenerator.sequential(" "));
    }
}
