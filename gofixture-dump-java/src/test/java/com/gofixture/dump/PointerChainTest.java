package com.gofixture.dump;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PointerChainTest {

    @Test
    void reenteringAtDeeperLevelIsCycle() {
        PointerChain chain = new PointerChain();
        Object a = new Object();
        assertFalse(chain.enter(a, 0));
        assertTrue(chain.enter(a, 2));
    }

    @Test
    void reenteringAtSameLevelIsNotCycle() {
        PointerChain chain = new PointerChain();
        Object a = new Object();
        assertFalse(chain.enter(a, 1));
        assertFalse(chain.enter(a, 1));
    }

    @Test
    void purgeForgetsFinishedBranches() {
        PointerChain chain = new PointerChain();
        Object root = new Object();
        Object child = new Object();
        chain.enter(root, 0);
        chain.enter(child, 1);
        chain.purgeFrom(1);
        assertEquals(1, chain.size());
        assertFalse(chain.enter(child, 2));
        assertTrue(chain.enter(root, 2));
    }

    @Test
    void identityNotEquality() {
        PointerChain chain = new PointerChain();
        chain.enter(new String("same"), 0);
        assertFalse(chain.enter(new String("same"), 1));
    }
}
