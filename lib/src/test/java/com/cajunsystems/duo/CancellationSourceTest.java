package com.cajunsystems.duo;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSourceTest {

    @Test
    void testNoneIsNeverCancelled() {
        CancellationToken none = CancellationToken.none();
        AtomicInteger calls = new AtomicInteger(0);

        none.onCancel(calls::incrementAndGet).close();

        assertFalse(none.isCancelled());
        assertEquals(0, calls.get());
    }

    @Test
    void testCancelRunsCallbacksOnce() {
        CancellationSource source = new CancellationSource();
        AtomicInteger calls = new AtomicInteger(0);
        source.onCancel(calls::incrementAndGet);

        assertFalse(source.token().isCancelled());
        source.cancel();
        source.cancel();

        assertTrue(source.token().isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testCallbackRegisteredAfterCancelRunsImmediately() {
        CancellationSource source = new CancellationSource();
        source.cancel();
        AtomicInteger calls = new AtomicInteger(0);

        source.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testClosedRegistrationDoesNotRun() {
        CancellationSource source = new CancellationSource();
        AtomicInteger calls = new AtomicInteger(0);

        CancellationToken.Registration registration = source.onCancel(calls::incrementAndGet);
        registration.close();
        source.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void testParentCancelsChildren() {
        CancellationSource parent = new CancellationSource();
        CancellationSource child = parent.childSource();
        CancellationSource grandchild = child.childSource();
        AtomicInteger calls = new AtomicInteger(0);
        grandchild.onCancel(calls::incrementAndGet);

        parent.cancel();

        assertTrue(child.isCancelled());
        assertTrue(grandchild.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void testChildDoesNotCancelParent() {
        CancellationSource parent = new CancellationSource();
        CancellationSource child = parent.childSource();

        child.cancel();

        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
    }

    @Test
    void testChildOfCancelledSourceStartsCancelled() {
        CancellationSource parent = new CancellationSource();
        parent.cancel();

        assertTrue(parent.childSource().isCancelled());
    }

    @Test
    void testCancelledChildIsReleasedByParent() {
        CancellationSource parent = new CancellationSource();
        for (int i = 0; i < 100; i++) {
            parent.childSource().cancel();
        }

        assertEquals(0, parent.childCount());
        assertFalse(parent.isCancelled());
    }

    @Test
    void testClosedChildIsReleasedWithoutCancelling() {
        CancellationSource parent = new CancellationSource();
        AtomicInteger calls = new AtomicInteger(0);

        try (CancellationSource child = parent.childSource()) {
            child.onCancel(calls::incrementAndGet);
            assertEquals(1, parent.childCount());
        }

        assertEquals(0, parent.childCount());
        parent.cancel();
        assertEquals(0, calls.get());
    }

    @Test
    void testClosedChildStillSeesParentCancellation() {
        CancellationSource parent = new CancellationSource();
        CancellationSource child = parent.childSource();
        child.close();

        parent.cancel();

        assertTrue(child.isCancelled());
    }
}
