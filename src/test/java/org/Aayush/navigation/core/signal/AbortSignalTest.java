package org.Aayush.navigation.core.signal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AbortSignal Tests")
class AbortSignalTest {

    @Test
    @DisplayName("Listeners run once on abort")
    void testListenersRunOnce() {
        AbortController controller = new AbortController();
        AtomicInteger calls = new AtomicInteger();
        controller.signal().onAbort(calls::incrementAndGet);

        controller.abort();
        controller.abort();

        assertTrue(controller.signal().isAborted());
        assertTrue(controller.signal().whenAborted().isDone());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Late listeners run immediately")
    void testLateListener() {
        AbortController controller = new AbortController();
        controller.abort();
        AtomicInteger calls = new AtomicInteger();

        controller.signal().onAbort(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Removed listeners are not called")
    void testRemoveListener() {
        AbortController controller = new AbortController();
        AtomicInteger calls = new AtomicInteger();
        Runnable remove = controller.signal().onAbort(calls::incrementAndGet);

        remove.run();
        controller.abort();

        assertEquals(0, calls.get());
        assertFalse(AbortSignal.never().isAborted());
    }
}
