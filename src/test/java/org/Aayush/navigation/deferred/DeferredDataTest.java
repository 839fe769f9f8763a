package org.Aayush.navigation.deferred;

import org.Aayush.navigation.core.signal.AbortController;
import org.Aayush.navigation.core.signal.AbortSignal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DeferredData Tests")
class DeferredDataTest {

    private static Map<String, Object> values(Object... keysAndValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            values.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return values;
    }

    @Test
    @DisplayName("Plain values leave the record done from the start")
    void testPlainValuesAreDone() throws Exception {
        DeferredData deferred = DeferredData.defer(values("a", 1, "b", "two"));

        assertTrue(deferred.isDone());
        assertTrue(deferred.pendingKeys().isEmpty());
        assertEquals(Map.of("a", 1, "b", "two"), deferred.unwrappedData());
        assertFalse(deferred.resolveData(AbortSignal.never()).get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Completion stages are tracked until they settle")
    void testTracksPendingValues() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        DeferredData deferred = DeferredData.defer(values("fast", "now", "slow", slow));

        assertFalse(deferred.isDone());
        assertEquals(Set.of("slow"), deferred.pendingKeys());
        TrackedValue tracked = assertInstanceOf(TrackedValue.class, deferred.data().get("slow"));
        assertEquals(TrackedValue.State.PENDING, tracked.state());

        CompletableFuture<Boolean> resolved = deferred.resolveData(AbortSignal.never());
        slow.complete("later");

        assertFalse(resolved.get(1, TimeUnit.SECONDS));
        assertTrue(deferred.isDone());
        assertEquals(TrackedValue.State.RESOLVED, tracked.state());
        assertEquals(Map.of("fast", "now", "slow", "later"), deferred.unwrappedData());
    }

    @Test
    @DisplayName("unwrappedData rethrows the first rejection")
    void testUnwrapRethrowsRejection() {
        IllegalStateException failure = new IllegalStateException("no data");
        DeferredData deferred = DeferredData.defer(values("bad", CompletableFuture.failedFuture(failure)));

        assertTrue(deferred.isDone());
        IllegalStateException thrown = assertThrows(IllegalStateException.class, deferred::unwrappedData);
        assertSame(failure, thrown);
    }

    @Test
    @DisplayName("unwrappedData refuses unsettled records")
    void testUnwrapPendingFails() {
        DeferredData deferred = DeferredData.defer(values("slow", new CompletableFuture<>()));

        assertThrows(IllegalStateException.class, deferred::unwrappedData);
    }

    @Test
    @DisplayName("Cancel marks the record done and aborts awaiters")
    void testCancel() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        DeferredData deferred = DeferredData.defer(values("slow", slow));
        List<Boolean> notifications = new CopyOnWriteArrayList<>();
        CompletableFuture<Boolean> resolved = deferred.resolveData(AbortSignal.never());

        deferred.cancel();

        assertTrue(resolved.get(1, TimeUnit.SECONDS));
        assertTrue(deferred.isDone());
        assertTrue(deferred.isAborted());
        TrackedValue tracked = (TrackedValue) deferred.data().get("slow");
        assertEquals(TrackedValue.State.CANCELLED, tracked.state());
        assertInstanceOf(AbortedDeferredException.class, tracked.error());

        deferred.subscribe(notifications::add);
        slow.complete("too late");
        assertTrue(notifications.isEmpty());
        assertNull(tracked.data());
        assertThrows(AbortedDeferredException.class, deferred::unwrappedData);
    }

    @Test
    @DisplayName("Cancel after settlement leaves settled values untouched")
    void testCancelAfterSettle() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        IllegalStateException failure = new IllegalStateException("no data");
        CompletableFuture<String> failing = new CompletableFuture<>();
        DeferredData deferred = DeferredData.defer(values("slow", slow, "failing", failing));
        slow.complete("value");
        failing.completeExceptionally(failure);
        assertTrue(deferred.isDone());

        deferred.cancel();

        TrackedValue resolved = (TrackedValue) deferred.data().get("slow");
        assertEquals(TrackedValue.State.RESOLVED, resolved.state());
        assertEquals("value", resolved.data());
        assertNull(resolved.error());
        assertEquals("value", resolved.future().get(1, TimeUnit.SECONDS));
        TrackedValue rejected = (TrackedValue) deferred.data().get("failing");
        assertEquals(TrackedValue.State.REJECTED, rejected.state());
        assertSame(failure, rejected.error());
        assertSame(failure, assertThrows(IllegalStateException.class, deferred::unwrappedData));
    }

    @Test
    @DisplayName("Cancel after full resolution still unwraps")
    void testUnwrapAfterLateCancel() throws Exception {
        CompletableFuture<String> slow = new CompletableFuture<>();
        DeferredData deferred = DeferredData.defer(values("fast", 1, "slow", slow));
        slow.complete("later");

        deferred.cancel();

        assertEquals(Map.of("fast", 1, "slow", "later"), deferred.unwrappedData());
    }

    @Test
    @DisplayName("Aborting the awaiting signal cancels the record")
    void testSignalAbortCancels() throws Exception {
        DeferredData deferred = DeferredData.defer(values("slow", new CompletableFuture<>()));
        AbortController controller = new AbortController();

        CompletableFuture<Boolean> resolved = deferred.resolveData(controller.signal());
        controller.abort();

        assertTrue(resolved.get(1, TimeUnit.SECONDS));
        assertTrue(deferred.isAborted());
        assertTrue(deferred.resolveData(AbortSignal.never()).get(1, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Subscriber hears each settlement")
    void testSubscriberNotifications() {
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();
        DeferredData deferred = DeferredData.defer(values("first", first, "second", second));
        List<Boolean> notifications = new CopyOnWriteArrayList<>();
        deferred.subscribe(notifications::add);

        first.complete("1");
        assertFalse(deferred.isDone());
        second.complete("2");

        assertEquals(List.of(false, false), notifications);
        assertTrue(deferred.isDone());
    }
}
