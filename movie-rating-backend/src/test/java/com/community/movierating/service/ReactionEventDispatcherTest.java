package com.community.movierating.service;

import com.community.movierating.dto.ReactionEvent;
import com.community.movierating.dto.ReactionOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ReactionEventDispatcherTest {

    private ReactionEventRouter router;
    private ExecutorService executor;
    private ReactionEventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        router = mock(ReactionEventRouter.class);
        executor = Executors.newFixedThreadPool(4);
        dispatcher = new ReactionEventDispatcher(router, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static ReactionEvent event(long messageId, String emoji) {
        return new ReactionEvent(42L, messageId, 10L, 1L, emoji);
    }

    @Test
    void testEventsOnSameMessageRunInArrivalOrder() throws Exception {
        List<String> applied = new CopyOnWriteArrayList<>();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);

        when(router.onReactionAdd(any())).thenAnswer(invocation -> {
            firstStarted.countDown();
            releaseFirst.await(5, TimeUnit.SECONDS);
            applied.add("add");
            return ReactionOutcome.ACCEPTED;
        });
        when(router.onReactionRemove(any())).thenAnswer(invocation -> {
            applied.add("remove");
            return ReactionOutcome.REMOVED;
        });

        CompletableFuture<ReactionOutcome> add = dispatcher.dispatchAdd(event(5000L, "7️⃣"));
        assertTrue(firstStarted.await(5, TimeUnit.SECONDS));
        CompletableFuture<ReactionOutcome> remove = dispatcher.dispatchRemove(event(5000L, "7️⃣"));

        // the remove is queued behind the blocked add
        Thread.sleep(100);
        assertTrue(applied.isEmpty());
        assertFalse(remove.isDone());

        releaseFirst.countDown();
        assertEquals(ReactionOutcome.ACCEPTED, add.get(5, TimeUnit.SECONDS));
        assertEquals(ReactionOutcome.REMOVED, remove.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("add", "remove"), applied);
    }

    @Test
    void testEventsOnDifferentMessagesRunInParallel() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        when(router.onReactionAdd(any())).thenAnswer(invocation -> {
            bothRunning.countDown();
            // each handler waits for the other; this only finishes if they overlap
            return bothRunning.await(5, TimeUnit.SECONDS) ? ReactionOutcome.ACCEPTED : ReactionOutcome.FAILED_PERSISTENCE;
        });

        CompletableFuture<ReactionOutcome> first = dispatcher.dispatchAdd(event(5000L, "7️⃣"));
        CompletableFuture<ReactionOutcome> second = dispatcher.dispatchAdd(event(6000L, "8️⃣"));

        assertEquals(ReactionOutcome.ACCEPTED, first.get(10, TimeUnit.SECONDS));
        assertEquals(ReactionOutcome.ACCEPTED, second.get(10, TimeUnit.SECONDS));
    }

    @Test
    void testFailedEventDoesNotBlockFollowingEvents() throws Exception {
        when(router.onReactionAdd(any())).thenThrow(new IllegalStateException("boom"));
        when(router.onReactionRemove(any())).thenReturn(ReactionOutcome.IGNORED_STALE);

        CompletableFuture<ReactionOutcome> add = dispatcher.dispatchAdd(event(5000L, "7️⃣"));
        CompletableFuture<ReactionOutcome> remove = dispatcher.dispatchRemove(event(5000L, "7️⃣"));

        assertEquals(ReactionOutcome.IGNORED_STALE, remove.get(5, TimeUnit.SECONDS));
        assertTrue(add.isCompletedExceptionally());
    }

    @Test
    void testChainsAreReleasedWhenIdle() throws Exception {
        when(router.onReactionAdd(any())).thenReturn(ReactionOutcome.ACCEPTED);

        dispatcher.dispatchAdd(event(5000L, "7️⃣")).get(5, TimeUnit.SECONDS);
        dispatcher.dispatchAdd(event(6000L, "7️⃣")).get(5, TimeUnit.SECONDS);

        // the removal callback runs right after completion; give it a moment
        long deadline = System.currentTimeMillis() + 2000;
        while (dispatcher.pendingChains() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, dispatcher.pendingChains());
    }
}
