package com.questrail.peerlink.core;

import com.questrail.peerlink.api.ConnectorClosedException;
import com.questrail.peerlink.api.LinkTransportException;
import com.questrail.peerlink.api.Message;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class InboundQueueTest {

    @Test
    void deliversInInsertionOrder() throws InterruptedException {
        InboundQueue queue = new InboundQueue();
        for (int i = 0; i < 100; i++) {
            assertTrue(queue.put(Message.of("m" + i)));
        }

        for (int i = 0; i < 100; i++) {
            assertEquals("m" + i, queue.take().tag());
        }
        assertEquals(0, queue.size());
    }

    @Test
    void takeBlocksUntilPut() throws Exception {
        InboundQueue queue = new InboundQueue();
        CompletableFuture<Message> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(100);
        assertFalse(taken.isDone());

        queue.put(Message.of("late"));
        assertEquals("late", taken.get(2, TimeUnit.SECONDS).tag());
    }

    @Test
    void timedPollReturnsEmptyWhenIdle() throws InterruptedException {
        InboundQueue queue = new InboundQueue();

        assertTrue(queue.poll(Duration.ofMillis(50)).isEmpty());
        assertTrue(queue.poll().isEmpty());
    }

    @Test
    void closeReleasesBlockedTakers() throws Exception {
        InboundQueue queue = new InboundQueue();
        CompletableFuture<Message> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);

        queue.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> taken.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ConnectorClosedException.class, e.getCause());
    }

    @Test
    void closeDropsQueuedAndLaterMessages() {
        InboundQueue queue = new InboundQueue();
        queue.put(Message.of("queued"));

        queue.close();

        assertEquals(0, queue.size());
        assertFalse(queue.put(Message.of("after")));
        assertThrows(ConnectorClosedException.class, queue::poll);
    }

    @Test
    void linkLossDrainsQueuedMessagesBeforeFailing() throws InterruptedException {
        InboundQueue queue = new InboundQueue();
        queue.put(Message.of("first"));
        queue.put(Message.of("second"));

        IOException cause = new IOException("reset");
        queue.markLinkLost(cause);

        assertEquals("first", queue.take().tag());
        assertEquals("second", queue.take().tag());
        LinkTransportException e = assertThrows(LinkTransportException.class, queue::take);
        assertSame(cause, e.getCause());
    }

    @Test
    void linkLossWakesIdleWaiter() throws Exception {
        InboundQueue queue = new InboundQueue();
        CompletableFuture<Message> taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.poll(Duration.ofSeconds(10)).orElse(null);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);

        queue.markLinkLost(null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> taken.get(2, TimeUnit.SECONDS));
        assertInstanceOf(LinkTransportException.class, e.getCause());
    }
}
