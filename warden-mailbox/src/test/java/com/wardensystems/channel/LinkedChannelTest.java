package com.wardensystems.channel;

import com.wardensystems.QueueOverflowException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class LinkedChannelTest {

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LinkedChannel<String>("inbox", 0));
    }

    @Test
    void testOfferRejectsNull() {
        LinkedChannel<String> channel = new LinkedChannel<>("inbox", 4);
        assertThrows(NullPointerException.class, () -> channel.offer(null));
    }

    @Test
    void testFifoOrder() throws InterruptedException {
        LinkedChannel<String> channel = new LinkedChannel<>("inbox", 10);
        channel.send("a");
        channel.send("b");
        channel.send("c");

        assertEquals("a", channel.receive());
        assertEquals(Optional.of("b"), channel.receive(Duration.ofMillis(10)));
        assertEquals("c", channel.receive());
        assertTrue(channel.isEmpty());
    }

    @Test
    void testSendOnFullChannelThrowsOverflow() {
        LinkedChannel<Integer> channel = new LinkedChannel<>("orders-inbox", 2);
        channel.send(1);
        channel.send(2);

        QueueOverflowException overflow = assertThrows(QueueOverflowException.class, () -> channel.send(3));
        assertEquals(2, overflow.getCapacity());
        assertEquals("orders-inbox", overflow.getServiceName());
        assertFalse(channel.offer(3));
        assertEquals(2, channel.size());
        assertEquals(0, channel.remainingCapacity());
    }

    @Test
    void testReceiveTimesOutWithEmpty() throws InterruptedException {
        LinkedChannel<String> channel = new LinkedChannel<>("inbox", 4);

        long start = System.nanoTime();
        Optional<String> message = channel.receive(Duration.ofMillis(100));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(message.isEmpty());
        assertTrue(elapsedMillis >= 90, "returned after " + elapsedMillis + "ms");
    }

    @Test
    void testDrainReturnsEverythingInOrder() {
        LinkedChannel<String> channel = new LinkedChannel<>("inbox", 8);
        channel.send("x");
        channel.send("y");

        assertEquals(List.of("x", "y"), channel.drain());
        assertTrue(channel.drain().isEmpty());
        assertEquals(8, channel.remainingCapacity());
    }

    @Test
    @Timeout(5)
    void testBlockedReceiveIsInterruptible() throws Exception {
        LinkedChannel<String> channel = new LinkedChannel<>("inbox", 4);
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);

        Thread waiter = new Thread(() -> {
            started.countDown();
            try {
                channel.receive();
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
        });
        waiter.start();
        started.await();
        Thread.sleep(50);
        waiter.interrupt();
        waiter.join(1000);

        assertTrue(interrupted.get());
    }
}
