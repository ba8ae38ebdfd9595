package io.docfeed.cluster.membership.gossip.impl;

import io.docfeed.cluster.membership.member.Member;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SwimGossipServiceTest {

    private static final InetSocketAddress SENDER = new InetSocketAddress("127.0.0.1", 7000);

    @Test
    void decodesFreshHeartbeat() {
        final long now = System.currentTimeMillis();
        final ByteBuf b = SwimGossipService.encode("node-A", now);
        try {
            final Member m = SwimGossipService.decode(b, SENDER, now + 10);
            assertNotNull(m);
            assertEquals("node-A", m.nodeTag());
            assertEquals(SENDER, m.address());
            assertEquals(now, m.timestampMillis());
        } finally {
            b.release();
        }
    }

    @Test
    void dropsExpiredHeartbeat() {
        final ByteBuf b = SwimGossipService.encode("A", 1_000L);
        try {
            assertNull(SwimGossipService.decode(b, SENDER, 10_000L));
        } finally {
            b.release();
        }
    }

    @Test
    void dropsMalformedPackets() {
        final ByteBuf empty = Unpooled.buffer(0);
        final ByteBuf truncated = Unpooled.buffer().writeByte(5).writeBytes(new byte[]{'A', 'B'});
        try {
            assertNull(SwimGossipService.decode(empty, SENDER, 0L));
            assertNull(SwimGossipService.decode(truncated, SENDER, 0L));
        } finally {
            empty.release();
            truncated.release();
        }
    }

    @Test
    void rejectsOverlongTag() {
        assertThrows(IllegalArgumentException.class,
                () -> new SwimGossipService("x".repeat(300), SENDER, List.of(), tag -> { }));
    }

    @Test
    void peersExchangeHeartbeats() throws Exception {
        final int portB;
        try (DatagramSocket probe = new DatagramSocket(0)) {
            portB = probe.getLocalPort();
        }
        final CountDownLatch heardA = new CountDownLatch(1);
        final CountDownLatch heardB = new CountDownLatch(1);

        final SwimGossipService b = new SwimGossipService("B", new InetSocketAddress("127.0.0.1", portB), List.of(),
                tag -> { if (tag.equals("A")) heardA.countDown(); });
        final SwimGossipService a = new SwimGossipService("A", new InetSocketAddress("127.0.0.1", 0),
                List.of(new InetSocketAddress("127.0.0.1", portB)),
                tag -> { if (tag.equals("B")) heardB.countDown(); });
        try {
            b.start();
            a.start();
            assertTrue(heardA.await(5, TimeUnit.SECONDS), "B never heard from A");
            // B learned A's address from the packet and gossips back
            assertTrue(heardB.await(5, TimeUnit.SECONDS), "A never heard from B");
            assertTrue(b.view().containsKey("A"));
        } finally {
            a.close();
            b.close();
        }
    }
}
