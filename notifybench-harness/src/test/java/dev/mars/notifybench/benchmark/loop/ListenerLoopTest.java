package dev.mars.notifybench.benchmark.loop;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.notifybench.client.connection.Notification;
import dev.mars.notifybench.client.exception.NotificationTimeoutException;
import dev.mars.notifybench.client.exception.UnexpectedNotificationException;
import dev.mars.notifybench.test.categories.TestCategories;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core tests for ListenerLoop validation against an in-memory connection.
 */
@Tag(TestCategories.CORE)
class ListenerLoopTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Test
    void testReceivesPayload42OnBench() {
        LoopbackConnection connection = new LoopbackConnection();
        connection.deliver("bench", "42");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.anyInteger());

        Notification notification = listener.receive(0);

        assertEquals("bench", notification.channel());
        assertEquals(42, Long.parseLong(notification.payload()));
    }

    @Test
    void testRoundTripWithNotifierInSequence() {
        LoopbackConnection connection = new LoopbackConnection();
        NotifierLoop notifier = new NotifierLoop(connection, "bench");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.sequence());

        notifier.run(100, Timer.builder("test").register(new SimpleMeterRegistry()));

        assertEquals(100, listener.run(100));
    }

    @Test
    void testWrongChannelFails() {
        LoopbackConnection connection = new LoopbackConnection();
        connection.deliver("elsewhere", "0");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.sequence());

        UnexpectedNotificationException e = assertThrows(UnexpectedNotificationException.class, () -> listener.receive(0));

        assertTrue(e.getMessage().startsWith("Did not receive expected notification"));
        assertEquals("elsewhere", e.getNotification().channel());
    }

    @Test
    void testNonIntegerPayloadFails() {
        LoopbackConnection connection = new LoopbackConnection();
        connection.deliver("bench", "hello");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.anyInteger());

        UnexpectedNotificationException e = assertThrows(UnexpectedNotificationException.class, () -> listener.receive(0));

        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    @Test
    void testOutOfSequencePayloadFails() {
        LoopbackConnection connection = new LoopbackConnection();
        connection.deliver("bench", "0");
        connection.deliver("bench", "2");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.sequence());

        UnexpectedNotificationException e = assertThrows(UnexpectedNotificationException.class, () -> listener.run(2));

        assertTrue(e.getMessage().contains("expected payload 1 at position 1"), e.getMessage());
    }

    @Test
    void testMissingNotificationTimesOut() {
        LoopbackConnection connection = new LoopbackConnection();
        connection.deliver("bench", "0");
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.sequence());

        assertThrows(NotificationTimeoutException.class, () -> listener.run(2));
    }

    @Test
    void testRepeatingSeriesAcceptsBatchPayloads() {
        LoopbackConnection connection = new LoopbackConnection();
        for (int batch = 0; batch < 3; batch++) {
            for (int n = 1; n <= 4; n++) {
                connection.deliver("bench", Integer.toString(n));
            }
        }
        ListenerLoop listener = new ListenerLoop(connection, "bench", TIMEOUT, PayloadExpectation.repeatingSeries(4));

        assertEquals(12, listener.run(12));
    }
}
