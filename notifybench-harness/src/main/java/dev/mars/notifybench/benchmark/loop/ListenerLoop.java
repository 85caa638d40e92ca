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
import dev.mars.notifybench.client.connection.NotificationSource;
import dev.mars.notifybench.client.exception.UnexpectedNotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Receives and validates notifications on one channel.
 *
 * <p>Each received notification must be on the subscribed channel, carry an integer
 * payload, and match the {@link PayloadExpectation} for its position. The first
 * timeout or mismatch ends the loop with an exception.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ListenerLoop {

    private static final Logger logger = LoggerFactory.getLogger(ListenerLoop.class);

    private final NotificationSource source;
    private final String channel;
    private final Duration waitTimeout;
    private final PayloadExpectation expectation;

    public ListenerLoop(NotificationSource source, String channel, Duration waitTimeout, PayloadExpectation expectation) {
        this.source = source;
        this.channel = channel;
        this.waitTimeout = waitTimeout;
        this.expectation = expectation;
    }

    /**
     * Waits for the notification at position {@code index} and validates it.
     *
     * @return the validated notification
     * @throws dev.mars.notifybench.client.exception.NotificationTimeoutException if none arrives in time
     * @throws UnexpectedNotificationException if it fails validation
     */
    public Notification receive(int index) {
        Notification notification = source.waitForNotification(waitTimeout);

        if (!channel.equals(notification.channel())) {
            throw new UnexpectedNotificationException("expected channel '" + channel + "'", notification);
        }

        long payload;
        try {
            payload = Long.parseLong(notification.payload());
        } catch (NumberFormatException e) {
            throw new UnexpectedNotificationException("payload is not an integer", notification, e);
        }

        if (!expectation.matches(index, payload)) {
            throw new UnexpectedNotificationException(
                    "expected payload " + expectation.describe(index) + " at position " + index, notification);
        }
        return notification;
    }

    /**
     * Receives {@code count} notifications.
     *
     * @return the number of notifications received, always {@code count} on return
     */
    public int run(int count) {
        logger.debug("Listening for {} notifications on channel '{}' ({})", count, channel, expectation);
        for (int i = 0; i < count; i++) {
            receive(i);
        }
        return count;
    }

    public String getChannel() {
        return channel;
    }
}
