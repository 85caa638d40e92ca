package dev.mars.notifybench.client.exception;

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

/**
 * Thrown when a received notification has the wrong channel, an unparsable payload
 * or a payload out of sequence.
 */
public class UnexpectedNotificationException extends NotifyBenchException {

    private final transient Notification notification;

    public UnexpectedNotificationException(String reason, Notification notification) {
        super("Did not receive expected notification: " + reason + " (got " + notification + ")");
        this.notification = notification;
    }

    public UnexpectedNotificationException(String reason, Notification notification, Throwable cause) {
        super("Did not receive expected notification: " + reason + " (got " + notification + ")", cause);
        this.notification = notification;
    }

    public Notification getNotification() {
        return notification;
    }
}
