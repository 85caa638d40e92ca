package dev.mars.notifybench.client.connection;

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

import java.time.Duration;

/**
 * Blocking source of notifications for a connection that has issued LISTEN.
 */
public interface NotificationSource {

    /**
     * Blocks until the next notification arrives.
     *
     * @param timeout how long to wait
     * @return the next notification in delivery order
     * @throws dev.mars.notifybench.client.exception.NotificationTimeoutException if nothing arrives in time
     * @throws dev.mars.notifybench.client.exception.NotifyBenchException if the connection failed
     */
    Notification waitForNotification(Duration timeout);
}
