package dev.mars.notifybench.benchmark.scenario;

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

import dev.mars.notifybench.benchmark.loop.ListenerLoop;
import dev.mars.notifybench.benchmark.loop.NotifierLoop;
import dev.mars.notifybench.benchmark.loop.PayloadExpectation;
import dev.mars.notifybench.client.connection.NotifyConnection;
import io.micrometer.core.instrument.Timer;

/**
 * One thread alternates notify then wait, so exactly one notification is in flight.
 * Each iteration is a full round trip.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ManualSequentialListenNotifyScenario extends AbstractScenario {

    public static final String NAME = "ManualSequentialListenNotify";

    private NotifierLoop notifier;
    private ListenerLoop listener;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Sequential notify/wait round trips over two connections";
    }

    @Override
    protected void doSetUp(BenchmarkContext context) {
        NotifyConnection notifierConnection = open(context);
        NotifyConnection listenerConnection = open(context);

        listenerConnection.listen(config().getChannel());
        notifierConnection.prepare(NotifierLoop.NOTIFY_STATEMENT, NotifierLoop.NOTIFY_SQL);

        notifier = new NotifierLoop(notifierConnection, config().getChannel());
        listener = new ListenerLoop(listenerConnection, config().getChannel(),
                config().getWaitTimeout(), PayloadExpectation.sequence());
    }

    @Override
    public int run(int iterations, Timer iterationTimer) {
        for (int i = 0; i < iterations; i++) {
            final int index = i;
            iterationTimer.record(() -> {
                notifier.send(index);
                listener.receive(index);
            });
        }
        return iterations;
    }
}
