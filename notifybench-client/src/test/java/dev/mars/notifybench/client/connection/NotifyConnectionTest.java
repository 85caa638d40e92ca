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

import dev.mars.notifybench.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag(TestCategories.CORE)
class NotifyConnectionTest {

    @Test
    void testQuoteIdentifier() {
        assertEquals("\"bench\"", NotifyConnection.quoteIdentifier("bench"));
        assertEquals("\"Mixed Case\"", NotifyConnection.quoteIdentifier("Mixed Case"));
        assertEquals("\"a\"\"b\"", NotifyConnection.quoteIdentifier("a\"b"));
    }
}
