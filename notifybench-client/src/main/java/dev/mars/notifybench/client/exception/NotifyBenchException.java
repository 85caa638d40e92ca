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

/**
 * Base exception for every failed database call made by a benchmark.
 *
 * <p>There is no distinction between transient and permanent errors: whoever catches this
 * aborts the benchmark it belongs to.</p>
 */
public class NotifyBenchException extends RuntimeException {

    public NotifyBenchException(String message) {
        super(message);
    }

    public NotifyBenchException(String message, Throwable cause) {
        super(message, cause);
    }
}
