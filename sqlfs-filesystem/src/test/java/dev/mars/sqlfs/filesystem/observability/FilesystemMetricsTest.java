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

package dev.mars.sqlfs.filesystem.observability;

import dev.mars.sqlfs.filesystem.FilesystemContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilesystemMetricsTest {

    @Test
    void testSingleton() {
        assertSame(FilesystemMetrics.getInstance(), FilesystemMetrics.getInstance());
    }

    @Test
    void testRegisterAndUnregisterGauges() {
        FilesystemMetrics metrics = FilesystemMetrics.getInstance();

        metrics.registerContextGauges("metrics-test", () -> 3L, () -> 1L);
        assertTrue(metrics.hasContextGauges("metrics-test"));

        metrics.unregisterContextGauges("metrics-test");
        assertFalse(metrics.hasContextGauges("metrics-test"));
    }

    @Test
    void testRecordingWithoutSdkDoesNotThrow() {
        FilesystemMetrics metrics = FilesystemMetrics.getInstance();

        assertDoesNotThrow(() -> {
            metrics.recordOperation("create_file", "OK");
            metrics.recordPermissionDenied("remove");
            metrics.recordBytesCommitted(128);
            metrics.recordBytesCommitted(0);
        });
    }

    @Test
    void testContextRegistersGaugesForItsLifetime() throws Exception {
        FilesystemMetrics metrics = FilesystemMetrics.getInstance();
        FilesystemContext context = FilesystemContext.builder().name("gauged-context").build();

        assertTrue(metrics.hasContextGauges("gauged-context"));

        context.close();
        assertFalse(metrics.hasContextGauges("gauged-context"));
    }
}
