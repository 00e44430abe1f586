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
package dev.mars.pgtransport.api.error;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class EndpointExceptionTest {

    private static final URI HOST = URI.create("postgres://localhost:5432/transport");

    @Test
    void messageIsPrefixedWithUri() {
        IllegalStateException cause = new IllegalStateException("refused");
        EndpointException exception = new EndpointException(HOST, "Failed to open connection", cause);

        assertEquals(HOST, exception.getUri());
        assertEquals("postgres://localhost:5432/transport => Failed to open connection", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    void uriOnlyMessage() {
        assertEquals(HOST.toString(), new EndpointException(HOST).getMessage());
    }

    @Test
    void noUri() {
        EndpointException exception = new EndpointException();
        assertNull(exception.getUri());
        assertNull(exception.getMessage());
    }
}
