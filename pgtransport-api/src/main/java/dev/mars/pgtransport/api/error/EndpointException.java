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

import java.net.URI;

/**
 * Raised when an operation against a transport host endpoint fails.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class EndpointException extends AbstractUriException {

    private static final long serialVersionUID = 1L;

    public EndpointException() {
        super();
    }

    public EndpointException(URI uri) {
        super(uri);
    }

    public EndpointException(URI uri, String message) {
        super(uri, message);
    }

    public EndpointException(URI uri, String message, Throwable cause) {
        super(uri, message, cause);
    }
}
