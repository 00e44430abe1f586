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
 * Base type for transport failures that can be attributed to an addressable endpoint.
 *
 * <p>The URI is carried for diagnostics only. It is prefixed to the message so that
 * a log line identifies the failing host without further context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class AbstractUriException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final URI uri;

    protected AbstractUriException() {
        this.uri = null;
    }

    protected AbstractUriException(URI uri) {
        super(format(uri, null));
        this.uri = uri;
    }

    protected AbstractUriException(URI uri, String message) {
        super(format(uri, message));
        this.uri = uri;
    }

    protected AbstractUriException(URI uri, String message, Throwable cause) {
        super(format(uri, message), cause);
        this.uri = uri;
    }

    public URI getUri() {
        return uri;
    }

    private static String format(URI uri, String message) {
        if (uri == null) {
            return message;
        }
        return message == null || message.isBlank() ? uri.toString() : uri + " => " + message;
    }
}
