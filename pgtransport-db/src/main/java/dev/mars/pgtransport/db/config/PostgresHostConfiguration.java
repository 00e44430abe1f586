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
package dev.mars.pgtransport.db.config;

import dev.mars.pgtransport.api.host.HostConfiguration;
import dev.mars.pgtransport.api.host.HostSettings;

import java.net.URI;
import java.util.Objects;

/**
 * Host configuration pairing an address with its settings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class PostgresHostConfiguration implements HostConfiguration {

    private final URI hostAddress;
    private final HostSettings settings;

    public PostgresHostConfiguration(URI hostAddress, HostSettings settings) {
        this.hostAddress = Objects.requireNonNull(hostAddress, "Host address cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
    }

    /**
     * Creates a configuration addressed as {@code postgres://host:port/database}.
     */
    public static PostgresHostConfiguration of(PostgresHostSettings settings) {
        return new PostgresHostConfiguration(addressOf(settings), settings);
    }

    public static URI addressOf(HostSettings settings) {
        return URI.create("postgres://" + settings.getHost() + ":" + settings.getPort() + "/" + settings.getDatabase());
    }

    @Override
    public URI getHostAddress() {
        return hostAddress;
    }

    @Override
    public HostSettings getSettings() {
        return settings;
    }

    @Override
    public String toString() {
        return "PostgresHostConfiguration{hostAddress=" + hostAddress + ", settings=" + settings + '}';
    }
}
