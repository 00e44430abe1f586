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
package dev.mars.pgtransport.db.notification;

import java.util.OptionalLong;

/**
 * Naming of the per-queue notification channels: {@code transport_msg_<queueId>}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class NotificationChannels {

    public static final String CHANNEL_PREFIX = "transport_msg_";

    private NotificationChannels() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String channelFor(long queueId) {
        return CHANNEL_PREFIX + queueId;
    }

    /**
     * Parses the queue identifier from the suffix after the last underscore of a channel name.
     *
     * @param channel the channel name, as reported by the server
     * @return the queue identifier, or empty when the name has no numeric suffix
     */
    public static OptionalLong parseQueueId(String channel) {
        if (channel == null) {
            return OptionalLong.empty();
        }
        int index = channel.lastIndexOf('_');
        if (index <= 0 || index == channel.length() - 1) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(channel.substring(index + 1)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
