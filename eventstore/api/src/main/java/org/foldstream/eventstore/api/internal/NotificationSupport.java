/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.foldstream.eventstore.api.internal;

import org.foldstream.eventstore.api.AppendResult;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invokes a {@link NotificationDispatcher} after a successful append. Dispatcher failures are logged and discarded since
 * they must never make a committed append look like a failure.
 */
public class NotificationSupport {
    private static final Logger log = LoggerFactory.getLogger(NotificationSupport.class);

    public static void notifyAppended(NotificationDispatcher dispatcher, AppendResult appendResult, String eventType) {
        if (appendResult.isStreamCreated()) {
            try {
                dispatcher.notifyStreamCreated(appendResult.getIdentity());
            } catch (RuntimeException e) {
                log.warn("Notification dispatcher {} failed to handle creation of event stream {}, ignoring.", dispatcher, appendResult.getIdentity(), e);
            }
        }

        try {
            dispatcher.notifyEventAppended(appendResult.getIdentity(), eventType, appendResult.getSequenceNumber());
        } catch (RuntimeException e) {
            log.warn("Notification dispatcher {} failed to handle event {} (sequence number {}) appended to event stream {}, ignoring.",
                    dispatcher, eventType, appendResult.getSequenceNumber(), appendResult.getIdentity(), e);
        }
    }
}
