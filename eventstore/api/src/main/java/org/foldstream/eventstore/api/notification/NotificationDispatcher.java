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

package org.foldstream.eventstore.api.notification;

import org.foldstream.eventstore.api.EventStreamIdentity;

/**
 * A hook that an event store invokes, after the fact, when event streams are created and appended to.
 * <p>
 * Notification is fire-and-forget. It's never part of the durability contract of an append: if a dispatcher throws, the event store
 * logs the failure and the append still succeeds.
 */
public interface NotificationDispatcher {

    /**
     * Invoked when the first event has been appended to the event stream with the given {@code identity}.
     */
    void notifyStreamCreated(EventStreamIdentity identity);

    /**
     * Invoked for every event that has been appended to an event stream.
     */
    void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber);

    /**
     * @return A {@link NotificationDispatcher} that does nothing
     */
    static NotificationDispatcher none() {
        return NullNotificationDispatcher.INSTANCE;
    }
}
