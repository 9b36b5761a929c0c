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
 * A notification dispatcher that doesn't do anything. This is the default for all event stores.
 */
public final class NullNotificationDispatcher implements NotificationDispatcher {
    static final NullNotificationDispatcher INSTANCE = new NullNotificationDispatcher();

    private NullNotificationDispatcher() {
    }

    @Override
    public void notifyStreamCreated(EventStreamIdentity identity) {
    }

    @Override
    public void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber) {
    }

    @Override
    public String toString() {
        return NullNotificationDispatcher.class.getSimpleName();
    }
}
