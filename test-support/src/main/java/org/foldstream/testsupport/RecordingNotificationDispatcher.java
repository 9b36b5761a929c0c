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

package org.foldstream.testsupport;

import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link NotificationDispatcher} that records every notification as a string, e.g. {@code "appended Bank/Account/A-1 Opened 1"}.
 */
public class RecordingNotificationDispatcher implements NotificationDispatcher {
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void notifyStreamCreated(EventStreamIdentity identity) {
        notifications.add("created " + identity);
    }

    @Override
    public void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber) {
        notifications.add("appended " + identity + " " + eventType + " " + sequenceNumber);
    }

    public List<String> notifications() {
        return new ArrayList<>(notifications);
    }
}
