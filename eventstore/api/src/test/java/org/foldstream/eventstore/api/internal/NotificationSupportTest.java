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
import org.foldstream.eventstore.api.EventStreamIdentity;
import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayNameGeneration(ReplaceUnderscores.class)
class NotificationSupportTest {

    private static final EventStreamIdentity ACCOUNT = EventStreamIdentity.of("Bank", "Account", "A-1");

    @Test
    void notifies_stream_created_before_event_appended_when_the_append_created_the_stream() {
        // Given
        List<String> notifications = new CopyOnWriteArrayList<>();
        NotificationDispatcher dispatcher = new NotificationDispatcher() {
            @Override
            public void notifyStreamCreated(EventStreamIdentity identity) {
                notifications.add("created " + identity);
            }

            @Override
            public void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber) {
                notifications.add("appended " + eventType + " " + sequenceNumber);
            }
        };

        // When
        NotificationSupport.notifyAppended(dispatcher, new AppendResult(ACCOUNT, 1, true), "Opened");
        NotificationSupport.notifyAppended(dispatcher, new AppendResult(ACCOUNT, 2, false), "MoneyDeposited");

        // Then
        assertThat(notifications).containsExactly("created Bank/Account/A-1", "appended Opened 1", "appended MoneyDeposited 2");
    }

    @Test
    void failing_dispatcher_does_not_propagate_the_failure() {
        // Given
        NotificationDispatcher dispatcher = new NotificationDispatcher() {
            @Override
            public void notifyStreamCreated(EventStreamIdentity identity) {
                throw new IllegalStateException("created failed");
            }

            @Override
            public void notifyEventAppended(EventStreamIdentity identity, String eventType, long sequenceNumber) {
                throw new IllegalStateException("appended failed");
            }
        };

        // Then
        assertThatCode(() -> NotificationSupport.notifyAppended(dispatcher, new AppendResult(ACCOUNT, 1, true), "Opened")).doesNotThrowAnyException();
    }
}
