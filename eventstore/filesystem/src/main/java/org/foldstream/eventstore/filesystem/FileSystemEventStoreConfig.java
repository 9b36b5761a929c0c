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

package org.foldstream.eventstore.filesystem;

import org.foldstream.eventstore.api.notification.NotificationDispatcher;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Configuration for the {@link FileSystemEventStreamStore}
 */
@NullMarked
public class FileSystemEventStoreConfig {
    public final Path rootDirectory;
    public final boolean forceOnWrite;
    public final NotificationDispatcher notificationDispatcher;
    public final Clock clock;

    /**
     * Create an {@link FileSystemEventStoreConfig} that stores the event streams below {@code rootDirectory}, forces every
     * appended event to disk and doesn't send any notifications.
     *
     * @param rootDirectory The directory below which the event stream files are stored. It's created if it doesn't exist.
     */
    public FileSystemEventStoreConfig(Path rootDirectory) {
        this(rootDirectory, true, null, null);
    }

    /**
     * @param rootDirectory          The directory below which the event stream files are stored. It's created if it doesn't exist.
     * @param forceOnWrite           {@code true} if each append should be forced to the storage device before it's acknowledged
     * @param notificationDispatcher The dispatcher to notify after each successful append. May be <code>null</code>, in which case no notifications are sent.
     * @param clock                  The clock that defines the logged timestamp of appended events. May be <code>null</code>, in which case the UTC system clock is used.
     */
    public FileSystemEventStoreConfig(Path rootDirectory, boolean forceOnWrite, @Nullable NotificationDispatcher notificationDispatcher, @Nullable Clock clock) {
        Objects.requireNonNull(rootDirectory, "Root directory cannot be null");
        this.rootDirectory = rootDirectory;
        this.forceOnWrite = forceOnWrite;
        this.notificationDispatcher = Objects.requireNonNullElseGet(notificationDispatcher, NotificationDispatcher::none);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileSystemEventStoreConfig)) return false;
        FileSystemEventStoreConfig that = (FileSystemEventStoreConfig) o;
        return forceOnWrite == that.forceOnWrite && Objects.equals(rootDirectory, that.rootDirectory)
                && Objects.equals(notificationDispatcher, that.notificationDispatcher) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rootDirectory, forceOnWrite, notificationDispatcher, clock);
    }

    @Override
    public String toString() {
        return "FileSystemEventStoreConfig{" +
                "rootDirectory=" + rootDirectory +
                ", forceOnWrite=" + forceOnWrite +
                ", notificationDispatcher=" + notificationDispatcher +
                ", clock=" + clock +
                '}';
    }

    public static final class Builder {
        private @Nullable Path rootDirectory;
        private boolean forceOnWrite = true;
        private @Nullable NotificationDispatcher notificationDispatcher;
        private @Nullable Clock clock;

        /**
         * @param rootDirectory The directory below which the event stream files are stored
         * @return The builder instance
         */
        public Builder rootDirectory(Path rootDirectory) {
            this.rootDirectory = rootDirectory;
            return this;
        }

        /**
         * @param forceOnWrite {@code true} (default) if each append should be forced to the storage device before it's acknowledged.
         *                     Turning it off trades durability on power loss for throughput.
         * @return The builder instance
         */
        public Builder forceOnWrite(boolean forceOnWrite) {
            this.forceOnWrite = forceOnWrite;
            return this;
        }

        /**
         * @param notificationDispatcher The dispatcher to notify after each successful append
         * @return The builder instance
         */
        public Builder notificationDispatcher(NotificationDispatcher notificationDispatcher) {
            this.notificationDispatcher = notificationDispatcher;
            return this;
        }

        /**
         * @param clock The clock that defines the logged timestamp of appended events
         * @return The builder instance
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public FileSystemEventStoreConfig build() {
            if (rootDirectory == null) {
                throw new IllegalArgumentException("Root directory must be configured");
            }
            return new FileSystemEventStoreConfig(rootDirectory, forceOnWrite, notificationDispatcher, clock);
        }
    }
}
