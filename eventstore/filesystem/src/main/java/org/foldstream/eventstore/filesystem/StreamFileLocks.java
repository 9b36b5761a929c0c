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

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process locks for event stream files, shared by every {@link FileSystemEventStreamStore} in the JVM. A {@link java.nio.channels.FileLock}
 * is held on behalf of the whole JVM, so threads must be serialized here before one of them asks for it. A lock is removed
 * once no thread holds or waits for it.
 */
final class StreamFileLocks {
    private static final ConcurrentMap<Path, StreamFileLock> locks = new ConcurrentHashMap<>();

    private StreamFileLocks() {
    }

    static StreamFileLock acquire(Path file) {
        Path key = file.toAbsolutePath().normalize();
        // "users" is only changed inside compute, which is atomic per key
        StreamFileLock streamFileLock = locks.compute(key, (__, existing) -> {
            StreamFileLock lock = existing == null ? new StreamFileLock(key) : existing;
            lock.users++;
            return lock;
        });
        streamFileLock.lock.lock();
        return streamFileLock;
    }

    static int size() {
        return locks.size();
    }

    static final class StreamFileLock implements AutoCloseable {
        private final Path file;
        private final ReentrantLock lock = new ReentrantLock();
        private int users;

        private StreamFileLock(Path file) {
            this.file = file;
        }

        @Override
        public void close() {
            lock.unlock();
            locks.computeIfPresent(file, (__, existing) -> --existing.users == 0 ? null : existing);
        }
    }
}
