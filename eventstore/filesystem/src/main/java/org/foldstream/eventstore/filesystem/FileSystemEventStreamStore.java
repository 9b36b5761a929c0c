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

import io.cloudevents.CloudEvent;
import io.cloudevents.core.format.EventDeserializationException;
import io.cloudevents.jackson.JsonFormat;
import org.foldstream.cloudevents.FoldstreamExtensionGetter;
import org.foldstream.eventstore.api.*;
import org.foldstream.eventstore.api.internal.AppendConstraintEvaluator;
import org.foldstream.eventstore.api.internal.CloudEventEnvelopeMapper;
import org.foldstream.eventstore.api.internal.EventStreamImpl;
import org.foldstream.eventstore.api.internal.NotificationSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.*;
import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStreamStore} that keeps each event stream in its own file, {@code <root>/<domain>/<entity type>/<instance key>.jsonl},
 * with one JSON encoded {@link CloudEvent} per line.
 * <p>
 * Appends to a stream are serialized by a lock per stream file that all stores in this JVM share, and by a {@link FileLock}
 * between processes. A line is only committed once its terminating newline has been written. A trailing line without a newline
 * is the remains of a torn write, it's ignored when reading and removed by the next append.
 * </p>
 */
public class FileSystemEventStreamStore implements EventStreamStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemEventStreamStore.class);
    private static final String FILE_SUFFIX = ".jsonl";
    private static final byte NEW_LINE = '\n';

    private final FileSystemEventStoreConfig config;
    private final JsonFormat jsonFormat = new JsonFormat();
    private final CloudEventEnvelopeMapper envelopeMapper = new CloudEventEnvelopeMapper();

    public FileSystemEventStreamStore(FileSystemEventStoreConfig config) {
        requireNonNull(config, FileSystemEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.config = config;
        try {
            Files.createDirectories(config.rootDirectory);
        } catch (IOException e) {
            throw new StreamUnavailableException(null, "Couldn't create event store root directory " + config.rootDirectory, e);
        }
        log.info("Storing event streams in {}", config.rootDirectory.toAbsolutePath());
    }

    @Override
    public EventStream read(EventStreamIdentity identity) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        List<CloudEvent> cloudEvents = readCommittedCloudEvents(identity);
        return new EventStreamImpl(identity, cloudEvents.stream().map(envelopeMapper::toEnvelope).collect(Collectors.toList()));
    }

    @Override
    public boolean exists(EventStreamIdentity identity) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        return !readCommittedCloudEvents(identity).isEmpty();
    }

    @Override
    public AppendResult append(EventStreamIdentity identity, EventRecord event, AppendConstraint appendConstraint) {
        requireNonNull(identity, EventStreamIdentity.class.getSimpleName() + " cannot be null");
        requireNonNull(event, EventRecord.class.getSimpleName() + " cannot be null");
        requireNonNull(appendConstraint, AppendConstraint.class.getSimpleName() + " cannot be null");

        Path file = fileOf(identity);
        final AppendResult appendResult;
        try (StreamFileLocks.StreamFileLock ignoredStreamLock = StreamFileLocks.acquire(file)) {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file, CREATE, READ, WRITE);
                 FileLock ignored = channel.lock()) {
                byte[] content = readFully(channel);
                int committedLength = committedLength(content);
                if (committedLength < content.length) {
                    log.warn("Removing {} bytes of a torn write from the end of event stream {}", content.length - committedLength, identity);
                    channel.truncate(committedLength);
                }

                List<CloudEvent> committed = parseLines(identity, content, committedLength);
                long currentSequenceNumber = committed.isEmpty() ? 0 : FoldstreamExtensionGetter.getSequenceNumber(committed.get(committed.size() - 1));
                AppendConstraintEvaluator.requireFulfilled(identity, appendConstraint, currentSequenceNumber);

                long sequenceNumber = currentSequenceNumber + 1;
                CloudEvent cloudEvent = envelopeMapper.toCloudEvent(identity, event, sequenceNumber, OffsetDateTime.now(config.clock));
                writeLine(channel, committedLength, jsonFormat.serialize(cloudEvent));
                appendResult = new AppendResult(identity, sequenceNumber, currentSequenceNumber == 0);
            }
        } catch (IOException e) {
            throw new StreamUnavailableException(identity, "Couldn't append event " + event.eventType() + " to event stream " + identity, e);
        } catch (OverlappingFileLockException e) {
            throw new StreamUnavailableException(identity, "Event stream " + identity + " is locked by another writer in this JVM", e);
        }

        log.debug("Appended event {} to event stream {} with sequence number {}", event.eventType(), identity, appendResult.getSequenceNumber());
        NotificationSupport.notifyAppended(config.notificationDispatcher, appendResult, event.eventType());
        return appendResult;
    }

    @Override
    public Stream<String> instanceKeys(String domainName, String entityTypeName) {
        requireNonNull(domainName, "Domain name cannot be null");
        requireNonNull(entityTypeName, "Entity type name cannot be null");
        Path directory = config.rootDirectory.resolve(encode(domainName)).resolve(encode(entityTypeName));
        if (!Files.isDirectory(directory)) {
            return Stream.empty();
        }

        final List<Path> files;
        try (Stream<Path> paths = Files.list(directory)) {
            files = paths.filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX)).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new StreamUnavailableException(null, "Couldn't list event streams in " + directory, e);
        }

        return files.stream()
                .map(path -> decode(path.getFileName().toString().substring(0, path.getFileName().toString().length() - FILE_SUFFIX.length())))
                .filter(instanceKey -> exists(EventStreamIdentity.of(domainName, entityTypeName, instanceKey)));
    }

    private List<CloudEvent> readCommittedCloudEvents(EventStreamIdentity identity) {
        final byte[] content;
        try {
            content = Files.readAllBytes(fileOf(identity));
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new StreamUnavailableException(identity, "Couldn't read event stream " + identity, e);
        }
        return parseLines(identity, content, committedLength(content));
    }

    private List<CloudEvent> parseLines(EventStreamIdentity identity, byte[] content, int committedLength) {
        List<CloudEvent> cloudEvents = new ArrayList<>();
        int lineStart = 0;
        for (int i = 0; i < committedLength; i++) {
            if (content[i] == NEW_LINE) {
                if (i > lineStart) {
                    cloudEvents.add(deserialize(identity, Arrays.copyOfRange(content, lineStart, i), cloudEvents.size() + 1));
                }
                lineStart = i + 1;
            }
        }
        return cloudEvents;
    }

    private CloudEvent deserialize(EventStreamIdentity identity, byte[] line, int lineNumber) {
        try {
            return jsonFormat.deserialize(line);
        } catch (EventDeserializationException | IllegalStateException | IllegalArgumentException e) {
            throw new StreamUnavailableException(identity, "Event stream " + identity + " is corrupt at line " + lineNumber, e);
        }
    }

    private void writeLine(FileChannel channel, long position, byte[] json) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(json.length + 1).put(json).put(NEW_LINE).flip();
        long writePosition = position;
        while (buffer.hasRemaining()) {
            writePosition += channel.write(buffer, writePosition);
        }
        if (config.forceOnWrite) {
            channel.force(false);
        }
    }

    private static byte[] readFully(FileChannel channel) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(channel.size()));
        long position = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        return Arrays.copyOf(buffer.array(), buffer.position());
    }

    // Length of the content up to and including the last newline
    private static int committedLength(byte[] content) {
        for (int i = content.length - 1; i >= 0; i--) {
            if (content[i] == NEW_LINE) {
                return i + 1;
            }
        }
        return 0;
    }

    private Path fileOf(EventStreamIdentity identity) {
        return config.rootDirectory
                .resolve(encode(identity.domainName()))
                .resolve(encode(identity.entityTypeName()))
                .resolve(encode(identity.instanceKey()) + FILE_SUFFIX);
    }

    // Dots are escaped as well so that a name can never resolve to "." or ".."
    private static String encode(String name) {
        return URLEncoder.encode(name, UTF_8).replace(".", "%2E");
    }

    private static String decode(String name) {
        return URLDecoder.decode(name, UTF_8);
    }
}
