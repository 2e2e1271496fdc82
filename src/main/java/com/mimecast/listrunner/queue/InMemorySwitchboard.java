package com.mimecast.listrunner.queue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of Switchboard for testing or temporary queues.
 * <p>This implementation does not persist data to disk and is lost on application restart.
 * <p>Claims are tracked in a concurrent set so mutual exclusion holds across threads of one JVM.
 */
public class InMemorySwitchboard implements Switchboard {

    private final QueueKind kind;
    private final Switchboard shunt;
    private final Clock clock;
    private final ConcurrentSkipListMap<String, Entry> entries = new ConcurrentSkipListMap<>();
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();

    /**
     * Constructs a new InMemorySwitchboard instance.
     *
     * @param kind  Queue kind.
     * @param shunt Shunt queue, null to keep shunted entries in a private one.
     */
    public InMemorySwitchboard(QueueKind kind, Switchboard shunt) {
        this(kind, shunt, Clock.systemUTC());
    }

    /**
     * Constructs a new InMemorySwitchboard instance with given clock.
     *
     * @param kind  Queue kind.
     * @param shunt Shunt queue, null to keep shunted entries in a private one.
     * @param clock Clock for identifiers.
     */
    public InMemorySwitchboard(QueueKind kind, Switchboard shunt, Clock clock) {
        this.kind = kind;
        this.clock = clock;
        if (shunt != null || kind == QueueKind.SHUNT) {
            this.shunt = shunt;
        } else {
            this.shunt = new InMemorySwitchboard(QueueKind.SHUNT, null, clock);
        }
    }

    @Override
    public QueueKind getKind() {
        return kind;
    }

    /**
     * Gets the queue receiving shunted entries.
     *
     * @return Switchboard instance, null for a shunt queue itself.
     */
    public Switchboard getShunt() {
        return shunt;
    }

    @Override
    public String enqueue(byte[] payload, MessageMetadata metadata) {
        String id = QueueIds.next(clock.millis());
        entries.put(id, new Entry(payload.clone(), metadata.toJson()));
        return id;
    }

    /**
     * Stores an entry under a given identifier.
     */
    void put(String id, byte[] payload, MessageMetadata metadata) {
        entries.put(id, new Entry(payload.clone(), metadata.toJson()));
    }

    @Override
    public List<String> files() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    public Optional<MessageClaim> claim(String id) {
        if (!entries.containsKey(id) || !claimed.add(id)) {
            return Optional.empty();
        }
        return Optional.of(new MessageClaim() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public void close() {
                claimed.remove(id);
            }
        });
    }

    @Override
    public Optional<QueuedMessage> dequeue(String id) throws QueueException {
        Entry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new QueuedMessage(id, entry.payload.clone(), MessageMetadata.fromJson(entry.metadata)));
    }

    @Override
    public void update(String id, MessageMetadata metadata) throws QueueException {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new QueueException("No such entry " + id);
        }
        entries.put(id, new Entry(entry.payload, metadata.toJson()));
    }

    @Override
    public void finish(String id) {
        entries.remove(id);
    }

    @Override
    public void shunt(String id, String reason) throws QueueException {
        Entry entry = entries.remove(id);
        if (entry == null) {
            return;
        }
        MessageMetadata metadata = MessageMetadata.fromJson(entry.metadata)
                .setString(MessageMetadata.SHUNT_REASON, reason)
                .setString(MessageMetadata.WHICHQ, kind.getDirectory())
                .setLong(MessageMetadata.SHUNTED_TIME, clock.millis());
        if (shunt instanceof InMemorySwitchboard memory) {
            memory.put(id, entry.payload, metadata);
        } else if (shunt != null) {
            shunt.enqueue(entry.payload, metadata);
        } else {
            put(id, entry.payload, metadata);
        }
    }

    private static class Entry {
        private final byte[] payload;
        private final String metadata;

        Entry(byte[] payload, String metadata) {
            this.payload = payload;
            this.metadata = metadata;
        }
    }
}
