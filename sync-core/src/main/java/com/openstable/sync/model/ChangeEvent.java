package com.openstable.sync.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Typed change notification for one entity of one collection.
 *
 * Variants:
 * - {@link Insert}: a new entity entered the subscriber's view
 * - {@link Update}: an entity already in scope was replaced
 * - {@link Delete}: an entity left the view (deleted, or no longer matching the subscription filter)
 *
 * @param <T> entity type of the collection
 */
public sealed interface ChangeEvent<T extends SyncEntity> {

    String collection();

    String key();

    Instant timestamp();

    ChangeType type();

    /**
     * Entity value after the change, or null when the entity left the view.
     */
    T current();

    static <T extends SyncEntity> ChangeEvent<T> insert(String collection, T entity, Instant timestamp) {
        return new Insert<>(collection, entity, timestamp);
    }

    static <T extends SyncEntity> ChangeEvent<T> update(String collection, T entity, Instant timestamp) {
        return new Update<>(collection, entity, timestamp);
    }

    static <T extends SyncEntity> ChangeEvent<T> delete(String collection, String key, T previous, Instant timestamp) {
        return new Delete<>(collection, key, previous, timestamp);
    }

    record Insert<T extends SyncEntity>(String collection, T entity, Instant timestamp) implements ChangeEvent<T> {
        public Insert {
            Objects.requireNonNull(entity, "Insert event requires the new entity");
        }

        @Override
        public String key() {
            return entity.getId();
        }

        @Override
        public ChangeType type() {
            return ChangeType.INSERT;
        }

        @Override
        public T current() {
            return entity;
        }
    }

    record Update<T extends SyncEntity>(String collection, T entity, Instant timestamp) implements ChangeEvent<T> {
        public Update {
            Objects.requireNonNull(entity, "Update event requires the new entity");
        }

        @Override
        public String key() {
            return entity.getId();
        }

        @Override
        public ChangeType type() {
            return ChangeType.UPDATE;
        }

        @Override
        public T current() {
            return entity;
        }
    }

    /**
     * @param previous last known value of the entity; null when the feed only sent the key
     */
    record Delete<T extends SyncEntity>(String collection, String key, T previous, Instant timestamp)
            implements ChangeEvent<T> {
        public Delete {
            Objects.requireNonNull(key, "Delete event requires the entity key");
        }

        @Override
        public ChangeType type() {
            return ChangeType.DELETE;
        }

        @Override
        public T current() {
            return null;
        }
    }
}
