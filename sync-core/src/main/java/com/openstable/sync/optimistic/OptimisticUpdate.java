package com.openstable.sync.optimistic;

import com.openstable.sync.model.SyncEntity;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * A locally applied change that the server has not confirmed yet.
 */
@Value
@Builder
public class OptimisticUpdate<T extends SyncEntity> {

    /** Identifier of the mutation itself. For creates it is also the temporary cache key. */
    String localId;
    MutationType type;
    /** Cache key the change applies to. */
    String entityId;
    /** Value shown in the view while pending; null for removals. */
    T candidate;
    /** Value before the change; null for creates. */
    T previous;
    Instant createdAt;
    @With
    boolean confirmed;
    /** Server-assigned id once a create has been acknowledged. */
    @With
    String confirmedId;

    /**
     * Key under which the entity currently sits in the view.
     */
    public String currentKey() {
        return confirmedId != null ? confirmedId : entityId;
    }
}
