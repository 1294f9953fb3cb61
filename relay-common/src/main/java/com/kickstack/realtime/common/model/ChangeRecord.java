package com.kickstack.realtime.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single row of the change store.
 * The id is assigned by the store, strictly increasing, and is the only
 * ordering and resume token; timestamp is informational.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeRecord {

    private long id;
    private long timestamp;
    private String table;
    private ChangeOperation operation;

    /**
     * Primary key of the affected row, present for every operation
     */
    private String rowKey;

    /**
     * Post-change row for INSERT/UPDATE, key-only object for DELETE, may be null
     */
    private JsonNode payload;

    /**
     * Row identifier exposed to subscribers: the payload's "id" field when
     * present, otherwise the row key.
     */
    public JsonNode resolveRowId() {
        if (payload != null && payload.hasNonNull("id")) {
            return payload.get("id");
        }
        return rowKey != null ? TextNode.valueOf(rowKey) : NullNode.getInstance();
    }
}
