package com.kickstack.realtime.common.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.kickstack.realtime.common.model.ChangeOperation;
import com.kickstack.realtime.common.model.ChangeRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JSON frame exchanged over a relay connection, in either direction.
 * Only the fields relevant to {@link #type} are populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayMessage {

    private MessageType type;

    /**
     * Effective table list (connected)
     */
    private List<String> tables;

    /**
     * Effective resume point (connected)
     */
    private Long since;

    /**
     * Table name (change, subscribe, unsubscribe and their acknowledgements)
     */
    private String table;

    private ChangeOperation op;

    /**
     * Row identifier, number or string (change)
     */
    private JsonNode id;

    /**
     * Change timestamp in epoch milliseconds (change)
     */
    private Long ts;

    /**
     * Change store id (change)
     */
    private Long changeId;

    /**
     * Human readable error (error)
     */
    private String message;

    public static RelayMessage connected(Collection<String> tables, long since) {
        return RelayMessage.builder()
                .type(MessageType.CONNECTED)
                .tables(new ArrayList<>(tables))
                .since(since)
                .build();
    }

    public static RelayMessage change(ChangeRecord record) {
        return RelayMessage.builder()
                .type(MessageType.CHANGE)
                .table(record.getTable())
                .op(record.getOperation())
                .id(record.resolveRowId())
                .ts(record.getTimestamp())
                .changeId(record.getId())
                .build();
    }

    public static RelayMessage subscribed(String table) {
        return RelayMessage.builder().type(MessageType.SUBSCRIBED).table(table).build();
    }

    public static RelayMessage unsubscribed(String table) {
        return RelayMessage.builder().type(MessageType.UNSUBSCRIBED).table(table).build();
    }

    public static RelayMessage pong() {
        return RelayMessage.builder().type(MessageType.PONG).build();
    }

    public static RelayMessage error(String message) {
        return RelayMessage.builder().type(MessageType.ERROR).message(message).build();
    }

    public static RelayMessage ping() {
        return RelayMessage.builder().type(MessageType.PING).build();
    }

    public static RelayMessage subscribe(String table) {
        return RelayMessage.builder().type(MessageType.SUBSCRIBE).table(table).build();
    }

    public static RelayMessage unsubscribe(String table) {
        return RelayMessage.builder().type(MessageType.UNSUBSCRIBE).table(table).build();
    }

    /**
     * True for subscribe/unsubscribe frames that name a table
     */
    public boolean hasTable() {
        return table != null && !table.isBlank();
    }
}
