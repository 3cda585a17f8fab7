package com.rebenew.musicParty.queuesync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sobre único para todo el tráfico WebSocket.
 * Entrantes: comandos (session, queue, playback, roster, heartbeat).
 * Salientes: event, snapshot, ack, error.
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    private String type;
    private String subType;
    private String sessionId;
    private String senderId;
    private String correlationId;
    private Long version;
    private Long timestamp;
    private Object data;

    // Clientes que envían "action" en lugar de "subType"
    public void setAction(String action) {
        this.subType = action;
    }

    // ==================== FACTORÍAS ====================

    public static SyncMsg event(EventType event, String sessionId, long version, Object payload) {
        SyncMsg msg = new SyncMsg("event", event.wireName(), sessionId, null, payload);
        msg.setVersion(version);
        return msg;
    }

    public static SyncMsg snapshot(SessionSnapshot snapshot, String correlationId) {
        SyncMsg msg = new SyncMsg("snapshot", null, snapshot.sessionId(), null, snapshot);
        msg.setVersion(snapshot.version());
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg ack(String reason, String correlationId, Map<String, Object> result) {
        Map<String, Object> ackData = new LinkedHashMap<>();
        ackData.put("success", true);
        ackData.put("reason", reason);
        if (result != null) {
            ackData.putAll(result);
        }
        SyncMsg msg = new SyncMsg("ack", null, null, null, ackData);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    public static SyncMsg error(String errorCode, String message, String correlationId) {
        Map<String, Object> errorData = new LinkedHashMap<>();
        errorData.put("code", errorCode);
        errorData.put("message", message == null ? errorCode : message);
        SyncMsg msg = new SyncMsg("error", null, null, null, errorData);
        msg.setCorrelationId(correlationId);
        return msg;
    }

    private SyncMsg(String type, String subType, String sessionId, String senderId, Object data) {
        this.type = type;
        this.subType = subType;
        this.sessionId = sessionId;
        this.senderId = senderId;
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    // Jackson
    public SyncMsg() {
        this.timestamp = System.currentTimeMillis();
    }

    // ==================== CONSULTAS ====================

    @JsonIgnore
    public boolean isAck() {
        return "ack".equals(type);
    }

    @JsonIgnore
    public boolean isError() {
        return "error".equals(type);
    }

    @JsonIgnore
    public boolean isEvent() {
        return "event".equals(type);
    }

    @JsonIgnore
    public boolean isSnapshot() {
        return "snapshot".equals(type);
    }

    @SuppressWarnings("unchecked")
    @JsonIgnore
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    public String getStringData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public Long getLongData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Boolean getBoolData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        Object value = dataMap != null ? dataMap.get(key) : null;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{type='%s', subType='%s', sessionId='%s', senderId='%s', version=%s}",
                type, subType, sessionId, senderId, version);
    }
}
