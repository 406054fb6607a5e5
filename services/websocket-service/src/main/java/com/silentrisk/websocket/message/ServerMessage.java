package com.silentrisk.websocket.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.silentrisk.common.model.StatusUpdateEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frames sent from the server to WebSocket clients.
 *
 * <pre>
 * {"type":"subscribed","taskId":"...","message":"..."}
 * {"type":"unsubscribed","taskId":"...","message":"..."}
 * {"type":"status_update","taskId":"...","data":{"status":"processing","progress":40,"message":"..."}}
 * {"type":"error","error":"..."}
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerMessage {

    public static final String SUBSCRIBED = "subscribed";
    public static final String UNSUBSCRIBED = "unsubscribed";
    public static final String STATUS_UPDATE = "status_update";
    public static final String ERROR = "error";

    private String type;

    private String taskId;

    private String message;

    private StatusData data;

    private String error;

    public static ServerMessage subscribed(String taskId) {
        return ServerMessage.builder()
                .type(SUBSCRIBED)
                .taskId(taskId)
                .message("Successfully subscribed to task " + taskId)
                .build();
    }

    public static ServerMessage unsubscribed(String taskId) {
        return ServerMessage.builder()
                .type(UNSUBSCRIBED)
                .taskId(taskId)
                .message("Successfully unsubscribed from task " + taskId)
                .build();
    }

    public static ServerMessage statusUpdate(StatusUpdateEvent event) {
        return ServerMessage.builder()
                .type(STATUS_UPDATE)
                .taskId(event.getTaskId())
                .data(new StatusData(event.getStatus(), event.getProgress(), event.getMessage()))
                .build();
    }

    public static ServerMessage error(String error) {
        return ServerMessage.builder()
                .type(ERROR)
                .error(error)
                .build();
    }
}
