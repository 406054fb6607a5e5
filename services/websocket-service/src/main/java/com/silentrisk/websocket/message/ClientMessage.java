package com.silentrisk.websocket.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frame sent by a client: {@code {"type":"subscribe"|"unsubscribe","taskId":"..."}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClientMessage {

    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";

    private String type;

    private String taskId;

    public boolean isComplete() {
        return type != null && !type.isBlank() && taskId != null && !taskId.isBlank();
    }
}
