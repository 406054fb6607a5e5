package com.silentrisk.websocket.message;

import com.silentrisk.common.model.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StatusData {

    private TaskStatus status;

    private int progress;

    private String message;
}
