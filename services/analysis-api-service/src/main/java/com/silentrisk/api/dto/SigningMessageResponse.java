package com.silentrisk.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SigningMessageResponse {

    private String message;

    private long timestamp;

    /**
     * Seconds until a signature over {@link #message} is rejected as stale.
     */
    private long validForSeconds;
}
