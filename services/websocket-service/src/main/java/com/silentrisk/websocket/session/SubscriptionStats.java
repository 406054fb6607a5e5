package com.silentrisk.websocket.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionStats {

    private int totalConnections;

    private int totalSubscriptions;

    private int tasksWithSubscribers;

    private Map<String, Integer> connectionsPerTask;
}
