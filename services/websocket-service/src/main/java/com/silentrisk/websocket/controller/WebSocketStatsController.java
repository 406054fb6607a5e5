package com.silentrisk.websocket.controller;

import com.silentrisk.websocket.session.SubscriptionRegistry;
import com.silentrisk.websocket.session.SubscriptionStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ws")
@RequiredArgsConstructor
public class WebSocketStatsController {

    private final SubscriptionRegistry registry;

    @GetMapping("/stats")
    public ResponseEntity<SubscriptionStats> stats() {
        return ResponseEntity.ok(registry.stats());
    }
}
