package com.vigil.websocket;

import com.vigil.control.MonitorLoop;
import com.vigil.control.TickListener;
import com.vigil.status.StatusAggregator;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StatusBroadcaster implements TickListener {

    private final StatusWebSocketHandler webSocketHandler;
    private final StatusAggregator statusAggregator;
    private final MonitorLoop monitorLoop;

    @PostConstruct
    void subscribe() {
        monitorLoop.addTickListener(this);
    }

    @Override
    public void onTick() {
        if (!webSocketHandler.hasSubscribers()) {
            return;
        }
        webSocketHandler.broadcast(statusAggregator.systemStatus());
    }
}
