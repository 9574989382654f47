package com.eafix.reentry.application.monitoring;

import com.eafix.reentry.domain.monitoring.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Alarm channel for the re-entry core.
 *
 * Logs to SLF4J by severity and keeps the most recent alerts in memory for health
 * reports. Forwarding to pager or chat systems belongs to the hosting service.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);
    private static final int DEFAULT_HISTORY = 100;

    private final int historyLimit;
    private final Deque<Alert> recent = new ArrayDeque<>();

    public AlertService() {
        this(DEFAULT_HISTORY);
    }

    public AlertService(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    /**
     * Log the alert at a level matching its severity and add it to the history.
     */
    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL -> log.error("[ALERT-{}] {} {} - {} {}",
                alert.level(), alert.component(), alert.alertType(), alert.message(), alert.details());
            case HIGH, MEDIUM -> log.warn("[ALERT-{}] {} {} - {} {}",
                alert.level(), alert.component(), alert.alertType(), alert.message(), alert.details());
            case INFO -> log.info("[ALERT-INFO] {} {} - {}", alert.component(), alert.alertType(), alert.message());
        }

        synchronized (recent) {
            recent.addLast(alert);
            while (recent.size() > historyLimit) {
                recent.removeFirst();
            }
        }
    }

    /**
     * Most recent alerts, oldest first.
     */
    public List<Alert> recentAlerts() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
