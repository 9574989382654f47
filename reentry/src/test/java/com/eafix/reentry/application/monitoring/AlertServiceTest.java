package com.eafix.reentry.application.monitoring;

import com.eafix.reentry.domain.monitoring.Alert;
import com.eafix.reentry.domain.monitoring.AlertLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Alert Service Tests")
class AlertServiceTest {

    private static Alert alert(String type, AlertLevel level) {
        return Alert.builder()
            .alertType(type)
            .level(level)
            .component("ledger")
            .message(type + " raised")
            .detail("record_type", "reentry_decisions")
            .build();
    }

    @Test
    @DisplayName("Alerts of every level are kept, oldest first")
    void testHistoryOrder() {
        AlertService service = new AlertService();
        for (AlertLevel level : AlertLevel.values()) {
            service.sendAlert(alert(level.name(), level));
        }

        List<Alert> recent = service.recentAlerts();
        assertEquals(AlertLevel.values().length, recent.size());
        assertEquals(AlertLevel.values()[0], recent.get(0).level());
        assertEquals("reentry_decisions", recent.get(0).details().get("record_type"));
    }

    @Test
    @DisplayName("History is bounded")
    void testHistoryLimit() {
        AlertService service = new AlertService(2);
        service.sendAlert(alert(Alert.LEDGER_WRITE_FAILURE, AlertLevel.HIGH));
        service.sendAlert(alert(Alert.RESOLVER_EXHAUSTED, AlertLevel.CRITICAL));
        service.sendAlert(alert(Alert.PARAMETER_RELOAD_REJECTED, AlertLevel.MEDIUM));

        List<Alert> recent = service.recentAlerts();
        assertEquals(2, recent.size());
        assertEquals(Alert.RESOLVER_EXHAUSTED, recent.get(0).alertType());
        assertEquals(Alert.PARAMETER_RELOAD_REJECTED, recent.get(1).alertType());
    }
}
