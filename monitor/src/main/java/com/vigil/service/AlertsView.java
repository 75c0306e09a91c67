package com.vigil.service;

import com.vigil.model.Alert;

import java.time.Instant;
import java.util.List;

public record AlertsView(List<Alert> alerts, int totalAlerts, Instant timestamp) {}
