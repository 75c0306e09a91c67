package com.vigil.command;

import java.time.Instant;
import java.util.List;

public record CommandResponse(String command, Command parsed, Object result,
                              List<String> recommendations, Instant timestamp) {}
