package com.vigil.api;

import com.vigil.command.CommandDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/command")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class CommandController {

    private final CommandDispatcher dispatcher;

    @PostMapping
    public ResponseEntity<?> processCommand(@RequestBody(required = false) CommandRequest request) {
        if (request == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid JSON data"));
        }
        if (request.command() == null || request.command().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No command provided"));
        }
        return ResponseEntity.ok(dispatcher.execute(request.command()));
    }

    public record CommandRequest(String command) {}
}
