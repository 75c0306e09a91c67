package com.vigil.api;

import com.vigil.command.Command;
import com.vigil.command.CommandDispatcher;
import com.vigil.command.CommandResponse;
import com.vigil.command.HelpResult;
import com.vigil.model.ResultStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CommandControllerTest {

    private final CommandDispatcher dispatcher = mock(CommandDispatcher.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new CommandController(dispatcher))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void dispatchesCommand() throws Exception {
        when(dispatcher.execute("help")).thenReturn(new CommandResponse(
                "help",
                Command.builder().action(Command.Action.HELP).build(),
                new HelpResult(ResultStatus.SUCCESS, "Available commands", List.of("show status")),
                List.of(),
                Instant.parse("2024-01-01T00:00:00Z")));

        mockMvc.perform(post("/api/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"help\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parsed.action").value("help"))
                .andExpect(jsonPath("$.result.message").value("Available commands"))
                .andExpect(jsonPath("$.parsed.endpoint").doesNotExist());
    }

    @Test
    void blankCommandIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/command")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No command provided"));
        verifyNoInteractions(dispatcher);
    }
}
