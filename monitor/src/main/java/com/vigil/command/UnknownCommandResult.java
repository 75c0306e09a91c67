package com.vigil.command;

import com.vigil.model.ResultStatus;

import java.util.List;

public record UnknownCommandResult(ResultStatus status, String message, List<String> suggestions) {}
