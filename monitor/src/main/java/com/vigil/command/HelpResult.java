package com.vigil.command;

import com.vigil.model.ResultStatus;

import java.util.List;

public record HelpResult(ResultStatus status, String message, List<String> examples) {}
