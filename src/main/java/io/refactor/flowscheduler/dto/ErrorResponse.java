package io.refactor.flowscheduler.dto;

public record ErrorResponse(int code, String message) {
}
