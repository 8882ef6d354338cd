package com.clinic.scheduling.dto;

import com.clinic.scheduling.exception.ErrorKind;

public record ErrorResponse(ErrorKind kind, String message) {
}
