package com.eainde.athlete.stream;

public record ErrorPayload(String message, String code) {
}
