package com.eainde.athlete.controller;

import java.time.Instant;

public record ApiError(String code, String message, Instant timestamp) {
}
