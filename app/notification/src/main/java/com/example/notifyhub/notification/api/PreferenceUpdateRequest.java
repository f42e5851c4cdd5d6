package com.example.notifyhub.notification.api;

import jakarta.validation.constraints.NotNull;

public record PreferenceUpdateRequest(@NotNull(message = "enabled is required") Boolean enabled) {}
