package com.example.notifyhub.notification.delivery;

public record AccountContactResponse(String userId, String email, String status) {}
