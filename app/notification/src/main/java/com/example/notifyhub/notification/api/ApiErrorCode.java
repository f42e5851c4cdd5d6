/*
 * Where: notification API
 * What: machine-readable codes of error responses
 * Why: clients tell causes apart even when the HTTP status is the same
 */
package com.example.notifyhub.notification.api;

public enum ApiErrorCode {
    BAD_REQUEST,
    INVALID_EVENT,
    INVALID_VERIFICATION_TOKEN,
    STORE_UNAVAILABLE
}
