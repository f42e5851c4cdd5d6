/*
 * Where: notification domain model
 * What: lifecycle states of a notification job
 * Why: keeps the database values and the dispatch logic in step
 */
package com.example.notifyhub.notification.model;

public enum JobStatus {
  PENDING,
  IN_PROGRESS,
  SENT,
  FAILED
}
