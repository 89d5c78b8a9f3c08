package com.notiflow.notification.common.model;

/**
 * Identity of the caller that originated a notification.
 */
public record Subject(String id, String name) {
}
