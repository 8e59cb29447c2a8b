package com.carrental.model;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    DANGER
}
