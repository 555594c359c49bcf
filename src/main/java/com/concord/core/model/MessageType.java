package com.concord.core.model;

public enum MessageType {
    REQUEST,
    RESPONSE,
    STATUS,
    COORDINATION,
    CONFLICT,
    HEARTBEAT
}
