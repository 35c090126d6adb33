package com.example.journey.model;

/**
 * 跨线事件方向
 */
public enum CrossingEvent {
    ENTRY, EXIT
}
