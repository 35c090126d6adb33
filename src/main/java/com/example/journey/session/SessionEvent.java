package com.example.journey.session;

/**
 * 会话事件日志条目
 */
public enum SessionEvent {
    ENTRY, EXIT, AUTO_EXIT
}
