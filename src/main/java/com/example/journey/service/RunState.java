package com.example.journey.service;

/**
 * 运行状态
 */
public enum RunState {
    IDLE, RUNNING, STOPPED, COMPLETED, ERROR
}
