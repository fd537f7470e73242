package com.example.mlops.coordinator;

public enum TriggerReason {
    DRIFT,
    MANUAL
}
