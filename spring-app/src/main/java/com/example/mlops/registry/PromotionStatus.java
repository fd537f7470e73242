package com.example.mlops.registry;

public enum PromotionStatus {
    CANDIDATE,
    ACTIVE,
    RETIRED
}
