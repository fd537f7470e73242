package com.example.mlops.policy;

public enum Verdict {
    NONE,
    RETRAIN
}
