package com.example.mlops.dto;

/**
 * One training example: the model inputs plus the observed target
 * (e.g. trip duration in minutes).
 */
public record LabeledRow(FeatureVector features, double label) {}
