package com.z254.hivemind.dispatch.learning;

public record SweepResult(int decayed, int pruned, int remaining) {
}
