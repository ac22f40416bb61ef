package com.changedetection.alignment;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public class AlignmentAttempt {
    private final AlignmentStrategyName strategy;
    private final boolean success;
    private final String message;

    @Override
    public String toString() {
        return strategy + (success ? ": ok" : ": " + message);
    }
}
