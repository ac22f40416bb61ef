package com.changedetection.changeSignal;

import lombok.Getter;

/**
 * Binary change mask derived from a {@link ChangeMap}.
 */
@Getter
public final class ChangeMask {
    private final int width;
    private final int height;
    @Getter(lombok.AccessLevel.NONE)
    private final boolean[] values;
    private final long changedPixels;

    private ChangeMask(int width, int height, boolean[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
        long count = 0;
        for (boolean v : values) if (v) count++;
        this.changedPixels = count;
    }

    public static ChangeMask of(int width, int height, boolean[] values) {
        return new ChangeMask(width, height, values.clone());
    }

    public static ChangeMask empty(int width, int height) {
        return new ChangeMask(width, height, new boolean[width * height]);
    }

    public boolean get(int x, int y) {
        return values[y * width + x];
    }

    public boolean get(int index) {
        return values[index];
    }

    public long getTotalPixels() {
        return values.length;
    }

    public double getChangePercentage() {
        return values.length == 0 ? 0.0 : 100.0 * changedPixels / values.length;
    }

    public boolean[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeMask)) return false;
        ChangeMask that = (ChangeMask) o;
        return width == that.width && height == that.height && java.util.Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + java.util.Arrays.hashCode(values);
    }
}
