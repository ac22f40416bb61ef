package com.changedetection.feature;

/**
 * Fixed-length signature of one keypoint: either a float vector or packed binary bits.
 */
public final class Descriptor {
    private final float[] values;
    private final byte[] bits;

    private Descriptor(float[] values, byte[] bits) {
        this.values = values;
        this.bits = bits;
    }

    public static Descriptor ofValues(float[] values) {
        return new Descriptor(values.clone(), null);
    }

    public static Descriptor ofBits(byte[] bits) {
        return new Descriptor(null, bits.clone());
    }

    public boolean isBinary() {
        return bits != null;
    }

    /**
     * Number of elements (floats, or bytes for binary descriptors).
     */
    public int length() {
        return bits != null ? bits.length : values.length;
    }

    public float[] values() {
        if (values == null) throw new IllegalStateException("Binary descriptor has no float values");
        return values.clone();
    }

    public byte[] bits() {
        if (bits == null) throw new IllegalStateException("Float descriptor has no bits");
        return bits.clone();
    }

    float[] valuesView() {
        return values;
    }

    byte[] bitsView() {
        return bits;
    }

    public double distanceTo(Descriptor other) {
        if (isBinary() != other.isBinary() || length() != other.length()) {
            throw new IllegalArgumentException("Descriptors are not comparable");
        }
        if (isBinary()) {
            int d = 0;
            for (int i = 0; i < bits.length; i++) d += Integer.bitCount((bits[i] ^ other.bits[i]) & 0xFF);
            return d;
        }
        double sum = 0;
        for (int i = 0; i < values.length; i++) {
            double diff = values[i] - other.values[i];
            sum += diff * diff;
        }
        return Math.sqrt(sum);
    }
}
