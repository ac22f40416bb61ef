package com.changedetection.changeSignal;

/**
 * Either a computed {@link ChangeSignal} or the reason it could not be computed.
 */
public final class SignalOutcome {
    private final SignalType type;
    private final ChangeSignal signal;
    private final String reason;

    private SignalOutcome(SignalType type, ChangeSignal signal, String reason) {
        this.type = type;
        this.signal = signal;
        this.reason = reason;
    }

    public static SignalOutcome available(ChangeSignal signal) {
        return new SignalOutcome(signal.getType(), signal, null);
    }

    public static SignalOutcome unavailable(SignalType type, String reason) {
        return new SignalOutcome(type, null, reason);
    }

    public SignalType getType() {
        return type;
    }

    public boolean isAvailable() {
        return signal != null;
    }

    public ChangeSignal getSignal() {
        if (signal == null) throw new IllegalStateException(type + " is unavailable: " + reason);
        return signal;
    }

    public String getReason() {
        if (signal != null) throw new IllegalStateException(type + " is available");
        return reason;
    }

    @Override
    public String toString() {
        return type + (signal != null ? " (available)" : " (unavailable: " + reason + ")");
    }
}
