package com.example.emotion.analysis;

/**
 * 几何计算结果：成功得到 {@link MicroSignal}，或因关键点缺失/退化而不可用。
 * 用于区分"计算失败"与"计算成功但强度很低"。
 */
public final class SignalResult {

    private final MicroSignal signal;
    private final String reason;

    private SignalResult(MicroSignal signal, String reason) {
        this.signal = signal;
        this.reason = reason;
    }

    public static SignalResult ok(MicroSignal signal) {
        if (signal == null) {
            throw new IllegalArgumentException("signal不能为空");
        }
        return new SignalResult(signal, null);
    }

    public static SignalResult unavailable(String reason) {
        return new SignalResult(null, reason);
    }

    public boolean isAvailable() {
        return signal != null;
    }

    public MicroSignal getSignal() {
        if (signal == null) {
            throw new IllegalStateException("指标不可用: " + reason);
        }
        return signal;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 不可用时退化为 {@link MicroSignal#none()}
     */
    public MicroSignal orNone() {
        return signal != null ? signal : MicroSignal.none();
    }

    @Override
    public String toString() {
        return signal != null ? "Ok(" + signal + ")" : "Unavailable(" + reason + ")";
    }
}
