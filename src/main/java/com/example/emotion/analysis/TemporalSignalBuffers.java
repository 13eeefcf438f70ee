package com.example.emotion.analysis;

import com.example.emotion.util.BoundedHistory;

import java.util.List;

/**
 * 会话级时间缓冲：眨眼窗口和近期几何快照，容量在创建时固定
 */
public class TemporalSignalBuffers {

    private final BoundedHistory<Boolean> blinkHistory;
    private final BoundedHistory<SignalSnapshot> signalHistory;

    public TemporalSignalBuffers(int blinkWindow, int signalHistorySize) {
        this.blinkHistory = new BoundedHistory<>(blinkWindow);
        this.signalHistory = new BoundedHistory<>(signalHistorySize);
    }

    void recordBlink(boolean blink) {
        blinkHistory.add(blink);
    }

    int blinkCount() {
        return blinkHistory.count(Boolean::booleanValue);
    }

    public int blinkSamples() {
        return blinkHistory.size();
    }

    void recordSnapshot(SignalSnapshot snapshot) {
        signalHistory.add(snapshot);
    }

    public List<SignalSnapshot> recentSnapshots() {
        return signalHistory.snapshot();
    }
}
