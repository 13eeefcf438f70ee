package com.example.emotion.config;

import org.junit.Test;

import static org.junit.Assert.*;

public class EmotionAnalysisPropertiesTest {

    @Test
    public void testDefaultsAreValid() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.validate();

        assertEquals(7.0, properties.getFps(), 1e-9);
        assertEquals(30, properties.getBlinkWindow());
        assertEquals(0.6, properties.getFusion().getClassifierWeight(), 1e-9);
    }

    @Test
    public void testStressWeightsMustSumToOne() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.getFusion().setStressBlinkRateWeight(0.5);

        try {
            properties.validate();
            fail("权重之和不为1时应拒绝启动");
        } catch (IllegalStateException expected) {
            assertTrue(expected.getMessage().contains("stress"));
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testAnxietyWeightsMustBeNonNegative() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.getFusion().setAnxietyEyeWideningWeight(-0.2);
        properties.getFusion().setAnxietyLipPressWeight(0.9);
        properties.validate();
    }

    @Test(expected = IllegalStateException.class)
    public void testFpsMustBePositive() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.setFps(0);
        properties.validate();
    }

    @Test(expected = IllegalStateException.class)
    public void testWindowMustBePositive() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.setBlinkWindow(0);
        properties.validate();
    }

    @Test(expected = IllegalStateException.class)
    public void testClassifierWeightRange() {
        EmotionAnalysisProperties properties = new EmotionAnalysisProperties();
        properties.getFusion().setClassifierWeight(1.5);
        properties.validate();
    }
}
