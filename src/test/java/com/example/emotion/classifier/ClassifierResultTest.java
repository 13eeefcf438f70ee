package com.example.emotion.classifier;

import org.junit.Test;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.Assert.*;

public class ClassifierResultTest {

    @Test
    public void testDominantIsArgmax() {
        Map<Emotion, Double> probabilities = new EnumMap<>(Emotion.class);
        probabilities.put(Emotion.FEAR, 0.2);
        probabilities.put(Emotion.SURPRISE, 0.5);
        probabilities.put(Emotion.NEUTRAL, 0.3);

        ClassifierResult result = ClassifierResult.fromProbabilities(probabilities);

        assertEquals(Emotion.SURPRISE, result.getDominantEmotion());
        assertEquals(0.5, result.getConfidence(), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsDerivedEmotion() {
        Map<Emotion, Double> probabilities = new EnumMap<>(Emotion.class);
        probabilities.put(Emotion.STRESSED, 1.0);
        ClassifierResult.fromProbabilities(probabilities);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsNegativeProbability() {
        Map<Emotion, Double> probabilities = new EnumMap<>(Emotion.class);
        probabilities.put(Emotion.SAD, -0.1);
        ClassifierResult.fromProbabilities(probabilities);
    }

    @Test
    public void testFerPlusSoftmaxFoldsContemptIntoDisgust() {
        // neutral, happiness, surprise, sadness, anger, disgust, fear, contempt
        float[] logits = {0f, 0f, 0f, 0f, 0f, 0f, 0f, 0f};

        Map<Emotion, Double> probabilities = OpenCvDnnEmotionClassifier.softmax(logits);

        assertEquals(7, probabilities.size());
        assertEquals(0.25, probabilities.get(Emotion.DISGUST), 1e-9);
        assertEquals(0.125, probabilities.get(Emotion.NEUTRAL), 1e-9);
        double sum = probabilities.values().stream().mapToDouble(Double::doubleValue).sum();
        assertEquals(1.0, sum, 1e-9);
    }

    @Test
    public void testFerPlusSoftmaxIsNumericallyStable() {
        float[] logits = {1000f, 0f, 0f, 0f, 0f, 0f, 0f, 0f};

        Map<Emotion, Double> probabilities = OpenCvDnnEmotionClassifier.softmax(logits);

        assertEquals(1.0, probabilities.get(Emotion.NEUTRAL), 1e-9);
        assertEquals(Emotion.NEUTRAL, ClassifierResult.fromProbabilities(probabilities).getDominantEmotion());
    }

    @Test
    public void testLabels() {
        assertEquals(Emotion.ANXIOUS, Emotion.fromLabel("anxious"));
        assertFalse(Emotion.STRESSED.isClassifierLabel());
        assertTrue(Emotion.DISGUST.isClassifierLabel());
    }

    @Test
    public void testOnlyValidatedFactoryCreatesResults() {
        for (Constructor<?> constructor : ClassifierResult.class.getDeclaredConstructors()) {
            assertTrue(constructor + " 不应公开", Modifier.isPrivate(constructor.getModifiers()));
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testProbabilitiesAreReadOnly() {
        Map<Emotion, Double> probabilities = new EnumMap<>(Emotion.class);
        probabilities.put(Emotion.HAPPY, 1.0);

        ClassifierResult.fromProbabilities(probabilities).getProbabilities().put(Emotion.SAD, 0.5);
    }
}
