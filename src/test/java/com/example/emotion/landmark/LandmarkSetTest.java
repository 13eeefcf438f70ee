package com.example.emotion.landmark;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class LandmarkSetTest {

    @Test
    public void testRejectsWrongPointCount() {
        List<LandmarkPoint> points = new ArrayList<>(Collections.nCopies(468, new LandmarkPoint(0, 0, 0)));
        try {
            new LandmarkSet(LandmarkScheme.MEDIAPIPE_FACE_MESH, points);
            fail("点数不足时应拒绝构造");
        } catch (IllegalArgumentException expected) {
            assertTrue(expected.getMessage().contains("478"));
        }
    }

    @Test
    public void testResolvesNamedPointThroughScheme() {
        LandmarkSet face = SyntheticFaces.neutral().build();

        assertEquals(478, face.size());
        assertEquals(300.0, face.point(FacePoint.CHIN).getY(), 1e-9);
        assertSame(face.get(152), face.point(FacePoint.CHIN));
    }

    @Test(expected = MissingLandmarkException.class)
    public void testNonFinitePointIsMissing() {
        SyntheticFaces.neutral().invalidate(FacePoint.CHIN).build().point(FacePoint.CHIN);
    }

    @Test
    public void testUnmappedPointIsMissing() {
        LandmarkScheme partial = LandmarkScheme.builder("partial", 3)
                .map(FacePoint.CHIN, 2)
                .build();
        LandmarkSet face = new LandmarkSet(partial, Collections.nCopies(3, new LandmarkPoint(1, 2, 0)));

        assertTrue(partial.defines(FacePoint.CHIN));
        assertFalse(partial.defines(FacePoint.LEFT_JAW));
        try {
            face.point(FacePoint.LEFT_JAW);
            fail("未定义的关键点应抛出异常");
        } catch (MissingLandmarkException expected) {
            assertTrue(expected.getMessage().contains("LEFT_JAW"));
        }
    }

    @Test
    public void testBuiltInSchemesDefineEveryFacePoint() {
        for (FacePoint point : FacePoint.values()) {
            assertTrue(point + " 未在 MediaPipe 方案中定义", LandmarkScheme.MEDIAPIPE_FACE_MESH.defines(point));
            assertTrue(point + " 未在 iBUG 方案中定义", LandmarkScheme.IBUG_68.defines(point));
        }
        assertEquals(68, LandmarkScheme.IBUG_68.getPointCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSchemeRejectsOutOfRangeIndex() {
        LandmarkScheme.builder("tiny", 10).map(FacePoint.CHIN, 10);
    }

    @Test
    public void testMediaPipeIsTheReferenceCalibration() {
        assertEquals(1.0, LandmarkScheme.MEDIAPIPE_FACE_MESH.getBrowRatioScale(), 0.0);
        assertEquals(1.0, LandmarkScheme.MEDIAPIPE_FACE_MESH.getJawRatioScale(), 0.0);
        assertTrue(LandmarkScheme.IBUG_68.getBrowRatioScale() < 1.0);
        assertTrue(LandmarkScheme.IBUG_68.getJawRatioScale() > 1.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSchemeRejectsNonPositiveCalibration() {
        LandmarkScheme.builder("tiny", 10).ratioScales(0.0, 1.0);
    }
}
