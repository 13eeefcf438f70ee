package com.example.emotion.dto;

import org.junit.Test;

import static org.junit.Assert.*;

public class FrameImageTest {

    @Test
    public void testPixelsCannotBeChangedFromOutside() {
        byte[] pixels = new byte[2 * 1 * FrameImage.CHANNELS];
        FrameImage image = new FrameImage(2, 1, pixels);

        pixels[0] = 7;
        image.getBgr()[1] = 9;

        assertEquals(0, image.getBgr()[0]);
        assertEquals(0, image.getBgr()[1]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsMismatchedBuffer() {
        new FrameImage(2, 2, new byte[5]);
    }
}
