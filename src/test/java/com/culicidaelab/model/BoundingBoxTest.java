package com.culicidaelab.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoundingBoxTest {

    @Test
    public void testParse() {
        BoundingBox bbox = BoundingBox.parse(" -10.5, 20 ,30,40.25");

        assertEquals(-10.5, bbox.getMinLon());
        assertEquals(20.0, bbox.getMinLat());
        assertEquals(30.0, bbox.getMaxLon());
        assertEquals(40.25, bbox.getMaxLat());
    }

    @Test
    public void testRejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.parse(null));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.parse("1,2,3"));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.parse("1,2,3,x"));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.parse("1,2,3,NaN"));
        assertThrows(IllegalArgumentException.class, () -> BoundingBox.parse("5,0,1,1"));
    }

    @Test
    public void testContainsIsInclusive() {
        BoundingBox bbox = BoundingBox.parse("0,0,10,10");

        assertTrue(bbox.contains(0, 0));
        assertTrue(bbox.contains(10, 10));
        assertTrue(bbox.contains(5, 5));
        assertFalse(bbox.contains(10.0001, 5));
    }
}
