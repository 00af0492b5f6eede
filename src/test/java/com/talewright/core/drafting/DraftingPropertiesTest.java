package com.talewright.core.drafting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DraftingPropertiesTest {

    private final DraftingProperties properties = new DraftingProperties();

    @Test
    void shortScenesAreWrittenInOneBeat() {
        assertEquals(1, properties.beatsFor(1500));
        assertEquals(1, properties.beatsFor(2500));
    }

    @Test
    void longScenesUseThreeBeatsThenTheMaximum() {
        assertEquals(3, properties.beatsFor(2501));
        assertEquals(3, properties.beatsFor(5000));
        assertEquals(4, properties.beatsFor(5001));
    }

    @Test
    void maximumIsClampedToFourBeats() {
        properties.setMaxBeats(9);
        assertEquals(4, properties.beatsFor(8000));

        properties.setMaxBeats(1);
        assertEquals(3, properties.beatsFor(8000));
    }
}
