package podcluster.cloud.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlacementTest {

    @Test
    void placeholderMeansUnconstrained() {
        assertEquals(Placement.unconstrained(), Placement.fromRegion("PLACEHOLDER"));
    }

    @Test
    void splitsOnceOnSeparator() {
        assertEquals(new Placement("United States", "US-TX-3 - b"), Placement.fromRegion("United States - US-TX-3 - b"));
    }

    @Test
    void countryWithoutDataCenter() {
        assertEquals(new Placement("Finland", ""), Placement.fromRegion("Finland"));
    }
}
