package com.municipality.wastecollection.geo;

import com.municipality.wastecollection.config.CollectionProperties;
import com.municipality.wastecollection.dto.NearbyBin;
import com.municipality.wastecollection.model.Bin;
import com.municipality.wastecollection.model.FillLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BinSpatialIndexTest {

    private static final GeoPoint CENTER = new GeoPoint(36.8065, 10.1815);

    private BinSpatialIndex index;

    @BeforeEach
    void setUp() {
        index = new BinSpatialIndex(new CollectionProperties());
    }

    private static Bin bin(String id, double latitude, double longitude, FillLevel level) {
        Bin bin = new Bin();
        bin.setId(id);
        bin.setCapacityLiters(120);
        bin.setLatitude(latitude);
        bin.setLongitude(longitude);
        bin.setCurrentFillLevel(level);
        return bin;
    }

    private static List<String> ids(List<NearbyBin> result) {
        return result.stream().map(nearby -> nearby.getBin().getId()).collect(Collectors.toList());
    }

    @Test
    void testNearbyIsSortedByDistance() {
        index.upsert(bin("far", 36.8265, 10.1815, FillLevel.EMPTY));
        index.upsert(bin("near", 36.8075, 10.1815, FillLevel.EMPTY));
        index.upsert(bin("mid", 36.8165, 10.1815, FillLevel.EMPTY));

        List<NearbyBin> result = index.nearby(CENTER, 5000, false);

        assertEquals(List.of("near", "mid", "far"), ids(result));
        assertTrue(result.get(0).getDistanceMeters() < result.get(1).getDistanceMeters());
    }

    @Test
    void testEqualDistancesAreOrderedById() {
        index.upsert(bin("b", 36.81, 10.19, FillLevel.EMPTY));
        index.upsert(bin("a", 36.81, 10.19, FillLevel.EMPTY));

        assertEquals(List.of("a", "b"), ids(index.nearby(CENTER, 5000, false)));
    }

    @Test
    void testRadiusBoundaryIsInclusive() {
        Bin edge = bin("edge", 36.8200, 10.1900, FillLevel.EMPTY);
        index.upsert(edge);
        double exact = GeoDistance.meters(CENTER.getLatitude(), CENTER.getLongitude(), edge.getLatitude(), edge.getLongitude());

        assertEquals(List.of("edge"), ids(index.nearby(CENTER, exact, false)));
        assertTrue(index.nearby(CENTER, exact - 0.01, false).isEmpty());
    }

    @Test
    void testQuerySpanningSeveralCells() {
        // ~3.3 km north and ~2.7 km east, several 0.01° cells away
        index.upsert(bin("north", 36.8365, 10.1815, FillLevel.EMPTY));
        index.upsert(bin("east", 36.8065, 10.2115, FillLevel.EMPTY));
        index.upsert(bin("outside", 36.9065, 10.1815, FillLevel.EMPTY));

        assertEquals(List.of("east", "north"), ids(index.nearby(CENTER, 4000, false)));
    }

    @Test
    void testEligibleOnlyFiltersBinsNotNeedingCollection() {
        index.upsert(bin("full", 36.807, 10.182, FillLevel.FULL));
        index.upsert(bin("three-quarters", 36.808, 10.182, FillLevel.THREE_QUARTERS));
        index.upsert(bin("half", 36.8066, 10.1816, FillLevel.HALF));

        assertEquals(List.of("full", "three-quarters"), ids(index.nearby(CENTER, 1000, true)));
        assertEquals(3, index.nearby(CENTER, 1000, false).size());
        assertEquals(List.of("full", "three-quarters"),
                index.eligibleBins().stream().map(Bin::getId).collect(Collectors.toList()));
    }

    @Test
    void testInactiveBinsAreNeverIndexed() {
        Bin inactive = bin("gone", 36.807, 10.182, FillLevel.FULL);
        inactive.setActive(false);
        index.upsert(inactive);

        assertTrue(index.nearby(CENTER, 1000, false).isEmpty());
        assertEquals(0, index.size());
    }

    @Test
    void testUpsertMovesBinAndRemoveDropsIt() {
        index.upsert(bin("moving", 36.807, 10.182, FillLevel.EMPTY));
        index.upsert(bin("moving", 37.5, 11.0, FillLevel.EMPTY));

        assertTrue(index.nearby(CENTER, 2000, false).isEmpty());
        assertEquals(1, index.nearby(new GeoPoint(37.5, 11.0), 10, false).size());

        index.remove("moving");
        assertEquals(0, index.size());
    }

    @Test
    void testQueryAcrossTheAntimeridian() {
        index.upsert(bin("west", -17.0, -179.999, FillLevel.EMPTY));

        List<NearbyBin> result = index.nearby(new GeoPoint(-17.0, 179.999), 500, false);

        assertEquals(List.of("west"), ids(result));
    }

    @Test
    void testResultsAreDetachedCopies() {
        index.upsert(bin("copy", 36.807, 10.182, FillLevel.FULL));

        Bin returned = index.nearby(CENTER, 1000, false).get(0).getBin();
        returned.setCurrentFillLevel(FillLevel.EMPTY);
        returned.setLatitude(0);

        assertEquals(1, index.nearby(CENTER, 1000, true).size());
    }

    @Test
    void testRebuildReplacesContents() {
        index.upsert(bin("old", 36.807, 10.182, FillLevel.EMPTY));
        Bin inactive = bin("inactive", 36.807, 10.182, FillLevel.EMPTY);
        inactive.setActive(false);

        index.rebuild(List.of(bin("new", 36.807, 10.182, FillLevel.EMPTY), inactive));

        assertEquals(List.of("new"), ids(index.nearby(CENTER, 1000, false)));
    }

    @Test
    void testRejectsNegativeRadius() {
        assertThrows(IllegalArgumentException.class, () -> index.nearby(CENTER, -1, false));
    }
}
