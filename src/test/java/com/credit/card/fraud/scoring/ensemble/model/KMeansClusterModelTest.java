package com.credit.card.fraud.scoring.ensemble.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KMeansClusterModelTest {

    private final KMeansClusterModel model = new KMeansClusterModel(new double[][]{{0, 0}, {10, 10}});

    @Test
    void assign_shouldReturnNearestCentroid() {
        assertEquals(0, model.assign(new double[]{1, 1}));
        assertEquals(1, model.assign(new double[]{9, 9}));
    }

    @Test
    void assign_shouldPreferLowestIndex_onTie() {
        assertEquals(0, model.assign(new double[]{5, 5}));
    }

    @Test
    void constructor_shouldRejectRaggedCentroids() {
        assertThrows(IllegalArgumentException.class, () -> new KMeansClusterModel(new double[][]{{0, 0}, {1}}));
    }
}
