package com.cgi.dataprofiler.detector.strategy;

import com.cgi.dataprofiler.detector.model.AnomalyResult;
import org.junit.Test;

import static org.junit.Assert.*;

public class IqrMethodTest {

    private static final double DELTA = 1e-9;

    private final IqrMethod method = new IqrMethod(1.5);

    @Test
    public void testTukeyFences() {
        AnomalyResult result = method.detect(AnomalyTestData.withOutlier());

        assertEquals(1, result.getCount());
        assertEquals(11.0, (Double) result.getParameters().get("q1"), DELTA);
        assertEquals(13.0, (Double) result.getParameters().get("q3"), DELTA);
        assertEquals(8.0, (Double) result.getParameters().get("lower_bound"), DELTA);
        assertEquals(16.0, (Double) result.getParameters().get("upper_bound"), DELTA);
    }

    @Test
    public void testConstantValuesHaveNoOutliers() {
        assertEquals(0, method.detect(new double[]{5, 5, 5, 5, 5}).getCount());
    }

    @Test
    public void testOutlierExamplesAreBounded() {
        double[] values = new double[1000];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < 800 ? 10 + i % 5 : 1000.0 + i;
        }

        AnomalyResult result = method.detect(values);

        assertEquals(200, result.getCount());
        assertEquals(AbstractAnomalyDetectionMethod.MAX_OUTLIER_EXAMPLES, result.getOutlierValues().size());
    }
}
