package com.cgi.dataprofiler.engine.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class CompensatedSumTest {

    @Test
    public void testRecoversLowOrderBits() {
        CompensatedSum sum = new CompensatedSum();
        sum.add(1e16);
        for (int i = 0; i < 1000; i++) {
            sum.add(1.0);
        }
        sum.add(-1e16);

        assertEquals(1000.0, sum.value(), 0.0);
    }

    @Test
    public void testMergeMatchesSequentialSum() {
        CompensatedSum left = new CompensatedSum();
        CompensatedSum right = new CompensatedSum();
        CompensatedSum all = new CompensatedSum();
        for (int i = 0; i < 10_000; i++) {
            double value = 0.1 * i;
            (i % 2 == 0 ? left : right).add(value);
            all.add(value);
        }

        left.add(right);
        assertEquals(all.value(), left.value(), 1e-9);
    }
}
