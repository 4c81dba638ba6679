package io.chronr.query.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import io.chronr.util.JsonUtil;

public class AggregateTest {

    @Test
    public void testJson() throws Exception {
        ListAggregate<Double> list = new ListAggregate<>(ImmutableList.of(
                SeriesValues.single("a", 10, 1.5),
                SeriesValues.<Double>empty("b")));
        JsonNode node = JsonUtil.jsonMapper.readTree(list.toString());
        Assert.assertEquals("LIST", node.get("kind").asText());
        Assert.assertEquals("a", node.get("values").get(0).get("series").asText());
        Assert.assertEquals(10, node.get("values").get(0).get("points").get(0).get("timestamp").asLong());
        Assert.assertEquals(0, node.get("values").get(1).get("points").size());

        HistogramAggregate histogram = new HistogramAggregate(new double[]{10, 100}, new int[]{3, 1});
        node = JsonUtil.jsonMapper.readTree(histogram.toString());
        Assert.assertEquals("HISTOGRAM", node.get("kind").asText());
        Assert.assertEquals(3, node.get("counts").get(0).asInt());
        Assert.assertEquals(4, histogram.total());
    }

    @Test
    public void testHistogramUnmodifiable() {
        double[] bounds = {10, 100};
        int[] counts = {3, 1};
        HistogramAggregate histogram = new HistogramAggregate(bounds, counts);
        counts[0] = 99;
        bounds[1] = 5;
        histogram.counts()[1] = 42;
        histogram.bounds()[0] = 0;

        Assert.assertArrayEquals(new int[]{3, 1}, histogram.counts());
        Assert.assertArrayEquals(new double[]{10, 100}, histogram.bounds(), 0.0);
        Assert.assertEquals(new HistogramAggregate(new double[]{10, 100}, new int[]{3, 1}), histogram);
        Assert.assertEquals(2, histogram.bucketCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHistogramLengths() {
        new HistogramAggregate(new double[]{10}, new int[]{1, 2});
    }
}
