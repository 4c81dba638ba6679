package io.chronr.query;

import com.google.common.collect.ImmutableList;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import io.chronr.query.result.Aggregate;
import io.chronr.query.result.HistogramAggregate;
import io.chronr.query.result.ListAggregate;
import io.chronr.query.result.Point;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.ScanSplit;
import io.chronr.segment.mem.TimeSeriesMemStore;

import static io.chronr.query.MachineMetricsData.query;
import static io.chronr.query.MachineMetricsData.schema;

/**
 * Aggregations and combiners end to end, over 30 rows of 10 series.
 */
public class CombinerTest {
    private TimeSeriesMemStore memStore;
    private QueryEngine engine;

    @Before
    public void before() {
        memStore = MachineMetricsData.loadedStore(30);
        engine = new QueryEngine(memStore, new QueryConfig(new Properties()));
    }

    @After
    public void after() {
        engine.close();
        memStore.reset();
    }

    private Result<Aggregate> run(QuerySpec spec) throws Exception {
        return engine.submit(schema, 0, spec, ScanSplit.ALL).get(10, TimeUnit.SECONDS);
    }

    @Test
    public void testLastWithList() throws Exception {
        Result<Aggregate> res = run(query("last", Arrays.asList("timestamp", "min"), "simple"));
        Assert.assertTrue(res.toString(), res.isGood());

        List<? extends SeriesValues<?>> values = ((ListAggregate<?>) res.get()).values;
        Assert.assertEquals(10, values.size());
        Assert.assertEquals("Series 0", values.get(0).seriesKey);
        Assert.assertEquals(Point.of(120000L, 21.0), values.get(0).points.get(0));
        for (int k = 0; k < 10; k++) {
            SeriesValues<?> sv = values.get(k);
            Assert.assertEquals("Series " + k, sv.seriesKey);
            Assert.assertEquals(Point.of(120000L + k * 1000L, 21.0 + k), sv.points.get(0));
        }
    }

    @Test
    public void testSumWithHistogram() throws Exception {
        // Per series sums are 33, 36, ..., 60.
        Result<Aggregate> res = run(query("sum", ImmutableList.of("min"), "histogram", "2000"));
        Assert.assertTrue(res.toString(), res.isGood());
        Assert.assertEquals(Aggregate.Kind.HISTOGRAM, res.get().kind());

        HistogramAggregate histogram = (HistogramAggregate) res.get();
        Assert.assertArrayEquals(new int[]{0, 0, 0, 0, 4, 6, 0, 0, 0, 0}, histogram.counts());
        Assert.assertEquals(10, histogram.total());
    }

    @Test
    public void testHistogramDropsOutOfRange() throws Exception {
        // Sums of max go from 329.7 to 356.7.
        HistogramAggregate histogram = (HistogramAggregate) run(
                query("sum", ImmutableList.of("max"), "histogram", "400", "4")).get();
        Assert.assertEquals(4, histogram.bucketCount());
        Assert.assertArrayEquals(new int[]{0, 0, 0, 10}, histogram.counts());

        HistogramAggregate few = (HistogramAggregate) run(
                query("sum", ImmutableList.of("max"), "histogram", "340", "4")).get();
        Assert.assertEquals(4, few.total());
    }

    @Test
    public void testCombinerArgumentErrors() throws Exception {
        QuerySpec spec = query("sum", ImmutableList.of("min"), "histogram");
        Assert.assertEquals(new WrongNumberArguments(0, 1), run(spec).error());
        Assert.assertEquals(new WrongNumberArguments(3, 1),
                run(spec.withCombinerArgs(ImmutableList.of("one", "two", "three"))).error());
        Assert.assertTrue(run(spec.withCombinerArgs(ImmutableList.of("1abc2", "10"))).error() instanceof BadArgument);
        Assert.assertTrue(run(spec.withCombinerArgs(ImmutableList.of("1E6", "1.1"))).error() instanceof BadArgument);
    }

    @Test
    public void testTimeGroupMinWithList() throws Exception {
        List<String> args = Arrays.asList("timestamp", "min", "110000", "130000", "2");
        Result<Aggregate> res = run(query("timegroup_min", args, "list"));
        Assert.assertTrue(res.toString(), res.isGood());

        List<? extends SeriesValues<?>> values = ((ListAggregate<?>) res.get()).values;
        Assert.assertEquals(10, values.size());
        for (int k = 0; k < 10; k++) {
            List<? extends Point<?>> points = values.get(k).points;
            Assert.assertEquals(2, points.size());
            Assert.assertEquals(Point.of(110000L, 11.0 + k), points.get(0));
            Assert.assertEquals(Point.of(120000L, 21.0 + k), points.get(1));
        }

        Result<Aggregate> mismatch = run(query("timegroup_min", args, "histogram", "2000"));
        Assert.assertTrue(mismatch.error() instanceof InvalidAggregator);
    }

    @Test
    public void testTimeGroupWideRange() throws Exception {
        List<String> args = Arrays.asList("timestamp", "min", "-5000000000000000000", "5000000000000000000", "2");
        Result<Aggregate> res = run(query("timegroup_min", args, "simple"));
        Assert.assertTrue(res.toString(), res.isGood());

        List<? extends SeriesValues<?>> values = ((ListAggregate<?>) res.get()).values;
        for (int k = 0; k < 10; k++) {
            List<? extends Point<?>> points = values.get(k).points;
            Assert.assertEquals(-5000000000000000000L, points.get(0).timestamp);
            Assert.assertTrue(Double.isNaN((Double) points.get(0).value));
            // Every sample is past 0, the middle of the range.
            Assert.assertEquals(Point.of(0L, 1.0 + k), points.get(1));
        }
    }

    @Test
    public void testScalarFunctions() throws Exception {
        ListAggregate<?> count = (ListAggregate<?>) run(query("count", ImmutableList.of("p90"), "simple")).get();
        Assert.assertEquals(Point.of(120000L, 3L), count.values.get(0).points.get(0));

        ListAggregate<?> avg = (ListAggregate<?>) run(query("avg", ImmutableList.of("avg"), "simple")).get();
        // Series 9: 29, 39, 49.
        Assert.assertEquals(39.0, (Double) avg.values.get(9).points.get(0).value, 1e-9);

        ListAggregate<?> first = (ListAggregate<?>) run(query("first", Arrays.asList("timestamp", "p90"), "simple")).get();
        Assert.assertEquals(Point.of(101000L, 86.0), first.values.get(1).points.get(0));
    }
}
