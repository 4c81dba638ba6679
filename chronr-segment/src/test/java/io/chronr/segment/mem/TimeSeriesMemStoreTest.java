package io.chronr.segment.mem;

import com.google.common.collect.Lists;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import io.chronr.segment.ColumnReadException;
import io.chronr.segment.ColumnSchema;
import io.chronr.segment.ColumnType;
import io.chronr.segment.DatasetRef;
import io.chronr.segment.DatasetSchema;
import io.chronr.segment.Partition;
import io.chronr.segment.PartitionScan;
import io.chronr.segment.Record;
import io.chronr.segment.Sample;
import io.chronr.segment.ScanSplit;

public class TimeSeriesMemStoreTest {
    private static final DatasetRef ref = DatasetRef.of("cpu");
    private static final DatasetSchema schema = new DatasetSchema(ref,
            Arrays.asList(
                    new ColumnSchema("timestamp", ColumnType.TIMESTAMP),
                    new ColumnSchema("usage", ColumnType.DOUBLE),
                    new ColumnSchema("cores", ColumnType.LONG),
                    new ColumnSchema("host", ColumnType.STRING)),
            "host", "timestamp");

    private final TimeSeriesMemStore memStore = new TimeSeriesMemStore();

    @After
    public void after() {
        memStore.reset();
    }

    private static List<Record> records(int hosts, int perHost) {
        List<Record> records = new ArrayList<>();
        for (int n = 0; n < hosts * perHost; n++) {
            records.add(Record.of(1000L + n * 10, 0.5 * n, 4, "host-" + (n % hosts)));
        }
        return records;
    }

    private List<Partition> scan(PartitionScan scan) {
        return Lists.newArrayList(memStore.scanPartitions(ref, 0, scan));
    }

    @Test
    public void testIngestAndRead() {
        memStore.setup(schema, 0);
        memStore.ingest(ref, 0, records(3, 4));
        Assert.assertEquals(3, memStore.numPartitions(ref, 0));

        List<Partition> partitions = scan(PartitionScan.of(ScanSplit.ALL));
        Assert.assertEquals(3, partitions.size());
        Partition p = partitions.get(1);
        Assert.assertEquals("host-1", p.seriesKey());
        Assert.assertEquals(4, p.rowCount());
        Assert.assertEquals(ref, p.dataset());

        List<Sample> samples = Lists.newArrayList(p.readValues("usage"));
        Assert.assertEquals(4, samples.size());
        Assert.assertEquals(1010L, samples.get(0).timestamp);
        Assert.assertEquals(0.5, samples.get(0).value, 0.0);
        Assert.assertEquals(1100L, samples.get(3).timestamp);
        Assert.assertEquals(5.0, samples.get(3).value, 0.0);

        // Integral columns are readable as values, and as timestamps.
        List<Sample> cores = Lists.newArrayList(p.readValues("cores", "cores"));
        Assert.assertEquals(4L, cores.get(0).timestamp);
        Assert.assertEquals(4.0, cores.get(0).value, 0.0);
    }

    @Test
    public void testReaderSeesSnapshot() {
        memStore.setup(schema, 0);
        memStore.ingest(ref, 0, records(1, 2));
        Partition p = scan(PartitionScan.of(ScanSplit.ALL)).get(0);
        Iterator<Sample> it = p.readValues("usage");

        // Grow past the initial capacity while the reader is open.
        memStore.ingest(ref, 0, records(1, 100));
        Assert.assertEquals(2, Lists.newArrayList(it).size());
        Assert.assertEquals(102, p.rowCount());
    }

    @Test
    public void testUnreadableColumns() {
        memStore.setup(schema, 0);
        memStore.ingest(ref, 0, records(1, 1));
        Partition p = scan(PartitionScan.of(ScanSplit.ALL)).get(0);
        try {
            p.readValues("host");
            Assert.fail();
        } catch (ColumnReadException e) {
            // expected
        }
        try {
            p.readValues("usage", "usage");
            Assert.fail();
        } catch (ColumnReadException e) {
            // expected
        }
        try {
            p.readValues("no_such_column");
            Assert.fail();
        } catch (ColumnReadException e) {
            // expected
        }
    }

    @Test
    public void testBadRecordLeavesShardUntouched() {
        memStore.setup(schema, 0);
        List<Record> records = records(2, 2);
        records.add(Record.of("not a timestamp", 1.0, 4, "host-9"));
        try {
            memStore.ingest(ref, 0, records);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        Assert.assertEquals(0, memStore.numPartitions(ref, 0));

        try {
            memStore.ingest(ref, 0, Arrays.asList(Record.of(1L, 1.0, 4)));
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            memStore.ingest(ref, 0, Arrays.asList(Record.of(1L, 1.0, 4, null)));
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }

        // Null doubles are stored as NaN.
        memStore.ingest(ref, 0, Arrays.asList(Record.of(1L, null, 4, "host-0")));
        Sample sample = scan(PartitionScan.of(ScanSplit.ALL)).get(0).readValues("usage").next();
        Assert.assertTrue(Double.isNaN(sample.value));
    }

    @Test
    public void testSplitsCoverEveryPartitionOnce() {
        memStore.setup(schema, 0);
        memStore.ingest(ref, 0, records(10, 3));

        List<ScanSplit> splits = memStore.getScanSplits(ref, 4);
        Assert.assertEquals(4, splits.size());
        Set<String> keys = new HashSet<>();
        int total = 0;
        for (ScanSplit split : splits) {
            for (Partition p : scan(PartitionScan.of(split))) {
                keys.add(p.seriesKey());
                total++;
            }
        }
        Assert.assertEquals(10, total);
        Assert.assertEquals(10, keys.size());

        Assert.assertEquals(1, memStore.getScanSplits(ref, 0).size());
    }

    @Test
    public void testFilteredScan() {
        memStore.setup(schema, 0);
        memStore.ingest(ref, 0, records(10, 1));
        List<Partition> partitions = scan(PartitionScan.filtered(ScanSplit.ALL, key -> key.endsWith("3")));
        Assert.assertEquals(1, partitions.size());
        Assert.assertEquals("host-3", partitions.get(0).seriesKey());
    }

    @Test
    public void testSetup() {
        memStore.setup(schema, 0);
        memStore.setup(schema, 0);
        memStore.setup(schema, 1);
        Assert.assertFalse(memStore.scanPartitions(ref, 1, PartitionScan.of(ScanSplit.ALL)).hasNext());

        DatasetSchema other = new DatasetSchema(ref,
                Arrays.asList(
                        new ColumnSchema("timestamp", ColumnType.TIMESTAMP),
                        new ColumnSchema("host", ColumnType.STRING)),
                "host", "timestamp");
        try {
            memStore.setup(other, 0);
            Assert.fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            memStore.scanPartitions(ref, 2, PartitionScan.of(ScanSplit.ALL));
            Assert.fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            memStore.getScanSplits(DatasetRef.of("unknown"), 1);
            Assert.fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
