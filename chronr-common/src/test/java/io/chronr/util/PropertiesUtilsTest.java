package io.chronr.util;

import org.junit.Assert;
import org.junit.Test;

import java.util.Properties;

public class PropertiesUtilsTest {
    @Test
    public void testLoad() throws Exception {
        Properties p = PropertiesUtils.loadRs("test.properties");
        Assert.assertEquals(3, p.size());
        Assert.assertEquals("x", p.getProperty("chronr.other"));
        Assert.assertEquals(4, PropertiesUtils.getInt(p, "chronr.query.worker.threads", 9));
        Assert.assertEquals(2, PropertiesUtils.getInt(p, "chronr.query.dispatch.threads", 9));
        Assert.assertEquals(9, PropertiesUtils.getInt(p, "chronr.query.nothing", 9));
    }

    @Test
    public void testMissingResource() throws Exception {
        Assert.assertTrue(PropertiesUtils.loadRs("no_such_file.properties").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIllegalInt() {
        Properties p = new Properties();
        p.setProperty("k", "1.5");
        PropertiesUtils.getInt(p, "k", 0);
    }

    @Test
    public void testOverrideBySystem() {
        Properties p = new Properties();
        p.setProperty("chronr.test.override", "a");
        p.setProperty("chronr.test.keep", "b");
        System.setProperty("chronr.test.override", "c");
        try {
            Properties merged = PropertiesUtils.overrideBySystem(p, "chronr.test.");
            Assert.assertEquals("c", merged.getProperty("chronr.test.override"));
            Assert.assertEquals("b", merged.getProperty("chronr.test.keep"));
            Assert.assertEquals("a", p.getProperty("chronr.test.override"));
        } finally {
            System.clearProperty("chronr.test.override");
        }
    }
}
