package org.assemblerflow.qc.utils.config;

import org.assemblerflow.qc.QCBaseTest;
import org.assemblerflow.qc.exceptions.UserException;
import org.assemblerflow.qc.utils.io.IOUtils;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashMap;

public final class ConfigFactoryUnitTest extends QCBaseTest {

    @Test
    public void testPackagedDefaults() {
        final QCConfig config = ConfigFactory.getInstance().getQCConfig();
        Assert.assertEquals(config.sliding_window_size(), 2000);
        Assert.assertEquals(config.filter_gc_bound(), 0.05);
        Assert.assertEquals(config.coverage_auto_factor(), 0.3);
        Assert.assertEquals(config.coverage_auto_floor(), 10.0);
        Assert.assertEquals(config.health_max_contigs_per_1_5mb(), 100);
        Assert.assertEquals(config.health_min_length_fraction(), 0.8);
        Assert.assertEquals(config.health_max_length_fraction(), 1.5);
        Assert.assertEquals(config.status_file_name(), ".status");
    }

    @Test
    public void testGetOrCreateIsCached() {
        Assert.assertSame(ConfigFactory.getInstance().getQCConfig(), ConfigFactory.getInstance().getQCConfig());
    }

    @Test
    public void testUserFileOverridesDefaults() {
        final File userConfig = createTempFile("userQCConfig", ".properties");
        IOUtils.writeLines(userConfig.toPath(), Arrays.asList("sliding_window.size = 500", "status.file_name = status.txt"));

        org.aeonbits.owner.ConfigFactory.setProperty(QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME, userConfig.getAbsolutePath());
        try {
            final QCConfig config = ConfigFactory.getInstance().createQCConfig();
            Assert.assertEquals(config.sliding_window_size(), 500);
            Assert.assertEquals(config.status_file_name(), "status.txt");
            // untouched keys keep their packaged values
            Assert.assertEquals(config.filter_gc_bound(), 0.05);
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_USER_CONFIG_FILE);
        }
    }

    @DataProvider(name = "configArgs")
    public Object[][] configArgs() {
        return new Object[][]{
                {new String[]{"ProcessSpades", "--qc-config-file", "my.properties", "-S", "x"}, "my.properties"},
                {new String[]{"ProcessSpades", "-S", "x"}, null},
                {new String[]{}, null},
        };
    }

    @Test(dataProvider = "configArgs")
    public void testGetConfigFilenameFromArgs(final String[] args, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, "--qc-config-file"), expected);
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testConfigOptionWithoutFile() {
        ConfigFactory.getConfigFilenameFromArgs(new String[]{"ProcessSpades", "--qc-config-file", "-S", "x"}, "--qc-config-file");
    }

    @Test
    public void testMissingUserFileFallsBackToDefaults() {
        org.aeonbits.owner.ConfigFactory.setProperty(QCConfig.CONFIG_FILE_VARIABLE_FILE_NAME, ConfigFactory.NO_USER_CONFIG_FILE);
        final QCConfig config = ConfigFactory.getInstance().createQCConfig();
        Assert.assertEquals(config.sliding_window_size(), 2000);
        Assert.assertEquals(config.status_file_name(), ".status");
    }

    @Test
    public void testGetConfigMap() {
        final LinkedHashMap<String, Object> map = ConfigFactory.getConfigMap(ConfigFactory.getInstance().getQCConfig());
        Assert.assertEquals(map.get("sliding_window.size"), 2000);
        Assert.assertEquals(map.get("status.file_name"), ".status");
    }
}
