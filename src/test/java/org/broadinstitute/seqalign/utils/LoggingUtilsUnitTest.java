package org.broadinstitute.seqalign.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.broadinstitute.seqalign.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class LoggingUtilsUnitTest extends BaseTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][] {
                {Log.LogLevel.ERROR, Level.ERROR},
                {Log.LogLevel.WARNING, Level.WARN},
                {Log.LogLevel.INFO, Level.INFO},
                {Log.LogLevel.DEBUG, Level.DEBUG},
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelConversion(final Log.LogLevel htsjdkLevel, final Level log4jLevel) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(htsjdkLevel), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), htsjdkLevel);
    }

    @Test
    public void testSetLoggingLevel() {
        try {
            LoggingUtils.setLoggingLevel(Log.LogLevel.DEBUG);
            final LoggerContext context = (LoggerContext) LogManager.getContext(false);
            Assert.assertEquals(context.getConfiguration().getLoggerConfig(LoggingUtils.class.getName()).getLevel(), Level.DEBUG);
            Assert.assertTrue(Log.isEnabled(Log.LogLevel.DEBUG));
        } finally {
            LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
        }
    }
}
