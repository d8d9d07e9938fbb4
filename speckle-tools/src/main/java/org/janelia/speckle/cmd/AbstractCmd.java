package org.janelia.speckle.cmd;

import org.apache.commons.lang3.StringUtils;
import org.janelia.speckle.config.Config;
import org.janelia.speckle.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractCmd {
    static final long _1M = 1024 * 1024;

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCmd.class);
    private final static int LOW_MEMORY_PERC_THRESHOLD = 20;

    private final String commandName;
    private Config config;
    final long maxMemory;

    AbstractCmd(String commandName) {
        this.commandName = commandName;
        this.config = null;
        maxMemory = Runtime.getRuntime().maxMemory();
    }

    public String getCommandName() {
        return commandName;
    }

    abstract AbstractCmdArgs getArgs();

    boolean matches(String commandName) {
        return StringUtils.isNotBlank(commandName) && StringUtils.equals(this.commandName, commandName);
    }

    abstract void execute();

    Config getConfig() {
        if (config == null) {
            config = ConfigProvider.getInstance()
                    .fromDefaultResources()
                    .fromFile(getArgs().getConfigFileName())
                    .get();
        }
        return config;
    }

    long usedMemoryInMB() {
        return (maxMemory - Runtime.getRuntime().freeMemory()) / _1M + 1; // round up
    }

    synchronized void checkMemoryUsage() {
        long freeMemory = Runtime.getRuntime().freeMemory();
        int lowMemoryPercTh = getConfig().getIntegerPropertyValue("Memory.LowPercThreshold", LOW_MEMORY_PERC_THRESHOLD);
        long threshold = (maxMemory / 100) * lowMemoryPercTh;
        if (freeMemory < threshold) {
            LOG.warn("Free memory is below the {}% mark : {} bytes, max memory: {} bytes",
                    lowMemoryPercTh, freeMemory, maxMemory);
            System.gc();
        }
    }
}
