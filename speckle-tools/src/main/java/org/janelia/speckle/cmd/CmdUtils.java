package org.janelia.speckle.cmd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CmdUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CmdUtils.class);

    static ExecutorService createCmdExecutor(CommonArgs args) {
        int taskConcurrency = getTaskConcurrency(args);
        if (args.taskConcurrency > 0) {
            LOG.info("Create a thread pool with {} worker threads ({} available processors)",
                    taskConcurrency, Runtime.getRuntime().availableProcessors());
            return Executors.newFixedThreadPool(
                    taskConcurrency,
                    new ThreadFactoryBuilder()
                            .setNameFormat("SPECKLE-%d")
                            .setDaemon(true)
                            .build());
        } else {
            LOG.info("Create a workstealing pool with {} worker threads", taskConcurrency);
            return Executors.newWorkStealingPool(taskConcurrency);
        }
    }

    static int getTaskConcurrency(CommonArgs args) {
        if (args.taskConcurrency > 0) {
            return args.taskConcurrency;
        } else {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
    }
}
