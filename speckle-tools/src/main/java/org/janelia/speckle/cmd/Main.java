package org.janelia.speckle.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private static class MainArgs {
        @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
        boolean displayHelpMessage = false;
    }

    public static void main(String[] argv) {
        int status = run(argv);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] argv) {
        MainArgs mainArgs = new MainArgs();
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new CorrectOverExposureCmd("correct", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .programName("speckle-tools")
                .addObject(mainArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            StringBuilder sb = new StringBuilder(e.getMessage()).append('\n');
            if (e.getJCommander() != null) {
                e.getJCommander().getUsageFormatter().usage(sb);
            } else {
                cmdline.getUsageFormatter().usage(sb);
            }
            System.err.println(sb);
            return 1;
        }

        String commandName = cmdline.getParsedCommand();
        if (mainArgs.displayHelpMessage || StringUtils.isBlank(commandName)) {
            StringBuilder sb = new StringBuilder();
            cmdline.getUsageFormatter().usage(sb);
            System.out.println(sb);
            return mainArgs.displayHelpMessage ? 0 : 1;
        }
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(commandName))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No command found for " + commandName));
        if (cmd.getArgs().displayHelpMessage()) {
            StringBuilder sb = new StringBuilder();
            cmdline.getUsageFormatter().usage(commandName, sb);
            System.out.println(sb);
            return 0;
        }
        List<String> validationErrors = cmd.getArgs().validate();
        if (!validationErrors.isEmpty()) {
            StringBuilder sb = new StringBuilder(String.join("\n", validationErrors)).append('\n');
            cmdline.getUsageFormatter().usage(commandName, sb);
            System.err.println(sb);
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration for {}: {}", commandName, e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            LOG.error("Command {} failed", commandName, e);
            return 1;
        }
    }
}
