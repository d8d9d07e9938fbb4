package org.janelia.speckle.cmd;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.beust.jcommander.ParametersDelegate;

import org.apache.commons.lang3.StringUtils;

class AbstractCmdArgs {
    @ParametersDelegate
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    Optional<Path> getOutputDirArg() {
        return StringUtils.isNotBlank(commonArgs.outputDir)
                ? Optional.of(Paths.get(commonArgs.outputDir))
                : Optional.empty();
    }

    Path getOutputDir() {
        return getOutputDirArg().orElse(Paths.get("."));
    }

    boolean displayHelpMessage() {
        return commonArgs.displayHelpMessage;
    }

    /**
     * @return validation errors; empty if the arguments are valid
     */
    List<String> validate() {
        return new ArrayList<>();
    }
}
