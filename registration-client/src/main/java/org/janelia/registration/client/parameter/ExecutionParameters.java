package org.janelia.registration.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.File;

import org.janelia.registration.util.LogbackTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parameters for controlling how stages are executed.
 *
 * @author Eric Trautman
 */
public class ExecutionParameters {

    @Parameter(
            names = "--maxWorkers",
            description = "Maximum number of tile units processed concurrently")
    public int maxWorkers = 1;

    @Parameter(
            names = "--affineEstimatorClass",
            description = "Fully qualified name of the AffineEstimator implementation (default is identity)")
    public String affineEstimatorClass;

    @Parameter(
            names = "--deformableEstimatorClass",
            description = "Fully qualified name of the DeformableEstimator implementation (default is zero displacement)")
    public String deformableEstimatorClass;

    @Parameter(
            names = "--logDirectory",
            description = "Write a timestamped log file for this run to this directory")
    public String logDirectory;

    /**
     * Attaches a log file appender when a log directory has been specified.
     */
    public void setupLogFile(final String logFileNamePrefix) {
        if (logDirectory != null) {
            final File logFile = LogbackTools.setRootFileAppenderWithTimestamp(new File(logDirectory),
                                                                               logFileNamePrefix);
            LOG.info("setupLogFile: logging to {}", logFile);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExecutionParameters.class);
}
