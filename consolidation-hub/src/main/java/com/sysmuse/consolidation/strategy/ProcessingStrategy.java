package com.sysmuse.consolidation.strategy;

import com.sysmuse.consolidation.ProcessingResult;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.FileHandler;

import java.nio.file.Path;
import java.util.List;

/**
 * One way of running a consolidation from input files to output.
 */
public interface ProcessingStrategy {

    /**
     * Short identifier, e.g. "streaming".
     */
    String getName();

    /**
     * @param files         input files, in processing order
     * @param outputHandler handler for the output file, null for console output
     */
    ProcessingResult process(ProcessingConfig config, List<Path> files, FileHandler outputHandler);
}
