package com.aceflow.research.dto;

import java.nio.file.Path;

/**
 * Result of one invocation: the bundle, where it was written, and the process exit status
 * (0 complete, 1 incomplete-but-written, 2 fatal).
 */
public record ResearchOutcome(ResearchBundle bundle, Path outputPath, int exitCode) {

    public static final int EXIT_COMPLETE = 0;
    public static final int EXIT_INCOMPLETE = 1;
    public static final int EXIT_FATAL = 2;

    public static ResearchOutcome written(ResearchBundle bundle, Path outputPath) {
        return new ResearchOutcome(bundle, outputPath, bundle.status().getExitCode());
    }
}
