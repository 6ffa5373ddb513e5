package com.sfgen.generator.codegen.output;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sfgen.generator.codegen.util.FileWriteUtil;

import lombok.RequiredArgsConstructor;

/**
 * Writes rendered files to disk, or prints them on a dry run.
 */
@RequiredArgsConstructor
public class ArtifactWriter {
    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private final boolean dryRun;
    private final PrintStream dryRunOutput;

    public void write(Path target, String content) throws IOException {
        if (dryRun) {
            log.debug("Dry run: printing {} instead of writing it", target);
            dryRunOutput.print(content);
            dryRunOutput.flush();
            return;
        }
        FileWriteUtil.safeWriteString(target, content);
        log.info("Wrote {}", target);
    }
}
