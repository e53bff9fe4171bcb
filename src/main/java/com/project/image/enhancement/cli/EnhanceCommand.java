package com.project.image.enhancement.cli;

import com.project.image.enhancement.DTOs.EnhancementResult;
import com.project.image.enhancement.DTOs.PipelineConfig;
import com.project.image.enhancement.exceptions.DetectorLoadException;
import com.project.image.enhancement.exceptions.ImageReadException;
import com.project.image.enhancement.exceptions.ImageWriteException;
import com.project.image.enhancement.service.EnhancementPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * One-shot run from the command line. Does nothing unless enhancement flags were passed.
 */
@Component
public class EnhanceCommand implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(EnhanceCommand.class);

    private final EnhancementPipeline pipeline;
    private ExitStatus status = ExitStatus.SUCCESS;

    public EnhanceCommand(EnhancementPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public void run(ApplicationArguments args) {
        String[] raw = args.getSourceArgs();
        if (EnhanceArguments.isCommandLineInvocation(raw)) {
            status = execute(raw);
        }
    }

    public ExitStatus execute(String[] rawArgs) {
        EnhanceArguments arguments;
        PipelineConfig config;
        try {
            arguments = EnhanceArguments.parse(rawArgs);
            if (arguments.helpRequested()) {
                System.out.println(EnhanceArguments.USAGE);
                return ExitStatus.USAGE;
            }
            config = arguments.toPipelineConfig();
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            System.out.println(EnhanceArguments.USAGE);
            return ExitStatus.USAGE;
        }

        try {
            EnhancementResult result = pipeline.enhanceFile(arguments.input(), arguments.output(), arguments.cascade(), config);
            if (!result.faceFound()) {
                log.info("No face detected. Saved original to {}", arguments.output());
            } else {
                log.info("Enhanced image saved to {}", arguments.output());
            }
            return ExitStatus.SUCCESS;
        } catch (ImageReadException e) {
            log.error(e.getMessage());
            return ExitStatus.INPUT_UNREADABLE;
        } catch (DetectorLoadException e) {
            log.error(e.getMessage());
            return ExitStatus.DETECTOR_UNAVAILABLE;
        } catch (ImageWriteException e) {
            log.error(e.getMessage(), e.getCause());
            return ExitStatus.OUTPUT_UNWRITABLE;
        }
    }

    @Override
    public int getExitCode() {
        return status.code();
    }
}
