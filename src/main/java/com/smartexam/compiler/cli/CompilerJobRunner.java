package com.smartexam.compiler.cli;

import com.smartexam.compiler.service.CompilationJobService;
import com.smartexam.compiler.service.CompilationJobService.ExitStatus;
import com.smartexam.compiler.service.CompilationJobService.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * {@code smartexam-compiler <jobDir>}: compiles the job directory given as the
 * only non-option argument. The exit code is 0 when an AST was produced, 1 on a
 * fatal lexical or syntax error, 2 on usage or I/O errors.
 */
@Component
public class CompilerJobRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CompilerJobRunner.class);

    private final CompilationJobService jobService;
    private int exitCode;

    public CompilerJobRunner(CompilationJobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() != 1) {
            log.warn("event=usage message=\"usage: smartexam-compiler <jobDir> [--smartexam.analyzer.*=...]\" args={}", positional);
            exitCode = ExitStatus.USAGE_ERROR.code();
            return;
        }

        JobOutcome outcome = jobService.run(Path.of(positional.get(0)));
        exitCode = outcome.status().code();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
