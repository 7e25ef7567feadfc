package com.smartexam.compiler.service;

import com.smartexam.compiler.report.ReportModels.CompilationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Compiles {@code <jobDir>/input.qp} and leaves the artifacts next to it.
 */
@Service
public class CompilationJobService {
    private static final Logger log = LoggerFactory.getLogger(CompilationJobService.class);

    private final PaperCompilationService compilationService;
    private final JobArtifactWriter artifactWriter;
    private final JobProperties files;

    public CompilationJobService(PaperCompilationService compilationService, JobArtifactWriter artifactWriter, JobProperties files) {
        this.compilationService = compilationService;
        this.artifactWriter = artifactWriter;
        this.files = files;
    }

    public JobOutcome run(Path jobDir) {
        if (!Files.isDirectory(jobDir)) {
            log.error("event=job_rejected dir={} reason=\"not a directory\"", jobDir);
            return new JobOutcome(ExitStatus.USAGE_ERROR, null);
        }

        try {
            String source = Files.readString(jobDir.resolve(files.inputFile()), StandardCharsets.UTF_8);
            CompilationReport report = compilationService.compile(source);
            artifactWriter.write(jobDir, report);

            ExitStatus status = report.astProduced() ? ExitStatus.SUCCESS : ExitStatus.COMPILATION_FAILED;
            log.info("event=job_complete dir={} status={} issues={}", jobDir, status, report.issues().size());
            return new JobOutcome(status, report);
        } catch (IOException e) {
            log.error("event=job_io_failed dir={} reason=\"{}\"", jobDir, e.getMessage());
            return new JobOutcome(ExitStatus.IO_ERROR, null);
        } catch (UncheckedIOException e) {
            log.error("event=job_io_failed dir={} reason=\"{}\"", jobDir, e.getMessage(), e.getCause());
            return new JobOutcome(ExitStatus.IO_ERROR, null);
        }
    }

    public enum ExitStatus {
        SUCCESS(0),
        COMPILATION_FAILED(1),
        USAGE_ERROR(2),
        IO_ERROR(2);

        private final int code;

        ExitStatus(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    /** {@code report} is null when the job never got to compile. */
    public record JobOutcome(ExitStatus status, CompilationReport report) {}
}
