package com.smartexam.compiler.service;

import com.smartexam.compiler.parser.ParserDtos.ParseResult;
import com.smartexam.compiler.parser.QuestionPaperParser;
import com.smartexam.compiler.report.ReportAssembler;
import com.smartexam.compiler.report.ReportModels.CompilationReport;
import com.smartexam.compiler.validation.SemanticAnalyzer;
import com.smartexam.compiler.validation.ValidationModels.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One compilation: parse, analyze when an AST was produced, assemble the report.
 * Holds no state between calls, so concurrent compilations are independent.
 */
@Service
public class PaperCompilationService {
    private static final Logger log = LoggerFactory.getLogger(PaperCompilationService.class);

    private final QuestionPaperParser parser;
    private final SemanticAnalyzer analyzer;
    private final ReportAssembler assembler;

    public PaperCompilationService(QuestionPaperParser parser, SemanticAnalyzer analyzer, ReportAssembler assembler) {
        this.parser = parser;
        this.analyzer = analyzer;
        this.assembler = assembler;
    }

    public CompilationReport compile(String source) {
        ParseResult parse = parser.parse(source);
        if (!parse.succeeded()) {
            log.info("event=compile_failed tokens={} diagnostics={}", parse.tokens().size(), parse.diagnostics().size());
            return assembler.assembleFailure(parse);
        }

        AnalysisResult analysis = analyzer.analyze(parse.paper());
        CompilationReport report = assembler.assemble(parse, analysis);
        log.info("event=compile_complete questions={} issues={} score={}",
                parse.paper().questions().size(), report.issues().size(), report.qualityScore());
        return report;
    }
}
