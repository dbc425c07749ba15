package com.example.folderaudit;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.folderaudit.cli.CommandLine;
import com.example.folderaudit.cli.CommandLine.CliOptions;
import com.example.folderaudit.cli.CommandLine.Command;
import com.example.folderaudit.cli.CommandLine.UsageException;
import com.example.folderaudit.compare.Comparison.ComparisonPipeline;
import com.example.folderaudit.compare.Comparison.ComparisonReport;
import com.example.folderaudit.config.AppConfig;
import com.example.folderaudit.config.EngineConfig;
import com.example.folderaudit.content.Content;
import com.example.folderaudit.content.Content.StreamingChecksumEngine;
import com.example.folderaudit.duplicates.Duplicates.DuplicateDetectionPipeline;
import com.example.folderaudit.duplicates.Duplicates.DuplicateReport;
import com.example.folderaudit.report.Reports;
import com.example.folderaudit.report.Reports.CsvReportWriter;
import com.example.folderaudit.report.Reports.JsonSummaryWriter;
import com.example.folderaudit.scan.Scanner.ScanException;
import com.example.folderaudit.scan.Scanner.ScanService;

/**
 * Entrada de linha de comando. Interpreta argumentos, monta a configuração
 * imutável do motor e executa a comparação ou a detecção de duplicados.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final AppConfig appConfig;
    private final PrintStream out;
    private final PrintStream err;

    public Main(AppConfig appConfig, PrintStream out, PrintStream err) {
        this.appConfig = Objects.requireNonNull(appConfig, "appConfig");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public static void main(String[] args) {
        int code = new Main(AppConfig.load(), System.out, System.err).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        CliOptions options;
        try {
            options = CommandLine.parse(args);
        } catch (UsageException e) {
            err.println("Erro: " + e.getMessage());
            err.print(CommandLine.usage());
            return EXIT_USAGE;
        }
        if (options.command() == Command.HELP) {
            out.print(CommandLine.usage());
            return EXIT_OK;
        }

        EngineConfig config;
        try {
            EngineConfig base = appConfig.toEngineConfig();
            config = options.workers()
                    .map(w -> base.toBuilder().workerCount(w).build())
                    .orElse(base);
        } catch (IllegalArgumentException e) {
            err.println("Erro de configuração: " + e.getMessage());
            return EXIT_USAGE;
        }
        log.debug("Configuração efetiva: {}", config);

        // Roots inválidos abortam antes de qualquer varredura
        Optional<Path> invalid = options.folders().stream().filter(p -> !Files.isDirectory(p)).findFirst();
        if (invalid.isPresent()) {
            err.println("Erro: " + invalid.get() + " não é um diretório");
            return EXIT_FAILURE;
        }

        try {
            if (options.command() == Command.COMPARE) {
                runComparison(options, config);
            } else {
                runDuplicates(options, config);
            }
            return EXIT_OK;
        } catch (ScanException e) {
            log.error("Varredura abortada: {}", e.getMessage());
            err.println("Erro: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Falha ao gravar resultado", e);
            err.println("Erro ao gravar resultado: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void runComparison(CliOptions options, EngineConfig config) throws IOException {
        ScanService scanService = new ScanService(config);
        ComparisonPipeline pipeline = new ComparisonPipeline(config, scanService,
                Content.comparatorFor(options.mode(), config));

        List<Path> folders = options.folders();
        ComparisonReport report = pipeline.compare(folders.get(0), folders.get(1), options.includeIdentical());

        out.println("Gravando resultado em: " + options.output());
        new CsvReportWriter().writeComparison(report, options.output());
        if (options.summaryJson().isPresent()) {
            new JsonSummaryWriter().write(report, options.summaryJson().get());
        }

        out.println();
        Reports.summaryLines(report.statistics()).forEach(out::println);
    }

    private void runDuplicates(CliOptions options, EngineConfig config) throws IOException {
        ScanService scanService = new ScanService(config);
        DuplicateDetectionPipeline pipeline = new DuplicateDetectionPipeline(config, scanService,
                new StreamingChecksumEngine(config));

        DuplicateReport report = pipeline.find(options.folders().get(0), options.minSize());
        if (report.groups().isEmpty()) {
            out.println("Nenhum arquivo duplicado encontrado.");
        }

        out.println("Gravando resultado em: " + options.output());
        new CsvReportWriter().writeDuplicates(report, options.output(), options.absolutePaths());
        if (options.summaryJson().isPresent()) {
            new JsonSummaryWriter().write(report, options.summaryJson().get(), options.absolutePaths());
        }

        out.println();
        Reports.summaryLines(report.statistics()).forEach(out::println);
    }
}
