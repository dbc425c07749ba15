package com.example.folderaudit.report;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.folderaudit.compare.Comparison.ComparisonOutcome;
import com.example.folderaudit.compare.Comparison.ComparisonReport;
import com.example.folderaudit.compare.Comparison.ComparisonStatistics;
import com.example.folderaudit.compare.Comparison.Tristate;
import com.example.folderaudit.duplicates.Duplicates.DuplicateGroup;
import com.example.folderaudit.duplicates.Duplicates.DuplicateReport;
import com.example.folderaudit.duplicates.Duplicates.DuplicateStatistics;
import com.example.folderaudit.scan.Scanner;
import com.example.folderaudit.scan.Scanner.ScanStatistics;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Fronteira de formatação: converte os resultados internos nos esquemas externos
 * (CSV de comparação, CSV de duplicados, resumo JSON e resumo de console).
 * Nenhum cálculo novo acontece aqui.
 */
public final class Reports {

    private Reports() {}

    public static final List<String> COMPARISON_HEADER = List.of(
            "file_name", "exist_in_folder_1", "exist_in_folder_2", "size_same", "content_same");

    public static final List<String> DUPLICATE_HEADER = List.of(
            "checksum", "size", "count", "paths");

    /** Separador dos caminhos na coluna "paths". */
    public static final String PATH_SEPARATOR = "|";

    // ==================================================================================
    // Mapeamento de linhas
    // ==================================================================================

    /** "True"/"False"; UNKNOWN vira string vazia, nunca "False". */
    public static String csvValue(Tristate value) {
        switch (Objects.requireNonNull(value, "value")) {
            case TRUE:
                return "True";
            case FALSE:
                return "False";
            default:
                return "";
        }
    }

    public static String csvValue(boolean value) {
        return value ? "True" : "False";
    }

    public static List<String> comparisonRow(ComparisonOutcome outcome) {
        return List.of(
                outcome.relativePath(),
                csvValue(outcome.existsInA()),
                csvValue(outcome.existsInB()),
                csvValue(outcome.sizeSame()),
                csvValue(outcome.contentSame()));
    }

    /**
     * Caminhos do grupo em ordem de code point.
     *
     * @param absolutePaths se true, usa caminhos absolutos; senão, relativos ao root (com '/')
     */
    public static List<String> groupPaths(DuplicateGroup group, boolean absolutePaths) {
        return group.files().stream()
                .map(f -> absolutePaths ? f.absolutePath().toString() : f.relativePath())
                .sorted(Scanner.PATH_ORDER)
                .collect(Collectors.toList());
    }

    public static List<String> duplicateRow(DuplicateGroup group, boolean absolutePaths) {
        String paths = String.join(PATH_SEPARATOR, groupPaths(group, absolutePaths));
        return List.of(
                group.checksum(),
                Long.toString(group.size()),
                Integer.toString(group.count()),
                paths);
    }

    // ==================================================================================
    // CSV
    // ==================================================================================

    /**
     * Escritor CSV mínimo: UTF-8, cabeçalho obrigatório, terminador "\r\n" e aspas apenas
     * quando o campo contém vírgula, aspas, CR ou LF.
     */
    public static final class CsvReportWriter {

        private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);
        private static final String LINE_END = "\r\n";

        public void writeComparison(ComparisonReport report, Path output) throws IOException {
            Objects.requireNonNull(report, "report");
            List<List<String>> rows = new ArrayList<>(report.outcomes().size());
            for (ComparisonOutcome outcome : report.outcomes()) {
                rows.add(comparisonRow(outcome));
            }
            write(output, COMPARISON_HEADER, rows);
            log.info("Resultado escrito em {} ({} linhas)", output, rows.size());
        }

        public void writeDuplicates(DuplicateReport report, Path output, boolean absolutePaths) throws IOException {
            Objects.requireNonNull(report, "report");
            List<List<String>> rows = new ArrayList<>(report.groups().size());
            for (DuplicateGroup group : report.groups()) {
                rows.add(duplicateRow(group, absolutePaths));
            }
            write(output, DUPLICATE_HEADER, rows);
            log.info("Resultado escrito em {} ({} grupos)", output, rows.size());
        }

        void write(Path output, List<String> header, List<List<String>> rows) throws IOException {
            Objects.requireNonNull(output, "output");
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
                writeRow(out, header);
                for (List<String> row : rows) {
                    writeRow(out, row);
                }
            }
        }

        private static void writeRow(Writer out, List<String> fields) throws IOException {
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) {
                    out.write(',');
                }
                out.write(escape(fields.get(i)));
            }
            out.write(LINE_END);
        }

        static String escape(String field) {
            if (field == null || field.isEmpty()) {
                return "";
            }
            boolean needsQuotes = field.indexOf(',') >= 0
                    || field.indexOf('"') >= 0
                    || field.indexOf('\n') >= 0
                    || field.indexOf('\r') >= 0;
            if (!needsQuotes) {
                return field;
            }
            return '"' + field.replace("\"", "\"\"") + '"';
        }
    }

    // ==================================================================================
    // Tamanho legível
    // ==================================================================================

    /** Base 1024; bytes sem casas decimais, demais unidades com uma. */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"KB", "MB", "GB", "TB"};
        double size = bytes / 1024.0;
        for (String unit : units) {
            if (size < 1024) {
                return String.format(Locale.ROOT, "%.1f %s", size, unit);
            }
            size /= 1024;
        }
        return String.format(Locale.ROOT, "%.1f PB", size);
    }

    // ==================================================================================
    // Resumo de console
    // ==================================================================================

    public static List<String> summaryLines(ComparisonStatistics stats) {
        List<String> lines = new ArrayList<>();
        lines.add("Resumo:");
        lines.add("  Somente na pasta 1: " + stats.onlyInA());
        lines.add("  Somente na pasta 2: " + stats.onlyInB());
        lines.add("  Nas duas pastas: " + stats.inBoth());
        lines.add("    - Mesmo conteúdo: " + stats.sameContent());
        lines.add("    - Conteúdo diferente: " + stats.differentContent());
        lines.add("    - Tamanho diferente: " + stats.sizeMismatch());
        if (stats.readErrors() > 0) {
            lines.add("    - Erros de leitura: " + stats.readErrors());
        }
        addScanLines(lines, stats.excludedByFilter(), stats.nonRegularSkipped(), stats.scanFailures());
        return lines;
    }

    public static List<String> summaryLines(DuplicateStatistics stats) {
        List<String> lines = new ArrayList<>();
        lines.add("Resumo:");
        lines.add("  Arquivos varridos:      " + stats.filesScanned());
        if (stats.minSize() > 0) {
            lines.add("  Arquivos >= " + stats.minSize() + " bytes: " + stats.filesConsidered());
        }
        lines.add("  Tamanho único (pulados): " + stats.uniqueBySize());
        lines.add("  Checksums calculados:   " + stats.checksummed());
        if (stats.readErrors() > 0) {
            lines.add("  Erros de leitura:       " + stats.readErrors());
        }
        lines.add("  Grupos duplicados:      " + stats.groups());
        lines.add("  Arquivos em duplicados: " + stats.filesInGroups());
        lines.add("  Espaço desperdiçado:    " + formatSize(stats.wastedBytes()));
        ScanStatistics scan = stats.scan();
        addScanLines(lines, scan.filesExcludedByFilter(), scan.nonRegularSkipped(), scan.entriesFailed());
        return lines;
    }

    /** Linhas da varredura; só aparecem quando há algo a contar. */
    private static void addScanLines(List<String> lines, long excluded, long nonRegular, long failures) {
        if (excluded > 0) {
            lines.add("  Excluídos pelo filtro:  " + excluded);
        }
        if (nonRegular > 0) {
            lines.add("  Links/especiais ignorados: " + nonRegular);
        }
        if (failures > 0) {
            lines.add("  Falhas na varredura:    " + failures);
        }
    }

    // ==================================================================================
    // Resumo JSON (Jackson)
    // ==================================================================================

    /**
     * Escreve as estatísticas da execução em JSON (snake_case), ao lado do CSV.
     */
    public static final class JsonSummaryWriter {

        private static final Logger log = LoggerFactory.getLogger(JsonSummaryWriter.class);

        private final ObjectMapper mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);

        public void write(ComparisonReport report, Path output) throws IOException {
            writeValue(ComparisonSummaryDto.from(report), output);
        }

        /** @param absolutePaths mesma escolha usada no CSV de duplicados */
        public void write(DuplicateReport report, Path output, boolean absolutePaths) throws IOException {
            writeValue(DuplicateSummaryDto.from(report, absolutePaths), output);
        }

        /** Serialização sem arquivo (testes, log). */
        public String toJson(ComparisonReport report) throws IOException {
            return mapper.writeValueAsString(ComparisonSummaryDto.from(report));
        }

        public String toJson(DuplicateReport report, boolean absolutePaths) throws IOException {
            return mapper.writeValueAsString(DuplicateSummaryDto.from(report, absolutePaths));
        }

        private void writeValue(Object dto, Path output) throws IOException {
            Objects.requireNonNull(output, "output");
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(output.toFile(), dto);
            log.info("Resumo JSON escrito em {}", output);
        }
    }

    // ==================================================================================
    // DTOs do resumo JSON
    // ==================================================================================

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class ComparisonSummaryDto {
        @JsonProperty("created_at") public String createdAt;
        @JsonProperty("folder_1") public String folder1;
        @JsonProperty("folder_2") public String folder2;
        @JsonProperty("mode") public String mode;
        @JsonProperty("files_in_folder_1") public long filesInFolder1;
        @JsonProperty("files_in_folder_2") public long filesInFolder2;
        @JsonProperty("only_in_folder_1") public int onlyInFolder1;
        @JsonProperty("only_in_folder_2") public int onlyInFolder2;
        @JsonProperty("in_both") public int inBoth;
        @JsonProperty("same_content") public int sameContent;
        @JsonProperty("different_content") public int differentContent;
        @JsonProperty("size_mismatch") public int sizeMismatch;
        @JsonProperty("read_errors") public int readErrors;
        @JsonProperty("reported_rows") public int reportedRows;
        @JsonProperty("directories_scanned") public long directoriesScanned;
        @JsonProperty("excluded_by_filter") public long excludedByFilter;
        @JsonProperty("non_regular_skipped") public long nonRegularSkipped;
        @JsonProperty("scan_failures") public long scanFailures;

        static ComparisonSummaryDto from(ComparisonReport report) {
            ComparisonStatistics s = report.statistics();
            ComparisonSummaryDto dto = new ComparisonSummaryDto();
            dto.createdAt = Instant.now().toString();
            dto.folder1 = report.rootA().toString();
            dto.folder2 = report.rootB().toString();
            dto.mode = s.mode().name().toLowerCase(Locale.ROOT);
            dto.filesInFolder1 = s.filesInA();
            dto.filesInFolder2 = s.filesInB();
            dto.onlyInFolder1 = s.onlyInA();
            dto.onlyInFolder2 = s.onlyInB();
            dto.inBoth = s.inBoth();
            dto.sameContent = s.sameContent();
            dto.differentContent = s.differentContent();
            dto.sizeMismatch = s.sizeMismatch();
            dto.readErrors = s.readErrors();
            dto.reportedRows = s.reportedRows();
            dto.directoriesScanned = s.directoriesVisited();
            dto.excludedByFilter = s.excludedByFilter();
            dto.nonRegularSkipped = s.nonRegularSkipped();
            dto.scanFailures = s.scanFailures();
            return dto;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class DuplicateSummaryDto {
        @JsonProperty("created_at") public String createdAt;
        @JsonProperty("folder") public String folder;
        @JsonProperty("algorithm") public String algorithm;
        @JsonProperty("min_size") public long minSize;
        @JsonProperty("files_scanned") public long filesScanned;
        @JsonProperty("directories_scanned") public long directoriesScanned;
        @JsonProperty("excluded_by_filter") public long excludedByFilter;
        @JsonProperty("non_regular_skipped") public long nonRegularSkipped;
        @JsonProperty("scan_failures") public long scanFailures;
        @JsonProperty("files_considered") public int filesConsidered;
        @JsonProperty("unique_by_size") public int uniqueBySize;
        @JsonProperty("checksummed") public int checksummed;
        @JsonProperty("read_errors") public int readErrors;
        @JsonProperty("duplicate_groups") public int duplicateGroups;
        @JsonProperty("files_in_duplicates") public int filesInDuplicates;
        @JsonProperty("wasted_bytes") public long wastedBytes;
        @JsonProperty("wasted_human") public String wastedHuman;
        @JsonProperty("largest_groups") public List<GroupDto> largestGroups;

        static final int LARGEST_GROUPS = 10;

        static DuplicateSummaryDto from(DuplicateReport report, boolean absolutePaths) {
            DuplicateStatistics s = report.statistics();
            DuplicateSummaryDto dto = new DuplicateSummaryDto();
            dto.createdAt = Instant.now().toString();
            dto.folder = report.root().toString();
            dto.algorithm = s.algorithm();
            dto.minSize = s.minSize();
            dto.filesScanned = s.filesScanned();
            dto.directoriesScanned = s.scan().directoriesVisited();
            dto.excludedByFilter = s.scan().filesExcludedByFilter();
            dto.nonRegularSkipped = s.scan().nonRegularSkipped();
            dto.scanFailures = s.scan().entriesFailed();
            dto.filesConsidered = s.filesConsidered();
            dto.uniqueBySize = s.uniqueBySize();
            dto.checksummed = s.checksummed();
            dto.readErrors = s.readErrors();
            dto.duplicateGroups = s.groups();
            dto.filesInDuplicates = s.filesInGroups();
            dto.wastedBytes = s.wastedBytes();
            dto.wastedHuman = formatSize(s.wastedBytes());
            dto.largestGroups = report.groups().stream()
                    .limit(LARGEST_GROUPS)
                    .map(g -> new GroupDto(g, absolutePaths))
                    .collect(Collectors.toList());
            return dto;
        }

        static final class GroupDto {
            public String checksum;
            public long size;
            public int count;
            public List<String> paths;

            GroupDto(DuplicateGroup group, boolean absolutePaths) {
                this.checksum = group.checksum();
                this.size = group.size();
                this.count = group.count();
                this.paths = groupPaths(group, absolutePaths);
            }
        }
    }
}
