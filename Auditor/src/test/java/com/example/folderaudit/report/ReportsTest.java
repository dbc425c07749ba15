package com.example.folderaudit.report;

import com.example.folderaudit.compare.Comparison.ComparisonOutcome;
import com.example.folderaudit.compare.Comparison.ComparisonReport;
import com.example.folderaudit.compare.Comparison.ComparisonStatistics;
import com.example.folderaudit.compare.Comparison.PathPartition;
import com.example.folderaudit.compare.Comparison.Tristate;
import com.example.folderaudit.content.Content.ComparisonMode;
import com.example.folderaudit.duplicates.Duplicates.DuplicateGroup;
import com.example.folderaudit.duplicates.Duplicates.DuplicateReport;
import com.example.folderaudit.duplicates.Duplicates.DuplicateStatistics;
import com.example.folderaudit.report.Reports.CsvReportWriter;
import com.example.folderaudit.report.Reports.JsonSummaryWriter;
import com.example.folderaudit.scan.Scanner.FileRecord;
import com.example.folderaudit.scan.Scanner.ScanStatistics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Reports Tests")
class ReportsTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Field encoding")
    class FieldEncodingTests {

        @Test
        @DisplayName("Unknown should be written as an empty field, never as False")
        void shouldEncodeTristate() {
            assertThat(Reports.csvValue(Tristate.TRUE)).isEqualTo("True");
            assertThat(Reports.csvValue(Tristate.FALSE)).isEqualTo("False");
            assertThat(Reports.csvValue(Tristate.UNKNOWN)).isEmpty();
        }

        @Test
        @DisplayName("Should quote only fields with separators, quotes or line breaks")
        void shouldEscapeMinimally() {
            assertThat(CsvReportWriter.escape("plain/path.txt")).isEqualTo("plain/path.txt");
            assertThat(CsvReportWriter.escape("a,b.txt")).isEqualTo("\"a,b.txt\"");
            assertThat(CsvReportWriter.escape("say \"hi\".txt")).isEqualTo("\"say \"\"hi\"\".txt\"");
            assertThat(CsvReportWriter.escape("line\nbreak")).isEqualTo("\"line\nbreak\"");
            assertThat(CsvReportWriter.escape("")).isEmpty();
        }

        @Test
        @DisplayName("Should format sizes with binary units")
        void shouldFormatSizes() {
            assertThat(Reports.formatSize(0)).isEqualTo("0 B");
            assertThat(Reports.formatSize(1023)).isEqualTo("1023 B");
            assertThat(Reports.formatSize(1024)).isEqualTo("1.0 KB");
            assertThat(Reports.formatSize(1536L * 1024)).isEqualTo("1.5 MB");
            assertThat(Reports.formatSize(3L * 1024 * 1024 * 1024)).isEqualTo("3.0 GB");
        }
    }

    @Nested
    @DisplayName("CsvReportWriter")
    class CsvWriterTests {

        @Test
        @DisplayName("Comparison CSV should have the fixed header and CRLF line endings")
        void shouldWriteComparisonCsv() throws IOException {
            ComparisonReport report = comparisonReport(List.of(
                    ComparisonOutcome.inBoth("diff.txt", Tristate.TRUE, Tristate.FALSE),
                    ComparisonOutcome.onlyInA("only,a.txt")));
            Path output = tempDir.resolve("out/comparison_results.csv");

            new CsvReportWriter().writeComparison(report, output);

            String content = Files.readString(output, StandardCharsets.UTF_8);
            assertThat(content).isEqualTo(
                    "file_name,exist_in_folder_1,exist_in_folder_2,size_same,content_same\r\n"
                            + "diff.txt,True,True,True,False\r\n"
                            + "\"only,a.txt\",True,False,,\r\n");
        }

        @Test
        @DisplayName("An empty comparison should still write the header")
        void shouldWriteHeaderOnly() throws IOException {
            Path output = tempDir.resolve("empty.csv");

            new CsvReportWriter().writeComparison(comparisonReport(List.of()), output);

            assertThat(Files.readString(output))
                    .isEqualTo("file_name,exist_in_folder_1,exist_in_folder_2,size_same,content_same\r\n");
        }

        @Test
        @DisplayName("Duplicate CSV should join sorted paths with '|'")
        void shouldWriteDuplicatesCsv() throws IOException {
            Path output = tempDir.resolve("duplicates.csv");

            new CsvReportWriter().writeDuplicates(duplicateReport(), output, false);

            List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
            assertThat(lines).containsExactly(
                    "checksum,size,count,paths",
                    "abc123,4,2,p1|p2");
        }

        @Test
        @DisplayName("Group paths should be ordered by code point, not by UTF-16 unit")
        void shouldOrderPathsByCodePoint() {
            DuplicateGroup group = new DuplicateGroup("d", 1, List.of(
                    new FileRecord("\uD83D\uDE00.txt", tempDir.resolve("emoji.txt"), 1),
                    new FileRecord("\uFF5E.txt", tempDir.resolve("tilde.txt"), 1)));

            assertThat(Reports.groupPaths(group, false)).containsExactly("\uFF5E.txt", "\uD83D\uDE00.txt");
            assertThat(Reports.duplicateRow(group, false).get(3)).isEqualTo("\uFF5E.txt|\uD83D\uDE00.txt");
        }

        @Test
        @DisplayName("Absolute path mode should write full paths")
        void shouldWriteAbsolutePaths() {
            List<String> row = Reports.duplicateRow(duplicateReport().groups().get(0), true);

            assertThat(row.get(3)).isEqualTo(tempDir.resolve("p1") + "|" + tempDir.resolve("p2"));
        }
    }

    @Nested
    @DisplayName("Summaries")
    class SummaryTests {

        @Test
        @DisplayName("Duplicate summary should include the wasted space line")
        void shouldSummarizeDuplicates() {
            List<String> lines = Reports.summaryLines(duplicateReport().statistics());

            assertThat(lines).anySatisfy(l -> assertThat(l).contains("Espaço desperdiçado").contains("4 B"));
            assertThat(lines).anySatisfy(l -> assertThat(l).contains("Grupos duplicados").endsWith("1"));
        }

        @Test
        @DisplayName("JSON summaries should use snake_case keys")
        void shouldWriteJsonSummaries() throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            JsonSummaryWriter writer = new JsonSummaryWriter();

            JsonNode comparison = mapper.readTree(writer.toJson(comparisonReport(List.of(
                    ComparisonOutcome.inBoth("diff.txt", Tristate.TRUE, Tristate.FALSE)))));
            assertThat(comparison.get("mode").asText()).isEqualTo("checksum");
            assertThat(comparison.get("different_content").asInt()).isEqualTo(1);
            assertThat(comparison.has("created_at")).isTrue();
            assertThat(comparison.has("folder_1")).isTrue();

            Path jsonFile = tempDir.resolve("summary/dupes.json");
            writer.write(duplicateReport(), jsonFile, false);
            JsonNode duplicates = mapper.readTree(jsonFile.toFile());
            assertThat(duplicates.get("duplicate_groups").asInt()).isEqualTo(1);
            assertThat(duplicates.get("wasted_bytes").asLong()).isEqualTo(4L);
            assertThat(duplicates.get("wasted_human").asText()).isEqualTo("4 B");
            assertThat(duplicates.get("largest_groups").get(0).get("paths").get(1).asText()).isEqualTo("p2");
            assertThat(duplicates.get("files_scanned").asLong()).isEqualTo(4L);
            assertThat(duplicates.get("directories_scanned").asLong()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Comparison JSON should carry the exclusions and walk failures of both scans")
        void shouldCarryScanCounters() throws IOException {
            JsonNode comparison = new ObjectMapper().readTree(new JsonSummaryWriter().toJson(comparisonReport(List.of())));

            assertThat(comparison.get("excluded_by_filter").asLong()).isEqualTo(3L);
            assertThat(comparison.get("non_regular_skipped").asLong()).isEqualTo(1L);
            assertThat(comparison.get("scan_failures").asLong()).isEqualTo(3L);
            assertThat(comparison.get("directories_scanned").asLong()).isEqualTo(3L);
            assertThat(comparison.get("files_in_folder_2").asLong()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Comparison summary should list exclusions and walk failures")
        void shouldSummarizeScanCounters() {
            List<String> lines = Reports.summaryLines(comparisonReport(List.of()).statistics());

            assertThat(lines).anySatisfy(l -> assertThat(l).contains("Excluídos pelo filtro").endsWith("3"));
            assertThat(lines).anySatisfy(l -> assertThat(l).contains("Links/especiais ignorados").endsWith("1"));
            assertThat(lines).anySatisfy(l -> assertThat(l).contains("Falhas na varredura").endsWith("3"));
        }

        @Test
        @DisplayName("Duplicate summary should omit scan lines when nothing was skipped")
        void shouldOmitEmptyScanCounters() {
            List<String> lines = Reports.summaryLines(duplicateReport().statistics());

            assertThat(lines).noneSatisfy(l -> assertThat(l).contains("Falhas na varredura"));
            assertThat(lines).noneSatisfy(l -> assertThat(l).contains("Excluídos pelo filtro"));
        }

        @Test
        @DisplayName("JSON group paths should follow the absolute path choice of the CSV")
        void shouldUseAbsolutePathsInJson() throws IOException {
            JsonNode duplicates = new ObjectMapper().readTree(new JsonSummaryWriter().toJson(duplicateReport(), true));

            JsonNode paths = duplicates.get("largest_groups").get(0).get("paths");
            assertThat(paths.get(0).asText()).isEqualTo(tempDir.resolve("p1").toString());
            assertThat(paths.get(1).asText()).isEqualTo(tempDir.resolve("p2").toString());
        }
    }

    private ComparisonReport comparisonReport(List<ComparisonOutcome> outcomes) {
        ComparisonStatistics stats = new ComparisonStatistics(ComparisonMode.CHECKSUM,
                new ScanStatistics(1, 2, 0, 0, 1), new ScanStatistics(1, 1, 1, 3, 2),
                0, 0, 1, 0, 1, 0, 0, outcomes.size());
        return new ComparisonReport(tempDir.resolve("a"), tempDir.resolve("b"), outcomes,
                PathPartition.of(Set.of("diff.txt"), Set.of("diff.txt")), stats);
    }

    private DuplicateReport duplicateReport() {
        DuplicateGroup group = new DuplicateGroup("abc123", 4, List.of(
                new FileRecord("p2", tempDir.resolve("p2"), 4),
                new FileRecord("p1", tempDir.resolve("p1"), 4)));
        DuplicateStatistics stats = new DuplicateStatistics("SHA-256", 0,
                new ScanStatistics(4, 0, 0, 0, 1), 4, 1, 3, 0, 1, 2, 4L);
        return new DuplicateReport(tempDir, List.of(group), stats);
    }
}
