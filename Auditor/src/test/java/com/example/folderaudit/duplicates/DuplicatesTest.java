package com.example.folderaudit.duplicates;

import com.example.folderaudit.config.EngineConfig;
import com.example.folderaudit.content.Content.ChecksumEngine;
import com.example.folderaudit.content.Content.ContentReadException;
import com.example.folderaudit.content.Content.StreamingChecksumEngine;
import com.example.folderaudit.duplicates.Duplicates.DuplicateDetectionPipeline;
import com.example.folderaudit.duplicates.Duplicates.DuplicateGroup;
import com.example.folderaudit.duplicates.Duplicates.DuplicateReport;
import com.example.folderaudit.report.Reports;
import com.example.folderaudit.scan.Scanner.FileRecord;
import com.example.folderaudit.scan.Scanner.ScanException;
import com.example.folderaudit.scan.Scanner.ScanResult;
import com.example.folderaudit.scan.Scanner.ScanService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Duplicate Detection Tests")
class DuplicatesTest {

    @TempDir
    Path tempDir;

    private EngineConfig config;
    private ScanService scanService;
    private CountingEngine engine;
    private DuplicateDetectionPipeline pipeline;

    @BeforeEach
    void setUp() {
        config = EngineConfig.builder().workerCount(3).build();
        scanService = new ScanService(config);
        engine = new CountingEngine(new StreamingChecksumEngine(config));
        pipeline = new DuplicateDetectionPipeline(config, scanService, engine);
    }

    @Test
    @DisplayName("Should group equal content and never hash files with a unique size")
    void shouldFindGroupAndSkipUniqueSizes() throws IOException {
        write("p1", "AAAA");
        write("p2", "AAAA");
        write("p3", "BBBB");
        write("p4", "1234567");

        DuplicateReport report = pipeline.find(tempDir, 0);

        assertThat(report.groups()).hasSize(1);
        DuplicateGroup group = report.groups().get(0);
        assertThat(group.count()).isEqualTo(2);
        assertThat(group.size()).isEqualTo(4L);
        assertThat(group.wastedBytes()).isEqualTo(4L);
        assertThat(Reports.duplicateRow(group, false).get(3)).isEqualTo("p1|p2");

        assertThat(engine.hashed).containsExactlyInAnyOrder("p1", "p2", "p3");
        assertThat(report.statistics().uniqueBySize()).isEqualTo(1);
        assertThat(report.statistics().checksummed()).isEqualTo(3);
        assertThat(report.statistics().filesInGroups()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report no groups when every file is unique")
    void shouldReportNoGroups() throws IOException {
        write("a.txt", "one");
        write("b.txt", "three");

        DuplicateReport report = pipeline.find(tempDir, 0);

        assertThat(report.groups()).isEmpty();
        assertThat(engine.hashed).isEmpty();
        assertThat(report.statistics().wastedBytes()).isZero();
    }

    @Test
    @DisplayName("Should ignore files smaller than the minimum size")
    void shouldApplyMinimumSize() throws IOException {
        write("small1", "ab");
        write("small2", "ab");
        write("big1", "abcdefgh");
        write("big2", "abcdefgh");

        DuplicateReport report = pipeline.find(tempDir, 5);

        assertThat(report.groups()).hasSize(1);
        assertThat(report.groups().get(0).files()).extracting(FileRecord::relativePath)
                .containsExactly("big1", "big2");
        assertThat(engine.hashed).containsExactlyInAnyOrder("big1", "big2");
        assertThat(report.statistics().filesConsidered()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should order groups by size, largest first")
    void shouldOrderBySizeDescending() throws IOException {
        write("s1", "xy");
        write("s2", "xy");
        write("l1", "0123456789");
        write("l2", "0123456789");
        write("dir/l3", "0123456789");
        write("m1", "hello");
        write("m2", "hello");

        DuplicateReport report = pipeline.find(tempDir, 0);

        assertThat(report.groups()).extracting(DuplicateGroup::size).containsExactly(10L, 5L, 2L);
        DuplicateGroup largest = report.groups().get(0);
        assertThat(Reports.duplicateRow(largest, false).get(3)).isEqualTo("dir/l3|l1|l2");
        assertThat(largest.wastedBytes()).isEqualTo(20L);
        assertThat(report.statistics().wastedBytes()).isEqualTo(20L + 5L + 2L);
    }

    @Test
    @DisplayName("Groups should never mix sizes even if the digest collided")
    void shouldKeepSizeInGroupKey() throws IOException {
        write("a1", "aaaa");
        write("a2", "aaaa");
        write("b1", "bbbbbb");
        write("b2", "bbbbbb");
        ChecksumEngine constant = new ChecksumEngine() {
            @Override
            public String checksum(Path path) {
                return "same";
            }

            @Override
            public String algorithm() {
                return "constant";
            }
        };

        DuplicateReport report = new DuplicateDetectionPipeline(config, scanService, constant).find(tempDir, 0);

        assertThat(report.groups()).hasSize(2);
        assertThat(report.groups()).extracting(DuplicateGroup::size).containsExactly(6L, 4L);
    }

    @Test
    @DisplayName("A read failure should drop the file and keep the run going")
    void shouldSkipUnreadableFiles() throws IOException {
        write("ok1", "data");
        write("ok2", "data");
        write("bad", "data");
        ChecksumEngine failing = new ChecksumEngine() {
            @Override
            public String checksum(Path path) throws ContentReadException {
                if (path.getFileName().toString().equals("bad")) {
                    throw new ContentReadException(path, "Permissão negada");
                }
                return engine.checksum(path);
            }

            @Override
            public String algorithm() {
                return engine.algorithm();
            }
        };

        DuplicateReport report = new DuplicateDetectionPipeline(config, scanService, failing).find(tempDir, 0);

        assertThat(report.groups()).hasSize(1);
        assertThat(report.groups().get(0).files()).extracting(FileRecord::relativePath)
                .containsExactly("ok1", "ok2");
        assertThat(report.statistics().readErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("Files rewritten with another size after the scan should not form a group")
    void shouldDropFilesChangedAfterScan() throws IOException {
        Path p1 = write("p1", "AAAA");
        Path p2 = write("p2", "BBBB");
        ScanResult scan = scanService.scan(tempDir);

        Files.write(p1, "CCCCCCCC".getBytes(StandardCharsets.UTF_8));
        Files.write(p2, "CCCCCCCC".getBytes(StandardCharsets.UTF_8));
        DuplicateReport report = pipeline.find(scan, 0);

        assertThat(report.groups()).isEmpty();
        assertThat(report.statistics().checksummed()).isEqualTo(2);
        assertThat(report.statistics().readErrors()).isEqualTo(2);
        assertThat(report.statistics().wastedBytes()).isZero();
    }

    @Test
    @DisplayName("Statistics should carry the files the scan excluded")
    void shouldCarryScanCounters() throws IOException {
        write("d1", "same");
        write("d2", "same");
        write(".DS_Store", "meta");
        write("sub/._d1", "fork");

        DuplicateReport report = pipeline.find(tempDir, 0);

        assertThat(report.statistics().filesScanned()).isEqualTo(2L);
        assertThat(report.statistics().scan().filesExcludedByFilter()).isEqualTo(2L);
        assertThat(report.statistics().scan().directoriesVisited()).isEqualTo(2L);
    }

    @Test
    @DisplayName("Should produce the same groups on repeated runs")
    void shouldBeDeterministic() throws IOException {
        for (int i = 0; i < 6; i++) {
            write("x" + i, "dup-" + (i % 2));
        }

        DuplicateReport first = pipeline.find(tempDir, 0);
        DuplicateReport second = pipeline.find(tempDir, 0);

        List<String> rowsFirst = new ArrayList<>();
        first.groups().forEach(g -> rowsFirst.add(String.join(",", Reports.duplicateRow(g, false))));
        List<String> rowsSecond = new ArrayList<>();
        second.groups().forEach(g -> rowsSecond.add(String.join(",", Reports.duplicateRow(g, false))));
        assertThat(rowsSecond).isEqualTo(rowsFirst).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a negative minimum size")
    void shouldRejectNegativeMinSize() {
        assertThatThrownBy(() -> pipeline.find(tempDir, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should fail with ScanException for an invalid root")
    void shouldFailOnInvalidRoot() {
        assertThatThrownBy(() -> pipeline.find(tempDir.resolve("missing"), 0)).isInstanceOf(ScanException.class);
    }

    @Test
    @DisplayName("DuplicateGroup should require two files of the same size")
    void groupShouldValidateMembers() {
        FileRecord a = new FileRecord("a", tempDir.resolve("a"), 4);
        FileRecord b = new FileRecord("b", tempDir.resolve("b"), 5);

        assertThatThrownBy(() -> new DuplicateGroup("x", 4, List.of(a))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DuplicateGroup("x", 4, List.of(a, b))).isInstanceOf(IllegalArgumentException.class);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private static final class CountingEngine implements ChecksumEngine {
        private final ChecksumEngine delegate;
        private final Set<String> hashed = Collections.newSetFromMap(new ConcurrentHashMap<>());

        CountingEngine(ChecksumEngine delegate) {
            this.delegate = delegate;
        }

        @Override
        public String checksum(Path path) throws ContentReadException {
            hashed.add(path.getFileName().toString());
            return delegate.checksum(path);
        }

        @Override
        public String algorithm() {
            return delegate.algorithm();
        }
    }
}
