package com.example.folderaudit.duplicates;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.folderaudit.config.EngineConfig;
import com.example.folderaudit.content.Content;
import com.example.folderaudit.content.Content.ChecksumEngine;
import com.example.folderaudit.scan.Scanner;
import com.example.folderaudit.scan.Scanner.FileRecord;
import com.example.folderaudit.scan.Scanner.ScanException;
import com.example.folderaudit.scan.Scanner.ScanResult;
import com.example.folderaudit.scan.Scanner.ScanService;
import com.example.folderaudit.scan.Scanner.ScanStatistics;
import com.example.folderaudit.worker.Workers.IoTask;
import com.example.folderaudit.worker.Workers.TaskOutcome;
import com.example.folderaudit.worker.Workers.WorkerPool;

/**
 * Detecção de arquivos duplicados dentro de uma única árvore.
 * <p>
 * Estratégia: agrupar por tamanho, descartar tamanhos únicos (nunca são hasheados),
 * calcular checksum só dos candidatos e agrupar por (tamanho, digest).
 */
public final class Duplicates {

    private Duplicates() {}

    /**
     * Conjunto de 2+ arquivos com mesmo tamanho e mesmo digest.
     * Arquivos ordenados pelo caminho relativo.
     */
    public static final class DuplicateGroup {
        private final String checksum;
        private final long size;
        private final List<FileRecord> files;

        public DuplicateGroup(String checksum, long size, List<FileRecord> files) {
            this.checksum = Objects.requireNonNull(checksum, "checksum");
            Objects.requireNonNull(files, "files");
            if (files.size() < 2) {
                throw new IllegalArgumentException("Grupo de duplicados precisa de 2+ arquivos: " + files.size());
            }
            for (FileRecord f : files) {
                if (f.size() != size) {
                    throw new IllegalArgumentException("Tamanho divergente no grupo " + checksum + ": " + f);
                }
            }
            this.size = size;
            List<FileRecord> sorted = new ArrayList<>(files);
            sorted.sort(Comparator.comparing(FileRecord::relativePath, Scanner.PATH_ORDER));
            this.files = List.copyOf(sorted);
        }

        public String checksum() { return checksum; }
        public long size() { return size; }
        public List<FileRecord> files() { return files; }
        public int count() { return files.size(); }

        /** Espaço recuperável mantendo uma única cópia. */
        public long wastedBytes() {
            return size * (files.size() - 1L);
        }
    }

    /** Contadores da execução, incluindo as estatísticas da varredura. */
    public static final class DuplicateStatistics {
        private final String algorithm;
        private final long minSize;
        private final ScanStatistics scan;
        private final int filesConsidered;
        private final int uniqueBySize;
        private final int checksummed;
        private final int readErrors;
        private final int groups;
        private final int filesInGroups;
        private final long wastedBytes;

        public DuplicateStatistics(String algorithm, long minSize, ScanStatistics scan, int filesConsidered,
                                   int uniqueBySize, int checksummed, int readErrors, int groups,
                                   int filesInGroups, long wastedBytes) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            this.minSize = minSize;
            this.scan = Objects.requireNonNull(scan, "scan");
            this.filesConsidered = filesConsidered;
            this.uniqueBySize = uniqueBySize;
            this.checksummed = checksummed;
            this.readErrors = readErrors;
            this.groups = groups;
            this.filesInGroups = filesInGroups;
            this.wastedBytes = wastedBytes;
        }

        public String algorithm() { return algorithm; }
        public long minSize() { return minSize; }
        public ScanStatistics scan() { return scan; }
        public long filesScanned() { return scan.filesRecorded(); }
        /** Arquivos com tamanho >= minSize. */
        public int filesConsidered() { return filesConsidered; }
        /** Arquivos descartados sem checksum por terem tamanho único. */
        public int uniqueBySize() { return uniqueBySize; }
        public int checksummed() { return checksummed; }
        public int readErrors() { return readErrors; }
        public int groups() { return groups; }
        public int filesInGroups() { return filesInGroups; }
        public long wastedBytes() { return wastedBytes; }
    }

    /** Grupos ordenados (maior tamanho primeiro) + estatísticas. */
    public static final class DuplicateReport {
        private final Path root;
        private final List<DuplicateGroup> groups;
        private final DuplicateStatistics statistics;

        public DuplicateReport(Path root, List<DuplicateGroup> groups, DuplicateStatistics statistics) {
            this.root = Objects.requireNonNull(root, "root");
            this.groups = List.copyOf(groups);
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public Path root() { return root; }
        public List<DuplicateGroup> groups() { return groups; }
        public DuplicateStatistics statistics() { return statistics; }
    }

    /**
     * Orquestra scan -> filtro de tamanho mínimo -> agrupamento por tamanho -> checksum
     * em paralelo -> agrupamento por digest.
     */
    public static final class DuplicateDetectionPipeline {

        private static final Logger log = LoggerFactory.getLogger(DuplicateDetectionPipeline.class);

        /** Maior tamanho primeiro; empate resolvido pelo checksum para saída determinística. */
        static final Comparator<DuplicateGroup> GROUP_ORDER = Comparator
                .comparingLong(DuplicateGroup::size).reversed()
                .thenComparing(DuplicateGroup::checksum);

        private final EngineConfig config;
        private final ScanService scanService;
        private final ChecksumEngine checksumEngine;

        public DuplicateDetectionPipeline(EngineConfig config, ScanService scanService, ChecksumEngine checksumEngine) {
            this.config = Objects.requireNonNull(config, "config");
            this.scanService = Objects.requireNonNull(scanService, "scanService");
            this.checksumEngine = Objects.requireNonNull(checksumEngine, "checksumEngine");
        }

        /**
         * @param minSize tamanho mínimo em bytes (0 = sem filtro)
         * @throws ScanException se o root for inválido
         */
        public DuplicateReport find(Path folder, long minSize) throws ScanException {
            Objects.requireNonNull(folder, "folder");
            log.info("Varrendo pasta: {}", folder);
            ScanResult scan = scanService.scan(folder);
            return find(scan, minSize);
        }

        public DuplicateReport find(ScanResult scan, long minSize) {
            Objects.requireNonNull(scan, "scan");
            if (minSize < 0) {
                throw new IllegalArgumentException("minSize deve ser >= 0: " + minSize);
            }

            // Agrupa por tamanho, já aplicando o tamanho mínimo
            Map<Long, List<FileRecord>> bySize = new TreeMap<>();
            int considered = 0;
            for (FileRecord record : scan.filesMap().values()) {
                if (record.size() < minSize) {
                    continue;
                }
                considered++;
                bySize.computeIfAbsent(record.size(), k -> new ArrayList<>()).add(record);
            }
            if (minSize > 0) {
                log.info("  {} arquivos >= {} bytes", considered, minSize);
            }

            // Só quem divide tamanho com outro arquivo vira candidato
            List<FileRecord> candidates = new ArrayList<>();
            for (List<FileRecord> group : bySize.values()) {
                if (group.size() > 1) {
                    candidates.addAll(group);
                }
            }
            int uniqueBySize = considered - candidates.size();
            log.info("  {} arquivos com tamanho único (sem checksum); {} para checksum", uniqueBySize, candidates.size());

            List<IoTask<String>> tasks = new ArrayList<>(candidates.size());
            for (FileRecord candidate : candidates) {
                tasks.add(() -> {
                    String digest = checksumEngine.checksum(candidate.absolutePath());
                    // Digest de conteúdo com outro tamanho quebraria a homogeneidade do grupo
                    Content.verifyUnchanged(candidate.absolutePath(), candidate.size());
                    return digest;
                });
            }

            List<TaskOutcome<String>> results;
            try (WorkerPool pool = new WorkerPool(config.workerCount(), "checksum")) {
                int interval = config.progressInterval();
                results = pool.runAll(tasks, (done, total) -> {
                    if (done % interval == 0) {
                        log.info("  Checksum {}/{}...", done, total);
                    }
                });
            }

            // (tamanho -> digest -> arquivos); tamanho na chave garante grupos homogêneos
            Map<Long, Map<String, List<FileRecord>>> byDigest = new TreeMap<>();
            int readErrors = 0;
            for (int i = 0; i < results.size(); i++) {
                TaskOutcome<String> result = results.get(i);
                FileRecord record = candidates.get(i);
                if (!result.isSuccess()) {
                    readErrors++;
                    IOException failure = result.failure().orElseThrow();
                    log.debug("Erro de leitura em {}: {}", record.absolutePath(), failure.getMessage());
                    continue;
                }
                byDigest.computeIfAbsent(record.size(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(result.get(), k -> new ArrayList<>())
                        .add(record);
            }
            if (readErrors > 0) {
                log.warn("  {} arquivos não puderam ser lidos", readErrors);
            }

            List<DuplicateGroup> groups = new ArrayList<>();
            int filesInGroups = 0;
            long wasted = 0L;
            for (Map.Entry<Long, Map<String, List<FileRecord>>> sizeEntry : byDigest.entrySet()) {
                for (Map.Entry<String, List<FileRecord>> digestEntry : sizeEntry.getValue().entrySet()) {
                    if (digestEntry.getValue().size() < 2) {
                        continue;
                    }
                    DuplicateGroup group = new DuplicateGroup(digestEntry.getKey(), sizeEntry.getKey(), digestEntry.getValue());
                    groups.add(group);
                    filesInGroups += group.count();
                    wasted += group.wastedBytes();
                }
            }
            groups.sort(GROUP_ORDER);

            DuplicateStatistics stats = new DuplicateStatistics(checksumEngine.algorithm(), minSize,
                    scan.statistics(), considered, uniqueBySize, candidates.size(), readErrors,
                    groups.size(), filesInGroups, wasted);
            return new DuplicateReport(scan.root(), groups, stats);
        }
    }
}
