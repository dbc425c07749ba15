package com.example.folderaudit.compare;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.folderaudit.config.EngineConfig;
import com.example.folderaudit.content.Content;
import com.example.folderaudit.content.Content.ComparisonMode;
import com.example.folderaudit.content.Content.ContentComparator;
import com.example.folderaudit.content.Content.ContentReadException;
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
 * Agrega tipos e o pipeline de comparação entre duas árvores de diretórios.
 * <p>
 * Fluxo: scan A || scan B -> partição de caminhos -> comparação dos pares em paralelo
 * -> um {@link ComparisonOutcome} por caminho -> filtro -> ordenação por caminho.
 */
public final class Comparison {

    private Comparison() {}

    /**
     * Valor de três estados. UNKNOWN significa "não verificado" (lado ausente,
     * tamanhos diferentes ou erro de leitura) e nunca deve virar FALSE.
     */
    public enum Tristate {
        TRUE,
        FALSE,
        UNKNOWN;

        public static Tristate of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public boolean isTrue() { return this == TRUE; }
        public boolean isFalse() { return this == FALSE; }
    }

    /** Resultado por caminho relativo. */
    public static final class ComparisonOutcome {
        private final String relativePath;
        private final boolean existsInA;
        private final boolean existsInB;
        private final Tristate sizeSame;
        private final Tristate contentSame;

        public ComparisonOutcome(String relativePath, boolean existsInA, boolean existsInB,
                                 Tristate sizeSame, Tristate contentSame) {
            this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
            if (!existsInA && !existsInB) {
                throw new IllegalArgumentException("Caminho precisa existir em pelo menos um lado: " + relativePath);
            }
            this.existsInA = existsInA;
            this.existsInB = existsInB;
            this.sizeSame = Objects.requireNonNull(sizeSame, "sizeSame");
            this.contentSame = Objects.requireNonNull(contentSame, "contentSame");
        }

        public static ComparisonOutcome onlyInA(String relativePath) {
            return new ComparisonOutcome(relativePath, true, false, Tristate.UNKNOWN, Tristate.UNKNOWN);
        }

        public static ComparisonOutcome onlyInB(String relativePath) {
            return new ComparisonOutcome(relativePath, false, true, Tristate.UNKNOWN, Tristate.UNKNOWN);
        }

        public static ComparisonOutcome inBoth(String relativePath, Tristate sizeSame, Tristate contentSame) {
            return new ComparisonOutcome(relativePath, true, true, sizeSame, contentSame);
        }

        public String relativePath() { return relativePath; }
        public boolean existsInA() { return existsInA; }
        public boolean existsInB() { return existsInB; }
        public Tristate sizeSame() { return sizeSame; }
        public Tristate contentSame() { return contentSame; }

        /** Presente nos dois lados e com conteúdo confirmado igual. */
        public boolean isIdentical() {
            return existsInA && existsInB && contentSame.isTrue();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ComparisonOutcome)) return false;
            ComparisonOutcome other = (ComparisonOutcome) o;
            return existsInA == other.existsInA
                    && existsInB == other.existsInB
                    && relativePath.equals(other.relativePath)
                    && sizeSame == other.sizeSame
                    && contentSame == other.contentSame;
        }

        @Override
        public int hashCode() {
            return Objects.hash(relativePath, existsInA, existsInB, sizeSame, contentSame);
        }

        @Override
        public String toString() {
            return "ComparisonOutcome{" + relativePath + ", a=" + existsInA + ", b=" + existsInB
                    + ", size=" + sizeSame + ", content=" + contentSame + "}";
        }
    }

    /**
     * Partição disjunta da união dos caminhos dos dois scans.
     */
    public static final class PathPartition {
        private final SortedSet<String> onlyInA;
        private final SortedSet<String> onlyInB;
        private final SortedSet<String> inBoth;

        private PathPartition(SortedSet<String> onlyInA, SortedSet<String> onlyInB, SortedSet<String> inBoth) {
            this.onlyInA = Collections.unmodifiableSortedSet(onlyInA);
            this.onlyInB = Collections.unmodifiableSortedSet(onlyInB);
            this.inBoth = Collections.unmodifiableSortedSet(inBoth);
        }

        public static PathPartition of(Set<String> keysA, Set<String> keysB) {
            Objects.requireNonNull(keysA, "keysA");
            Objects.requireNonNull(keysB, "keysB");
            SortedSet<String> onlyA = sortedCopy(keysA);
            onlyA.removeAll(keysB);
            SortedSet<String> onlyB = sortedCopy(keysB);
            onlyB.removeAll(keysA);
            SortedSet<String> both = sortedCopy(keysA);
            both.retainAll(keysB);
            return new PathPartition(onlyA, onlyB, both);
        }

        private static SortedSet<String> sortedCopy(Set<String> keys) {
            SortedSet<String> copy = new TreeSet<>(Scanner.PATH_ORDER);
            copy.addAll(keys);
            return copy;
        }

        public SortedSet<String> onlyInA() { return onlyInA; }
        public SortedSet<String> onlyInB() { return onlyInB; }
        public SortedSet<String> inBoth() { return inBoth; }

        public int totalPaths() {
            return onlyInA.size() + onlyInB.size() + inBoth.size();
        }
    }

    /**
     * Contadores da execução, para o resumo e diagnóstico. Inclui as estatísticas das
     * duas varreduras, para que exclusões e falhas do walk fiquem visíveis ao chamador.
     */
    public static final class ComparisonStatistics {
        private final ComparisonMode mode;
        private final ScanStatistics scanA;
        private final ScanStatistics scanB;
        private final int onlyInA;
        private final int onlyInB;
        private final int inBoth;
        private final int sameContent;
        private final int differentContent;
        private final int sizeMismatch;
        private final int readErrors;
        private final int reportedRows;

        public ComparisonStatistics(ComparisonMode mode, ScanStatistics scanA, ScanStatistics scanB,
                                    int onlyInA, int onlyInB, int inBoth, int sameContent,
                                    int differentContent, int sizeMismatch, int readErrors, int reportedRows) {
            this.mode = Objects.requireNonNull(mode, "mode");
            this.scanA = Objects.requireNonNull(scanA, "scanA");
            this.scanB = Objects.requireNonNull(scanB, "scanB");
            this.onlyInA = onlyInA;
            this.onlyInB = onlyInB;
            this.inBoth = inBoth;
            this.sameContent = sameContent;
            this.differentContent = differentContent;
            this.sizeMismatch = sizeMismatch;
            this.readErrors = readErrors;
            this.reportedRows = reportedRows;
        }

        public ComparisonMode mode() { return mode; }
        public ScanStatistics scanA() { return scanA; }
        public ScanStatistics scanB() { return scanB; }
        public long filesInA() { return scanA.filesRecorded(); }
        public long filesInB() { return scanB.filesRecorded(); }
        public int onlyInA() { return onlyInA; }
        public int onlyInB() { return onlyInB; }
        public int inBoth() { return inBoth; }
        public int sameContent() { return sameContent; }
        public int differentContent() { return differentContent; }
        public int sizeMismatch() { return sizeMismatch; }
        public int readErrors() { return readErrors; }
        public int reportedRows() { return reportedRows; }

        /** Somas das duas varreduras. */
        public long excludedByFilter() { return scanA.filesExcludedByFilter() + scanB.filesExcludedByFilter(); }
        public long nonRegularSkipped() { return scanA.nonRegularSkipped() + scanB.nonRegularSkipped(); }
        public long scanFailures() { return scanA.entriesFailed() + scanB.entriesFailed(); }
        public long directoriesVisited() { return scanA.directoriesVisited() + scanB.directoriesVisited(); }
    }

    /** Resultado completo: linhas filtradas e ordenadas + partição + estatísticas. */
    public static final class ComparisonReport {
        private final Path rootA;
        private final Path rootB;
        private final List<ComparisonOutcome> outcomes;
        private final PathPartition partition;
        private final ComparisonStatistics statistics;

        public ComparisonReport(Path rootA, Path rootB, List<ComparisonOutcome> outcomes,
                                PathPartition partition, ComparisonStatistics statistics) {
            this.rootA = Objects.requireNonNull(rootA, "rootA");
            this.rootB = Objects.requireNonNull(rootB, "rootB");
            this.outcomes = List.copyOf(outcomes);
            this.partition = Objects.requireNonNull(partition, "partition");
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public Path rootA() { return rootA; }
        public Path rootB() { return rootB; }
        /** Linhas a emitir, já filtradas e ordenadas por caminho relativo. */
        public List<ComparisonOutcome> outcomes() { return outcomes; }
        public PathPartition partition() { return partition; }
        public ComparisonStatistics statistics() { return statistics; }
    }

    /**
     * Orquestra a comparação de duas árvores. Sem estado entre execuções.
     */
    public static final class ComparisonPipeline {

        private static final Logger log = LoggerFactory.getLogger(ComparisonPipeline.class);

        private final EngineConfig config;
        private final ScanService scanService;
        private final ContentComparator comparator;

        public ComparisonPipeline(EngineConfig config, ScanService scanService, ContentComparator comparator) {
            this.config = Objects.requireNonNull(config, "config");
            this.scanService = Objects.requireNonNull(scanService, "scanService");
            this.comparator = Objects.requireNonNull(comparator, "comparator");
        }

        /**
         * Varre as duas árvores em paralelo e compara.
         *
         * @param includeIdentical se false, omite arquivos presentes nos dois lados com conteúdo igual
         * @throws ScanException se qualquer um dos roots for inválido; nenhuma comparação é feita
         */
        public ComparisonReport compare(Path folderA, Path folderB, boolean includeIdentical) throws ScanException {
            Objects.requireNonNull(folderA, "folderA");
            Objects.requireNonNull(folderB, "folderB");

            List<ScanResult> scans = scanBoth(folderA, folderB);
            ScanResult scanA = scans.get(0);
            ScanResult scanB = scans.get(1);
            log.info("Pasta 1: {} arquivos; Pasta 2: {} arquivos", scanA.size(), scanB.size());
            return compare(scanA, scanB, includeIdentical);
        }

        /**
         * Compara dois scans já realizados.
         */
        public ComparisonReport compare(ScanResult scanA, ScanResult scanB, boolean includeIdentical) {
            Objects.requireNonNull(scanA, "scanA");
            Objects.requireNonNull(scanB, "scanB");

            PathPartition partition = PathPartition.of(scanA.relativePaths(), scanB.relativePaths());
            List<String> common = new ArrayList<>(partition.inBoth());
            log.info("Comparando {} arquivos em comum (modo {})...", common.size(), comparator.mode());

            List<IoTask<ComparisonOutcome>> tasks = new ArrayList<>(common.size());
            for (String relativePath : common) {
                FileRecord a = scanA.get(relativePath);
                FileRecord b = scanB.get(relativePath);
                tasks.add(() -> comparePair(relativePath, a, b));
            }

            List<TaskOutcome<ComparisonOutcome>> results;
            try (WorkerPool pool = new WorkerPool(config.workerCount(), "compare")) {
                int interval = config.progressInterval();
                results = pool.runAll(tasks, (done, total) -> {
                    if (done % interval == 0) {
                        log.info("  Comparados {}/{}...", done, total);
                    }
                });
            }

            List<ComparisonOutcome> all = new ArrayList<>(partition.totalPaths());
            partition.onlyInA().forEach(p -> all.add(ComparisonOutcome.onlyInA(p)));
            partition.onlyInB().forEach(p -> all.add(ComparisonOutcome.onlyInB(p)));

            int same = 0;
            int different = 0;
            int sizeMismatch = 0;
            int readErrors = 0;
            for (int i = 0; i < results.size(); i++) {
                TaskOutcome<ComparisonOutcome> result = results.get(i);
                ComparisonOutcome outcome;
                if (result.isSuccess()) {
                    outcome = result.get();
                } else {
                    readErrors++;
                    IOException failure = result.failure().orElseThrow();
                    log.debug("Erro de leitura ao comparar {}: {}", common.get(i), failure.getMessage());
                    outcome = ComparisonOutcome.inBoth(common.get(i), Tristate.TRUE, Tristate.UNKNOWN);
                }
                if (outcome.sizeSame().isFalse()) {
                    sizeMismatch++;
                } else if (outcome.contentSame().isTrue()) {
                    same++;
                } else if (outcome.contentSame().isFalse()) {
                    different++;
                }
                all.add(outcome);
            }
            if (readErrors > 0) {
                log.warn("{} pares não puderam ser lidos; conteúdo marcado como desconhecido", readErrors);
            }

            List<ComparisonOutcome> rows = new ArrayList<>(all.size());
            for (ComparisonOutcome outcome : all) {
                if (includeIdentical || !outcome.isIdentical()) {
                    rows.add(outcome);
                }
            }
            rows.sort(Comparator.comparing(ComparisonOutcome::relativePath, Scanner.PATH_ORDER));

            ComparisonStatistics stats = new ComparisonStatistics(comparator.mode(),
                    scanA.statistics(), scanB.statistics(),
                    partition.onlyInA().size(), partition.onlyInB().size(), partition.inBoth().size(),
                    same, different, sizeMismatch, readErrors, rows.size());
            return new ComparisonReport(scanA.root(), scanB.root(), rows, partition, stats);
        }

        /**
         * Tamanho primeiro; conteúdo só é verificado quando os tamanhos do scan coincidem.
         * Depois da verificação, confirma que nenhum dos lados mudou desde o scan.
         */
        private ComparisonOutcome comparePair(String relativePath, FileRecord a, FileRecord b) throws ContentReadException {
            if (a.size() != b.size()) {
                return ComparisonOutcome.inBoth(relativePath, Tristate.FALSE, Tristate.UNKNOWN);
            }
            boolean same = comparator.sameContent(a.absolutePath(), b.absolutePath());
            Content.verifyUnchanged(a.absolutePath(), a.size());
            Content.verifyUnchanged(b.absolutePath(), b.size());
            return ComparisonOutcome.inBoth(relativePath, Tristate.TRUE, Tristate.of(same));
        }

        /** Duas varreduras independentes, cada uma na sua própria thread. */
        private List<ScanResult> scanBoth(Path folderA, Path folderB) throws ScanException {
            log.info("Varrendo pastas...");
            List<IoTask<ScanResult>> scans = List.of(
                    () -> scanService.scan(folderA),
                    () -> scanService.scan(folderB));

            List<TaskOutcome<ScanResult>> outcomes;
            try (WorkerPool pool = new WorkerPool(2, "scan")) {
                outcomes = pool.runAll(scans);
            }

            List<ScanResult> results = new ArrayList<>(2);
            Path[] roots = {folderA, folderB};
            for (int i = 0; i < outcomes.size(); i++) {
                TaskOutcome<ScanResult> outcome = outcomes.get(i);
                if (!outcome.isSuccess()) {
                    IOException failure = outcome.failure().orElseThrow();
                    if (failure instanceof ScanException) {
                        throw (ScanException) failure;
                    }
                    throw new ScanException(roots[i], "Falha na varredura de " + roots[i] + ": " + failure.getMessage(), failure);
                }
                results.add(outcome.get());
            }
            return results;
        }
    }
}
