package com.example.folderaudit.scan;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.folderaudit.config.EngineConfig;

/**
 * Módulo de varredura de diretórios usado pela comparação e pela detecção de duplicados.
 *
 * Responsabilidades principais:
 * - Caminhar uma árvore a partir de um root e registrar cada arquivo regular
 *   (caminho relativo com '/', caminho absoluto, tamanho via stat);
 * - Aplicar o {@link ExclusionFilter} sobre o nome base de cada arquivo;
 * - Ser resiliente a erros pontuais (permissão negada, arquivo sumiu durante o walk),
 *   sem derrubar o scan inteiro. Apenas problemas no root são fatais ({@link ScanException}).
 *
 * Links simbólicos não são seguidos; links, devices, sockets e FIFOs são ignorados.
 */
public final class Scanner {

    private Scanner() {}

    /**
     * Ordem dos caminhos relativos em todas as saídas: por code point Unicode, não por
     * unidade UTF-16 como {@link String#compareTo}. Difere apenas fora do BMP (ex.: emoji).
     */
    public static final Comparator<String> PATH_ORDER = Scanner::compareCodePoints;

    public static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    /**
     * Arquivo encontrado durante o scan. Imutável; identificado pelo caminho relativo.
     */
    public static final class FileRecord {
        private final String relativePath;
        private final Path absolutePath;
        private final long size;

        public FileRecord(String relativePath, Path absolutePath, long size) {
            this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
            this.absolutePath = Objects.requireNonNull(absolutePath, "absolutePath");
            if (size < 0) {
                throw new IllegalArgumentException("size negativo: " + size);
            }
            this.size = size;
        }

        /** Caminho relativo ao root, sempre com '/'. */
        public String relativePath() { return relativePath; }
        public Path absolutePath() { return absolutePath; }
        public long size() { return size; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FileRecord)) return false;
            FileRecord other = (FileRecord) o;
            return size == other.size
                    && relativePath.equals(other.relativePath)
                    && absolutePath.equals(other.absolutePath);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relativePath, absolutePath, size);
        }

        @Override
        public String toString() {
            return "FileRecord{" + relativePath + ", " + size + " bytes}";
        }
    }

    /**
     * Estatísticas de um scan: arquivos registrados, excluídos pelo filtro,
     * entradas não regulares ignoradas e entradas que falharam (permissão, stat).
     */
    public static final class ScanStatistics {
        private final long filesRecorded;
        private final long filesExcludedByFilter;
        private final long nonRegularSkipped;
        private final long entriesFailed;
        private final long directoriesVisited;

        public ScanStatistics(long filesRecorded,
                              long filesExcludedByFilter,
                              long nonRegularSkipped,
                              long entriesFailed,
                              long directoriesVisited) {
            this.filesRecorded = filesRecorded;
            this.filesExcludedByFilter = filesExcludedByFilter;
            this.nonRegularSkipped = nonRegularSkipped;
            this.entriesFailed = entriesFailed;
            this.directoriesVisited = directoriesVisited;
        }

        public long filesRecorded() { return filesRecorded; }
        public long filesExcludedByFilter() { return filesExcludedByFilter; }
        public long nonRegularSkipped() { return nonRegularSkipped; }
        public long entriesFailed() { return entriesFailed; }
        public long directoriesVisited() { return directoriesVisited; }
    }

    /**
     * Resultado de um scan: root normalizado + mapa caminho relativo -> {@link FileRecord}.
     * O mapa é ordenado pelo caminho relativo, o que torna a iteração determinística.
     */
    public static final class ScanResult {
        private final Path root;
        private final SortedMap<String, FileRecord> files;
        private final ScanStatistics statistics;

        public ScanResult(Path root, Map<String, FileRecord> files, ScanStatistics statistics) {
            this.root = Objects.requireNonNull(root, "root");
            SortedMap<String, FileRecord> sorted = new TreeMap<>(PATH_ORDER);
            sorted.putAll(Objects.requireNonNull(files, "files"));
            this.files = Collections.unmodifiableSortedMap(sorted);
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public Path root() { return root; }
        public SortedMap<String, FileRecord> filesMap() { return files; }
        public Set<String> relativePaths() { return files.keySet(); }
        public FileRecord get(String relativePath) { return files.get(relativePath); }
        public int size() { return files.size(); }
        public ScanStatistics statistics() { return statistics; }
    }

    /**
     * Falha fatal de scan: root inexistente, não é diretório, ou ilegível.
     * Aborta a execução antes de qualquer saída ser produzida.
     */
    public static final class ScanException extends IOException {
        private static final long serialVersionUID = 1L;

        private final Path root;

        public ScanException(Path root, String message) {
            super(message);
            this.root = root;
        }

        public ScanException(Path root, String message, Throwable cause) {
            super(message, cause);
            this.root = root;
        }

        public Path root() { return root; }
    }

    /**
     * Filtro de exclusão de artefatos de metadados de plataforma.
     *
     * Avaliado sobre o nome base do arquivo, nunca sobre o caminho completo:
     * - nomes exatos (ex.: ".DS_Store");
     * - prefixos (ex.: "._", sidecars de resource fork do macOS).
     *
     * Puro: sem I/O, sem estado mutável.
     */
    public static final class ExclusionFilter {

        private final Set<String> excludedNames;
        private final Set<String> excludedPrefixes;

        public ExclusionFilter(Set<String> excludedNames, Set<String> excludedPrefixes) {
            this.excludedNames = Set.copyOf(excludedNames);
            this.excludedPrefixes = Set.copyOf(excludedPrefixes);
        }

        public static ExclusionFilter from(EngineConfig config) {
            return new ExclusionFilter(config.excludedNames(), config.excludedPrefixes());
        }

        /** Filtro "nenhum" (não exclui nada). */
        public static ExclusionFilter none() {
            return new ExclusionFilter(Set.of(), Set.of());
        }

        /**
         * Retorna true se o nome base deve ser excluído.
         */
        public boolean isExcluded(String fileName) {
            if (fileName == null || fileName.isEmpty()) {
                return false;
            }
            if (excludedNames.contains(fileName)) {
                return true;
            }
            for (String prefix : excludedPrefixes) {
                if (fileName.startsWith(prefix)) {
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * Serviço de varredura. Cada chamada de {@link #scan(Path)} usa apenas estado local,
     * então duas varreduras podem rodar em paralelo sobre a mesma instância.
     */
    public static final class ScanService {

        private static final Logger log = LoggerFactory.getLogger(ScanService.class);

        private final ExclusionFilter filter;

        public ScanService(ExclusionFilter filter) {
            this.filter = Objects.requireNonNull(filter, "filter");
        }

        public ScanService(EngineConfig config) {
            this(ExclusionFilter.from(config));
        }

        /**
         * Varre {@code root} recursivamente.
         *
         * @throws ScanException se o root não existir, não for diretório ou não puder ser lido
         */
        public ScanResult scan(Path root) throws ScanException {
            Objects.requireNonNull(root, "root");
            Path canonical = validateRoot(root);

            Map<String, FileRecord> files = new TreeMap<>(PATH_ORDER);
            // Acumuladores locais à chamada
            final long[] excluded = new long[1];
            final long[] nonRegular = new long[1];
            final long[] failed = new long[1];
            final long[] dirsVisited = new long[1];

            log.debug("Iniciando scan de {}", canonical);
            try {
                Files.walkFileTree(canonical, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                        new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        dirsVisited[0]++;
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (!attrs.isRegularFile()) {
                            nonRegular[0]++;
                            log.debug("Ignorando entrada não regular: {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        Path name = file.getFileName();
                        if (name != null && filter.isExcluded(name.toString())) {
                            excluded[0]++;
                            log.debug("Excluído pelo filtro: {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        String relative = normalizedRelative(canonical, file);
                        files.put(relative, new FileRecord(relative, file, attrs.size()));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        if (file.equals(canonical)) {
                            // Root ilegível: vira fatal no catch externo
                            return FileVisitResult.TERMINATE;
                        }
                        failed[0]++;
                        log.debug("Falha ao acessar {}: {}", file, exc.toString());
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                        if (exc != null) {
                            // Listagem interrompida no meio; o que já foi visto permanece no resultado
                            failed[0]++;
                            log.warn("Erro ao listar diretório {}: {}", dir, exc.toString());
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                throw new ScanException(root, "Falha fatal na varredura de " + canonical + ": " + e.getMessage(), e);
            }

            if (dirsVisited[0] == 0) {
                throw new ScanException(root, "Diretório não pode ser lido: " + canonical);
            }

            ScanStatistics stats = new ScanStatistics(files.size(), excluded[0], nonRegular[0], failed[0], dirsVisited[0]);
            log.info("Scan de {} finalizado: {} arquivos ({} excluídos, {} falhas)",
                    canonical, files.size(), excluded[0], failed[0]);
            return new ScanResult(canonical, files, stats);
        }

        // --- Métodos Auxiliares ---

        /**
         * Normaliza o root e valida que é um diretório legível.
         * Tenta {@code toRealPath()}; se falhar, o root não existe (ou não é acessível).
         */
        private Path validateRoot(Path root) throws ScanException {
            Path canonical;
            try {
                canonical = root.toRealPath();
            } catch (NoSuchFileException e) {
                throw new ScanException(root, "Diretório não encontrado: " + root, e);
            } catch (AccessDeniedException e) {
                throw new ScanException(root, "Sem permissão para acessar: " + root, e);
            } catch (IOException e) {
                throw new ScanException(root, "Caminho inválido: " + root + " (" + e.getMessage() + ")", e);
            }
            if (!Files.isDirectory(canonical)) {
                throw new ScanException(root, "Caminho não é um diretório válido: " + root);
            }
            if (!Files.isReadable(canonical)) {
                throw new ScanException(root, "Diretório não pode ser lido: " + root);
            }
            return canonical;
        }

        /**
         * Caminho relativo ao root com separador canônico '/'.
         */
        private static String normalizedRelative(Path root, Path file) {
            Path relative = root.relativize(file);
            String separator = relative.getFileSystem().getSeparator();
            String text = relative.toString();
            return "/".equals(separator) ? text : text.replace(separator, "/");
        }
    }
}
