package com.example.folderaudit.content;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

import com.example.folderaudit.config.EngineConfig;

/**
 * Agrega os testes de equivalência de conteúdo entre arquivos.
 * <p>
 * Inclui:
 * 1. ChecksumEngine: digest criptográfico do conteúdo completo, lido em blocos.
 * 2. ByteComparator: comparação direta byte a byte com saída antecipada.
 * 3. ContentComparator: contrato comum usado pelo pipeline de comparação.
 * <p>
 * Todos leem em blocos de tamanho fixo; a memória por operação não depende do tamanho do arquivo.
 */
public final class Content {

    private Content() {}

    /** Modo de verificação de conteúdo para arquivos de mesmo tamanho. */
    public enum ComparisonMode {
        CHECKSUM,
        BYTES;

        /** Aceita "checksum"/"bytes" (case-insensitive). */
        public static ComparisonMode parse(String raw) {
            Objects.requireNonNull(raw, "raw");
            switch (raw.trim().toLowerCase(Locale.ROOT)) {
                case "checksum":
                case "hash":
                    return CHECKSUM;
                case "bytes":
                case "byte":
                    return BYTES;
                default:
                    throw new IllegalArgumentException("Modo de comparação inválido: " + raw + " (use 'checksum' ou 'bytes')");
            }
        }
    }

    /**
     * Falha ao abrir ou ler um arquivo específico. Recuperável: o chamador converte
     * em resultado "desconhecido" para aquele arquivo/par, sem abortar o lote.
     */
    public static final class ContentReadException extends IOException {
        private static final long serialVersionUID = 1L;

        private final Path path;

        public ContentReadException(Path path, String message, Throwable cause) {
            super(message + ": " + path, cause);
            this.path = path;
        }

        public ContentReadException(Path path, String message) {
            super(message + ": " + path);
            this.path = path;
        }

        public Path path() { return path; }
    }

    /**
     * Calcula o digest do conteúdo completo de um arquivo.
     */
    public interface ChecksumEngine {

        /**
         * @return digest em hexadecimal minúsculo
         * @throws ContentReadException se o arquivo não puder ser aberto ou a leitura falhar no meio
         */
        String checksum(Path path) throws ContentReadException;

        /** Nome do algoritmo; digests de algoritmos diferentes não são comparáveis. */
        String algorithm();
    }

    /**
     * {@link ChecksumEngine} baseado em {@link MessageDigest}, alimentado em blocos
     * de {@link EngineConfig#readBufferSize()} bytes.
     * <p>
     * Thread-safe: cada chamada cria seu próprio digest e buffer.
     */
    public static final class StreamingChecksumEngine implements ChecksumEngine {

        private static final HexFormat HEX = HexFormat.of();

        private final String algorithm;
        private final int bufferSize;

        public StreamingChecksumEngine(EngineConfig config) {
            this(config.hashAlgorithm(), config.readBufferSize());
        }

        public StreamingChecksumEngine(String algorithm, int bufferSize) {
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("bufferSize deve ser > 0");
            }
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            this.bufferSize = bufferSize;
            newDigest(); // falha cedo se o algoritmo não existir
        }

        @Override
        public String checksum(Path path) throws ContentReadException {
            Objects.requireNonNull(path, "path");
            MessageDigest digest = newDigest();
            byte[] buffer = new byte[bufferSize];
            try (InputStream in = Files.newInputStream(path)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    digest.update(buffer, 0, read);
                }
            } catch (IOException e) {
                throw new ContentReadException(path, "Falha ao calcular checksum", e);
            }
            return HEX.formatHex(digest.digest());
        }

        @Override
        public String algorithm() {
            return algorithm;
        }

        private MessageDigest newDigest() {
            try {
                return MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalArgumentException("Algoritmo de hash indisponível no sistema: " + algorithm, e);
            }
        }
    }

    /**
     * Decide se dois arquivos de mesmo tamanho (segundo o scan) têm o mesmo conteúdo.
     */
    public interface ContentComparator {

        boolean sameContent(Path a, Path b) throws ContentReadException;

        ComparisonMode mode();
    }

    /**
     * Comparação byte a byte.
     * <p>
     * Compara tamanhos primeiro (stat, sem abrir os arquivos). Se iguais, lê os dois em
     * passo sincronizado com blocos do mesmo tamanho e para no primeiro bloco diferente.
     */
    public static final class ByteComparator implements ContentComparator {

        private final int bufferSize;

        public ByteComparator(EngineConfig config) {
            this(config.readBufferSize());
        }

        public ByteComparator(int bufferSize) {
            if (bufferSize <= 0) {
                throw new IllegalArgumentException("bufferSize deve ser > 0");
            }
            this.bufferSize = bufferSize;
        }

        @Override
        public boolean sameContent(Path a, Path b) throws ContentReadException {
            return bytesEqual(a, b);
        }

        @Override
        public ComparisonMode mode() {
            return ComparisonMode.BYTES;
        }

        /**
         * @return true somente se todos os blocos forem iguais e os dois streams
         *         terminarem juntos
         */
        public boolean bytesEqual(Path a, Path b) throws ContentReadException {
            Objects.requireNonNull(a, "a");
            Objects.requireNonNull(b, "b");
            if (size(a) != size(b)) {
                return false;
            }

            byte[] bufA = new byte[bufferSize];
            byte[] bufB = new byte[bufferSize];
            try (InputStream inA = open(a); InputStream inB = open(b)) {
                while (true) {
                    int readA = fill(inA, bufA, a);
                    int readB = fill(inB, bufB, b);
                    if (readA != readB) {
                        // Um dos arquivos terminou antes (mudou depois do stat)
                        return false;
                    }
                    if (readA == 0) {
                        return true;
                    }
                    if (!Arrays.equals(bufA, 0, readA, bufB, 0, readB)) {
                        return false;
                    }
                }
            } catch (ContentReadException e) {
                throw e;
            } catch (IOException e) {
                // close() falhou
                throw new ContentReadException(a, "Falha ao fechar arquivos comparados com " + b, e);
            }
        }

        private static long size(Path path) throws ContentReadException {
            try {
                return Files.size(path);
            } catch (IOException e) {
                throw new ContentReadException(path, "Falha ao obter tamanho", e);
            }
        }

        private static InputStream open(Path path) throws ContentReadException {
            try {
                return Files.newInputStream(path);
            } catch (IOException e) {
                throw new ContentReadException(path, "Falha ao abrir arquivo", e);
            }
        }

        /** Lê até encher o buffer ou chegar ao EOF; 0 significa EOF. */
        private static int fill(InputStream in, byte[] buffer, Path path) throws ContentReadException {
            try {
                return in.readNBytes(buffer, 0, buffer.length);
            } catch (IOException e) {
                throw new ContentReadException(path, "Falha de leitura", e);
            }
        }
    }

    /**
     * Comparação via checksum: calcula o digest dos dois lados e compara.
     */
    public static final class ChecksumComparator implements ContentComparator {

        private final ChecksumEngine engine;

        public ChecksumComparator(ChecksumEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        @Override
        public boolean sameContent(Path a, Path b) throws ContentReadException {
            String digestA = engine.checksum(a);
            String digestB = engine.checksum(b);
            return digestA.equals(digestB);
        }

        @Override
        public ComparisonMode mode() {
            return ComparisonMode.CHECKSUM;
        }
    }

    /**
     * Confirma que o arquivo ainda existe com o tamanho visto no scan. Chamado depois de
     * ler o conteúdo: mudança ou sumiço entre o scan e a leitura vira erro de leitura.
     */
    public static void verifyUnchanged(Path path, long expectedSize) throws ContentReadException {
        Objects.requireNonNull(path, "path");
        long current;
        try {
            current = Files.size(path);
        } catch (IOException e) {
            throw new ContentReadException(path, "Arquivo sumiu desde o scan", e);
        }
        if (current != expectedSize) {
            throw new ContentReadException(path,
                    "Arquivo alterado desde o scan (" + expectedSize + " -> " + current + " bytes)");
        }
    }

    /** Cria o comparador correspondente ao modo escolhido. */
    public static ContentComparator comparatorFor(ComparisonMode mode, EngineConfig config) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(config, "config");
        return mode == ComparisonMode.BYTES
                ? new ByteComparator(config)
                : new ChecksumComparator(new StreamingChecksumEngine(config));
    }
}
