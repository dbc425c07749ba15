package com.example.folderaudit.config;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Configuração imutável do motor de comparação/detecção.
 *
 * Criada uma vez por execução (via {@link AppConfig#toEngineConfig()} ou {@link #builder()})
 * e repassada explicitamente aos componentes. Nenhum componente lê estado global.
 */
public final class EngineConfig {

    public static final int DEFAULT_WORKERS = 8;
    public static final int DEFAULT_READ_BUFFER_SIZE = 1024 * 1024; // 1 MiB
    public static final int MIN_READ_BUFFER_SIZE = 4 * 1024;
    public static final String DEFAULT_HASH_ALGORITHM = "SHA-256";
    public static final int DEFAULT_PROGRESS_INTERVAL = 500;
    public static final Set<String> DEFAULT_EXCLUDED_NAMES = Set.of(".DS_Store");
    public static final Set<String> DEFAULT_EXCLUDED_PREFIXES = Set.of("._");

    private final int workerCount;
    private final int readBufferSize;
    private final String hashAlgorithm;
    private final Set<String> excludedNames;
    private final Set<String> excludedPrefixes;
    private final int progressInterval;

    private EngineConfig(Builder b) {
        this.workerCount = b.workerCount;
        this.readBufferSize = b.readBufferSize;
        this.hashAlgorithm = b.hashAlgorithm;
        this.excludedNames = Set.copyOf(b.excludedNames);
        this.excludedPrefixes = Set.copyOf(b.excludedPrefixes);
        this.progressInterval = b.progressInterval;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copia os valores atuais para um novo builder (ex.: aplicar overrides da CLI). */
    public Builder toBuilder() {
        return new Builder()
                .workerCount(workerCount)
                .readBufferSize(readBufferSize)
                .hashAlgorithm(hashAlgorithm)
                .excludedNames(excludedNames)
                .excludedPrefixes(excludedPrefixes)
                .progressInterval(progressInterval);
    }

    public int workerCount() { return workerCount; }
    public int readBufferSize() { return readBufferSize; }
    public String hashAlgorithm() { return hashAlgorithm; }
    public Set<String> excludedNames() { return excludedNames; }
    public Set<String> excludedPrefixes() { return excludedPrefixes; }
    public int progressInterval() { return progressInterval; }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "workers=" + workerCount +
                ", readBuffer=" + readBufferSize +
                ", hash=" + hashAlgorithm +
                ", excludedNames=" + excludedNames +
                ", excludedPrefixes=" + excludedPrefixes +
                ", progressInterval=" + progressInterval +
                "}";
    }

    public static final class Builder {
        private int workerCount = DEFAULT_WORKERS;
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
        private String hashAlgorithm = DEFAULT_HASH_ALGORITHM;
        private final Set<String> excludedNames = new LinkedHashSet<>(DEFAULT_EXCLUDED_NAMES);
        private final Set<String> excludedPrefixes = new LinkedHashSet<>(DEFAULT_EXCLUDED_PREFIXES);
        private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

        private Builder() {}

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder hashAlgorithm(String hashAlgorithm) {
            this.hashAlgorithm = hashAlgorithm;
            return this;
        }

        /** Substitui o conjunto de nomes exatos excluídos. */
        public Builder excludedNames(Set<String> names) {
            Objects.requireNonNull(names, "names");
            this.excludedNames.clear();
            names.stream().filter(n -> n != null && !n.isBlank()).forEach(this.excludedNames::add);
            return this;
        }

        /** Substitui o conjunto de prefixos excluídos. */
        public Builder excludedPrefixes(Set<String> prefixes) {
            Objects.requireNonNull(prefixes, "prefixes");
            this.excludedPrefixes.clear();
            prefixes.stream().filter(p -> p != null && !p.isBlank()).forEach(this.excludedPrefixes::add);
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            this.progressInterval = progressInterval;
            return this;
        }

        /**
         * Valida e constrói. Falha cedo: workers < 1, buffer pequeno demais
         * ou algoritmo de hash indisponível na JVM.
         */
        public EngineConfig build() {
            if (workerCount < 1) {
                throw new IllegalArgumentException("workerCount deve ser >= 1: " + workerCount);
            }
            if (readBufferSize < MIN_READ_BUFFER_SIZE) {
                throw new IllegalArgumentException("readBufferSize deve ser >= " + MIN_READ_BUFFER_SIZE + ": " + readBufferSize);
            }
            if (progressInterval < 1) {
                throw new IllegalArgumentException("progressInterval deve ser >= 1: " + progressInterval);
            }
            if (hashAlgorithm == null || hashAlgorithm.isBlank()) {
                throw new IllegalArgumentException("hashAlgorithm é obrigatório");
            }
            try {
                MessageDigest.getInstance(hashAlgorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalArgumentException("Algoritmo de hash indisponível no sistema: " + hashAlgorithm, e);
            }
            return new EngineConfig(this);
        }
    }
}
