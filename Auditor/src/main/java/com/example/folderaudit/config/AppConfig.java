package com.example.folderaudit.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * AppConfig
 * ----------
 * Responsável por carregar, validar e expor configurações da ferramenta.
 *
 * PRINCÍPIOS:
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Métodos tipados com limites (int/KB) e fallback para o padrão quando o valor é inválido.
 * - O motor nunca lê daqui diretamente: {@link #toEngineConfig()} gera um {@link EngineConfig} imutável.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Número de threads do pool de comparação/checksum. Padrão 8. */
    public static final String WORKERS = "FOLDER_AUDIT_WORKERS";
    /** Tamanho do buffer de leitura em KB. Padrão 1024 (1 MiB). */
    public static final String READ_BUFFER_KB = "FOLDER_AUDIT_READ_BUFFER_KB";
    /** Algoritmo de hash (nome aceito por MessageDigest). Padrão SHA-256. */
    public static final String HASH_ALGORITHM = "FOLDER_AUDIT_HASH_ALGORITHM";
    /** Nomes exatos excluídos, separados por vírgula. Padrão ".DS_Store". */
    public static final String EXCLUDED_NAMES = "FOLDER_AUDIT_EXCLUDED_NAMES";
    /** Prefixos excluídos, separados por vírgula. Padrão "._". */
    public static final String EXCLUDED_PREFIXES = "FOLDER_AUDIT_EXCLUDED_PREFIXES";
    /** A cada quantas tarefas concluídas o progresso é logado. Padrão 500. */
    public static final String PROGRESS_INTERVAL = "FOLDER_AUDIT_PROGRESS_INTERVAL";

    // ======= ARMAZENAMENTO INTERNO =======

    /** Overrides em runtime (ex.: testes). Têm precedência sobre qualquer fonte. */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados (System properties > ENV > .env). */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes, com a seguinte precedência:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (System.getenv)
     * 3) Arquivo .env no diretório atual (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        // 3) .env (menor prioridade)
        dotenv.entries().forEach(e -> map.put(e.getKey(), e.getValue()));

        // 2) Variáveis de ambiente
        map.putAll(System.getenv());

        // 1) System properties (maior prioridade)
        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Mesma regra dos valores carregados: o valor é
     * aparado e null ou branco remove o override.
     */
    public void override(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null || value.isBlank()) {
            overrides.remove(key);
        } else {
            overrides.put(key, value.trim());
        }
    }

    // ======= GETTERS ESPECÍFICOS =======

    /** Workers do pool. Limites: [1, 256]. */
    public int workers() {
        return intConfig(WORKERS, EngineConfig.DEFAULT_WORKERS, 1, 256);
    }

    /** Buffer de leitura em bytes. Limites: [4 KB, 64 MB]. */
    public int readBufferBytes() {
        int kb = intConfig(READ_BUFFER_KB, EngineConfig.DEFAULT_READ_BUFFER_SIZE / 1024, 4, 64 * 1024);
        return kb * 1024;
    }

    public String hashAlgorithm() {
        return getOrDefault(HASH_ALGORITHM, EngineConfig.DEFAULT_HASH_ALGORITHM);
    }

    public Set<String> excludedNames() {
        return find(EXCLUDED_NAMES).map(AppConfig::splitList).orElse(EngineConfig.DEFAULT_EXCLUDED_NAMES);
    }

    public Set<String> excludedPrefixes() {
        return find(EXCLUDED_PREFIXES).map(AppConfig::splitList).orElse(EngineConfig.DEFAULT_EXCLUDED_PREFIXES);
    }

    /** Intervalo de progresso. Limites: [1, Integer.MAX_VALUE]. */
    public int progressInterval() {
        return intConfig(PROGRESS_INTERVAL, EngineConfig.DEFAULT_PROGRESS_INTERVAL, 1, Integer.MAX_VALUE);
    }

    /**
     * Congela a configuração atual num {@link EngineConfig} imutável.
     *
     * @throws IllegalArgumentException se o algoritmo de hash configurado não existir na JVM
     */
    public EngineConfig toEngineConfig() {
        return EngineConfig.builder()
                .workerCount(workers())
                .readBufferSize(readBufferBytes())
                .hashAlgorithm(hashAlgorithm())
                .excludedNames(excludedNames())
                .excludedPrefixes(excludedPrefixes())
                .progressInterval(progressInterval())
                .build();
    }

    // ======= HELPERS TIPADOS =======

    private static Set<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "workers=" + workers() +
                ", readBufferKB=" + readBufferBytes() / 1024 +
                ", hash=" + hashAlgorithm() +
                ", excludedNames=" + excludedNames() +
                ", excludedPrefixes=" + excludedPrefixes() +
                ", progressInterval=" + progressInterval() +
                "}";
    }
}
