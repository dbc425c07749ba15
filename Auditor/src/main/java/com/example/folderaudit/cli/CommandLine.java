package com.example.folderaudit.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import com.example.folderaudit.content.Content.ComparisonMode;

/**
 * Parsing dos argumentos de linha de comando.
 *
 * <pre>
 * compare &lt;pasta1&gt; &lt;pasta2&gt; [-o ARQ] [-w N] [--mode checksum|bytes] [-a] [--summary-json ARQ]
 * duplicates &lt;pasta&gt; [-o ARQ] [-w N] [-m BYTES] [--absolute-paths] [--summary-json ARQ]
 * </pre>
 */
public final class CommandLine {

    private CommandLine() {}

    public static final String DEFAULT_COMPARISON_OUTPUT = "comparison_results.csv";
    public static final String DEFAULT_DUPLICATES_OUTPUT = "duplicates.csv";

    public enum Command {
        COMPARE,
        DUPLICATES,
        HELP
    }

    /** Argumento inválido; a CLI mostra a mensagem + uso e sai com status 2. */
    public static final class UsageException extends Exception {
        private static final long serialVersionUID = 1L;

        public UsageException(String message) {
            super(message);
        }
    }

    /** Opções já validadas sintaticamente. A existência das pastas é checada depois. */
    public static final class CliOptions {
        private final Command command;
        private final List<Path> folders;
        private final Path output;
        private final Integer workers;
        private final ComparisonMode mode;
        private final boolean includeIdentical;
        private final long minSize;
        private final boolean absolutePaths;
        private final Path summaryJson;

        private CliOptions(Command command, List<Path> folders, Path output, Integer workers,
                           ComparisonMode mode, boolean includeIdentical, long minSize,
                           boolean absolutePaths, Path summaryJson) {
            this.command = command;
            this.folders = List.copyOf(folders);
            this.output = output;
            this.workers = workers;
            this.mode = mode;
            this.includeIdentical = includeIdentical;
            this.minSize = minSize;
            this.absolutePaths = absolutePaths;
            this.summaryJson = summaryJson;
        }

        static CliOptions help() {
            return new CliOptions(Command.HELP, List.of(), null, null, ComparisonMode.CHECKSUM, false, 0L, false, null);
        }

        public Command command() { return command; }
        public List<Path> folders() { return folders; }
        public Path output() { return output; }
        /** Vazio quando não informado: vale o valor do {@code AppConfig}. */
        public Optional<Integer> workers() { return Optional.ofNullable(workers); }
        public ComparisonMode mode() { return mode; }
        public boolean includeIdentical() { return includeIdentical; }
        public long minSize() { return minSize; }
        public boolean absolutePaths() { return absolutePaths; }
        public Optional<Path> summaryJson() { return Optional.ofNullable(summaryJson); }
    }

    public static CliOptions parse(String[] args) throws UsageException {
        Objects.requireNonNull(args, "args");
        if (args.length == 0) {
            throw new UsageException("Nenhum comando informado");
        }
        String first = args[0];
        if (first.equals("-h") || first.equals("--help") || first.equals("help")) {
            return CliOptions.help();
        }

        Command command;
        switch (first.toLowerCase(Locale.ROOT)) {
            case "compare":
                command = Command.COMPARE;
                break;
            case "duplicates":
            case "dupes":
                command = Command.DUPLICATES;
                break;
            default:
                throw new UsageException("Comando desconhecido: " + first);
        }

        List<Path> folders = new ArrayList<>();
        Path output = null;
        Integer workers = null;
        ComparisonMode mode = ComparisonMode.CHECKSUM;
        boolean includeIdentical = false;
        long minSize = 0L;
        boolean absolutePaths = false;
        Path summaryJson = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    return CliOptions.help();
                case "-o":
                case "--output":
                    output = Path.of(value(args, ++i, arg));
                    break;
                case "-w":
                case "--workers":
                    workers = parseInt(value(args, ++i, arg), arg);
                    if (workers < 1) {
                        throw new UsageException(arg + " deve ser >= 1: " + workers);
                    }
                    break;
                case "--summary-json":
                    summaryJson = Path.of(value(args, ++i, arg));
                    break;
                case "--mode":
                    requireCommand(command, Command.COMPARE, arg);
                    try {
                        mode = ComparisonMode.parse(value(args, ++i, arg));
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                    break;
                case "--bytes":
                    requireCommand(command, Command.COMPARE, arg);
                    mode = ComparisonMode.BYTES;
                    break;
                case "-a":
                case "--include-identical":
                    requireCommand(command, Command.COMPARE, arg);
                    includeIdentical = true;
                    break;
                case "-m":
                case "--min-size":
                    requireCommand(command, Command.DUPLICATES, arg);
                    minSize = parseLong(value(args, ++i, arg), arg);
                    if (minSize < 0) {
                        throw new UsageException(arg + " deve ser >= 0: " + minSize);
                    }
                    break;
                case "--absolute-paths":
                    requireCommand(command, Command.DUPLICATES, arg);
                    absolutePaths = true;
                    break;
                default:
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Opção desconhecida: " + arg);
                    }
                    folders.add(Path.of(arg));
            }
        }

        int expected = command == Command.COMPARE ? 2 : 1;
        if (folders.size() != expected) {
            throw new UsageException("'" + first + "' espera " + expected + " pasta(s), recebeu " + folders.size());
        }
        if (output == null) {
            output = Path.of(command == Command.COMPARE ? DEFAULT_COMPARISON_OUTPUT : DEFAULT_DUPLICATES_OUTPUT);
        }
        return new CliOptions(command, folders, output, workers, mode, includeIdentical, minSize, absolutePaths, summaryJson);
    }

    public static String usage() {
        String nl = System.lineSeparator();
        return "Uso:" + nl
                + "  compare <pasta1> <pasta2> [opções]" + nl
                + "      -o, --output ARQ           CSV de saída (padrão: " + DEFAULT_COMPARISON_OUTPUT + ")" + nl
                + "      -w, --workers N            threads de comparação (padrão: 8)" + nl
                + "      --mode checksum|bytes      verificação de conteúdo (padrão: checksum)" + nl
                + "      --bytes                    atalho para --mode bytes" + nl
                + "      -a, --include-identical    inclui arquivos idênticos no relatório" + nl
                + "      --summary-json ARQ         grava estatísticas da execução em JSON" + nl
                + "  duplicates <pasta> [opções]" + nl
                + "      -o, --output ARQ           CSV de saída (padrão: " + DEFAULT_DUPLICATES_OUTPUT + ")" + nl
                + "      -w, --workers N            threads de checksum (padrão: 8)" + nl
                + "      -m, --min-size BYTES       ignora arquivos menores (padrão: 0)" + nl
                + "      --absolute-paths           caminhos absolutos no CSV e no JSON" + nl
                + "      --summary-json ARQ         grava estatísticas da execução em JSON" + nl;
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException("Valor ausente para " + option);
        }
        return args[index];
    }

    private static void requireCommand(Command actual, Command expected, String option) throws UsageException {
        if (actual != expected) {
            throw new UsageException("Opção " + option + " não se aplica ao comando " + actual.name().toLowerCase(Locale.ROOT));
        }
    }

    private static int parseInt(String raw, String option) throws UsageException {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Valor inteiro inválido para " + option + ": " + raw);
        }
    }

    private static long parseLong(String raw, String option) throws UsageException {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Valor inteiro inválido para " + option + ": " + raw);
        }
    }
}
