package org.logic;

import org.logic.cnf.CNFFormula;
import org.logic.cnf.DimacsConverter;
import org.logic.engine.CnfStrategy;
import org.logic.engine.EngineConfiguration;
import org.logic.engine.LogicEngine;
import org.logic.engine.SatSystem;
import org.logic.errors.LogicException;
import org.logic.sat.SolverResult;
import org.logic.sat.SolverType;
import org.logic.table.TruthTable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * SOLUTORE LOGICO - Interfaccia a riga di comando
 *
 * MODALITÀ OPERATIVE:
 * - Valutazione (-e): valore di una formula con l'assegnamento dato da -v
 * - Tavola di verità (-tt): tavola completa della formula
 * - Classificazione (-c): tautologia, contraddizione o contingenza
 * - Conversione (-cnf): forma normale congiuntiva, in DIMACS con -dimacs
 * - Soddisfacibilità (-sat): modello o UNSAT
 * - File (-f): soddisfacibilità di ogni riga di un file .txt, o di un file DIMACS .cnf
 *
 * OPZIONI:
 * - -solver dpll|cdcl: algoritmo di risoluzione (default dpll)
 * - -opt=<flags>: t=Tseitin, r=restart, s=sussunzione, all=tutte; r e s attivano CDCL
 * - -t secondi: timeout della risoluzione SAT
 * - -depth n: annidamento massimo delle formule
 * - -budget n: numero massimo di decisioni del solutore
 *
 * Uscita su console con prefissi [I] informazione, [W] avviso, [E] errore.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String EVAL_PARAM = "-e";
    private static final String VALUES_PARAM = "-v";
    private static final String TABLE_PARAM = "-tt";
    private static final String CLASSIFY_PARAM = "-c";
    private static final String CNF_PARAM = "-cnf";
    private static final String DIMACS_PARAM = "-dimacs";
    private static final String SAT_PARAM = "-sat";
    private static final String FILE_PARAM = "-f";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String DEPTH_PARAM = "-depth";
    private static final String BUDGET_PARAM = "-budget";
    private static final String SOLVER_PARAM = "-solver";
    private static final String OPT_PARAM = "-opt=";

    private static final String OPT_TSEITIN = "t";
    private static final String OPT_RESTART = "r";
    private static final String OPT_SUBSUMPTION = "s";
    private static final String OPT_ALL = "all";
    private static final String OPT_CHARACTERS = OPT_TSEITIN + OPT_RESTART + OPT_SUBSUMPTION;

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /** Righe dei file di formule che iniziano con questo carattere sono commenti. */
    private static final String COMMENT_PREFIX = "#";

    private enum Mode {
        EVALUATE, TABLE, CLASSIFY, CNF, SAT, FILE
    }

    //endregion

    private Main() {
    }

    //region PUNTO PRINCIPALE

    /**
     * Punto principale: parsing dei parametri, costruzione del motore ed esecuzione
     * della modalità richiesta.
     *
     * @param args parametri linea di comando
     */
    public static void main(String[] args) {
        configureLogging();

        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            System.exit(2);
            return;
        }

        CliConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] " + e.getMessage());
            System.exit(2);
            return;
        }
        if (config == null) {
            return; // Help mostrato
        }

        LogicEngine engine = new LogicEngine(config.engineConfiguration);
        int exitCode;
        try {
            exitCode = executeMode(engine, config);
        } catch (LogicException e) {
            LOGGER.warning("Elaborazione fallita: " + e.getMessage());
            System.out.println("[E] " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            System.out.println("[E] Errore di lettura: " + e.getMessage());
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    private static void configureLogging() {
        try (InputStream stream = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (stream != null) {
                LogManager.getLogManager().readConfiguration(stream);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione del logging non caricata: " + e.getMessage());
        }
    }

    private static int executeMode(LogicEngine engine, CliConfiguration config) throws LogicException, IOException {
        if (config.mode == Mode.SAT || config.mode == Mode.FILE) {
            EngineConfiguration configuration = config.engineConfiguration;
            System.out.println(String.format("[I] Solutore %s, CNF %s, restart=%s, sussunzione=%s",
                    configuration.solverType(), configuration.cnfStrategy(),
                    configuration.restarts(), configuration.subsumption()));
        }
        return switch (config.mode) {
            case EVALUATE -> {
                boolean value = engine.classical().evaluateExpression(config.argument, config.assignment);
                System.out.println("[I] " + config.argument + " = " + (value ? "T" : "F"));
                yield 0;
            }
            case TABLE -> {
                TruthTable table = engine.classical().generateTruthTableFromExpression(config.argument, null);
                System.out.print(table);
                yield 0;
            }
            case CLASSIFY -> {
                System.out.println("[I] " + engine.classical().classify(null, config.argument));
                yield 0;
            }
            case CNF -> {
                CNFFormula formula = engine.sat().convertToCnf(config.argument);
                System.out.print(config.dimacsOutput
                        ? new DimacsConverter().write(formula)
                        : formula + System.lineSeparator());
                yield 0;
            }
            case SAT -> {
                SatSystem sat = engine.sat();
                yield report(config.argument, solveWithTimeout(() -> sat.solveExpression(config.argument), config));
            }
            case FILE -> processFile(engine, config);
        };
    }

    //endregion

    //region ELABORAZIONE FILE

    /**
     * File .cnf: una formula DIMACS. Altri file: una formula per riga,
     * righe vuote e commenti ignorati.
     *
     * @return 0 se tutte le formule sono state risolte, 1 altrimenti
     */
    private static int processFile(LogicEngine engine, CliConfiguration config) throws LogicException, IOException {
        Path path = Paths.get(config.argument);
        SatSystem sat = engine.sat();

        if (path.toString().toLowerCase(Locale.ROOT).endsWith(".cnf")) {
            CNFFormula formula;
            try {
                formula = new DimacsConverter().read(Files.readString(path, StandardCharsets.UTF_8));
            } catch (IllegalArgumentException e) {
                System.out.println("[E] File DIMACS non valido: " + e.getMessage());
                return 1;
            }
            return report(path.getFileName().toString(), solveWithTimeout(() -> sat.solve(formula), config));
        }

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        int failures = 0;
        int processed = 0;
        for (String line : lines) {
            String formula = line.trim();
            if (formula.isEmpty() || formula.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            processed++;
            try {
                failures += report(formula, solveWithTimeout(() -> sat.solveExpression(formula), config));
            } catch (LogicException e) {
                System.out.println("[E] " + formula + ": " + e.getMessage());
                failures++;
            }
        }
        System.out.println(String.format("[I] Formule elaborate: %d, fallite: %d", processed, failures));
        return failures == 0 ? 0 : 1;
    }

    //endregion

    //region RISOLUZIONE CON TIMEOUT

    /**
     * Esegue la risoluzione su un thread dedicato. Allo scadere del timeout il thread
     * viene interrotto e il solutore termina alla decisione successiva.
     *
     * @return risultato, null se il timeout è scaduto
     */
    private static SolverResult solveWithTimeout(Callable<SolverResult> task, CliConfiguration config)
            throws LogicException {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SolverResult> future = executor.submit(task);
            return future.get(config.timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            System.out.println("[W] Timeout raggiunto dopo " + config.timeoutSeconds + " secondi");
            return null;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LogicException logicException) {
                throw logicException;
            }
            throw new IllegalStateException("Errore nella risoluzione SAT", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Risoluzione SAT interrotta", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static int report(String label, SolverResult result) {
        if (result == null) {
            return 1;
        }
        System.out.println("[I] " + label + ": " + result.toCompactString());
        System.out.println("[I] " + result.getStatistics());
        return 0;
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("""
                Uso: java -jar solutore-logico.jar <modalità> [opzioni]

                Modalità:
                  -e <formula> -v A=1,B=0   valuta la formula con l'assegnamento dato
                  -tt <formula>             stampa la tavola di verità
                  -c <formula>              tautologia, contraddizione o contingenza
                  -cnf <formula> [-dimacs]  forma normale congiuntiva
                  -sat <formula>            soddisfacibilità e modello
                  -f <file>                 soddisfacibilità di ogni riga (.txt) o di un file DIMACS (.cnf)

                Opzioni:
                  -solver <dpll|cdcl>       algoritmo di risoluzione (default dpll)
                  -opt=<flags>              ottimizzazioni: t=Tseitin, r=restart, s=sussunzione, all=tutte
                                            r e s richiedono CDCL, che diventa il default
                  -t <secondi>              timeout della risoluzione (default 10)
                  -depth <n>                annidamento massimo delle formule
                  -budget <n>               numero massimo di decisioni del solutore
                  -h                        mostra questo messaggio

                Operatori: ! & | ^ -> <->, ¬ ∧ ∨ ⊕ → ↔, not and or xor nand nor implies iff
                """);
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Parametri validati della linea di comando.
     */
    private static final class CliConfiguration {
        final Mode mode;
        final String argument;
        final Map<String, Boolean> assignment;
        final boolean dimacsOutput;
        final int timeoutSeconds;
        final EngineConfiguration engineConfiguration;

        CliConfiguration(Mode mode, String argument, Map<String, Boolean> assignment, boolean dimacsOutput,
                         int timeoutSeconds, EngineConfiguration engineConfiguration) {
            this.mode = mode;
            this.argument = argument;
            this.assignment = assignment;
            this.dimacsOutput = dimacsOutput;
            this.timeoutSeconds = timeoutSeconds;
            this.engineConfiguration = engineConfiguration;
        }
    }

    private record OptimizationFlags(boolean tseitin, boolean restart, boolean subsumption) {
    }

    /**
     * Parser dei parametri: una sola modalità per invocazione, opzioni in qualsiasi ordine.
     */
    private static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri sono incompleti o incoerenti
         */
        CliConfiguration parse(String[] args) {
            Mode mode = null;
            String argument = null;
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            boolean dimacsOutput = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            EngineConfiguration engineConfiguration = EngineConfiguration.defaults();
            SolverType solverType = null;
            OptimizationFlags optimizations = new OptimizationFlags(false, false, false);

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case EVAL_PARAM, TABLE_PARAM, CLASSIFY_PARAM, CNF_PARAM, SAT_PARAM, FILE_PARAM -> {
                        if (mode != null) {
                            throw new IllegalArgumentException("Una sola modalità per invocazione: " + args[i]);
                        }
                        mode = modeOf(args[i]);
                        argument = nextArgument(args, ++i, args[i - 1]);
                    }
                    case VALUES_PARAM -> assignment = parseAssignment(nextArgument(args, ++i, VALUES_PARAM));
                    case DIMACS_PARAM -> dimacsOutput = true;
                    case TIMEOUT_PARAM -> {
                        timeoutSeconds = parsePositive(nextArgument(args, ++i, TIMEOUT_PARAM), TIMEOUT_PARAM);
                        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
                            throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + "s");
                        }
                    }
                    case DEPTH_PARAM -> engineConfiguration = engineConfiguration.withMaxNestingDepth(
                            parsePositive(nextArgument(args, ++i, DEPTH_PARAM), DEPTH_PARAM));
                    case BUDGET_PARAM -> engineConfiguration = engineConfiguration.withMaxDecisions(
                            parsePositive(nextArgument(args, ++i, BUDGET_PARAM), BUDGET_PARAM));
                    case SOLVER_PARAM -> solverType = SolverType.fromName(nextArgument(args, ++i, SOLVER_PARAM));
                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            optimizations = parseOptionalFlags(args[i].substring(OPT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Nessuna modalità specificata. Usa -h per l'help.");
            }
            engineConfiguration = applyOptimizations(engineConfiguration, solverType, optimizations);
            if (mode == Mode.FILE && !Files.isRegularFile(Paths.get(argument))) {
                throw new IllegalArgumentException("File non trovato: " + argument);
            }
            return new CliConfiguration(mode, argument, assignment, dimacsOutput, timeoutSeconds, engineConfiguration);
        }

        /**
         * Ogni carattere attiva un'ottimizzazione; {@code all} le attiva tutte.
         */
        private static OptimizationFlags parseOptionalFlags(String flags) {
            if (flags.isBlank()) {
                throw new IllegalArgumentException("Valore -opt vuoto");
            }
            if (flags.equals(OPT_ALL)) {
                return new OptimizationFlags(true, true, true);
            }
            for (char flag : flags.toCharArray()) {
                if (OPT_CHARACTERS.indexOf(flag) < 0) {
                    throw new IllegalArgumentException("Ottimizzazione sconosciuta: " + flag);
                }
            }
            return new OptimizationFlags(flags.contains(OPT_TSEITIN),
                    flags.contains(OPT_RESTART), flags.contains(OPT_SUBSUMPTION));
        }

        /**
         * Restart e sussunzione senza {@code -solver} scelgono CDCL; con {@code -solver dpll} sono un errore.
         */
        private static EngineConfiguration applyOptimizations(EngineConfiguration configuration,
                                                              SolverType solverType, OptimizationFlags flags) {
            boolean needsCdcl = flags.restart() || flags.subsumption();
            SolverType type = solverType != null ? solverType : needsCdcl ? SolverType.CDCL : SolverType.DPLL;
            if (needsCdcl && type != SolverType.CDCL) {
                throw new IllegalArgumentException("Le ottimizzazioni r e s richiedono -solver cdcl");
            }
            EngineConfiguration result = configuration.withSolverType(type)
                    .withRestarts(flags.restart())
                    .withSubsumption(flags.subsumption());
            return flags.tseitin() ? result.withCnfStrategy(CnfStrategy.TSEITIN) : result;
        }

        private static Mode modeOf(String param) {
            return switch (param) {
                case EVAL_PARAM -> Mode.EVALUATE;
                case TABLE_PARAM -> Mode.TABLE;
                case CLASSIFY_PARAM -> Mode.CLASSIFY;
                case CNF_PARAM -> Mode.CNF;
                case SAT_PARAM -> Mode.SAT;
                case FILE_PARAM -> Mode.FILE;
                default -> throw new IllegalArgumentException("Modalità sconosciuta: " + param);
            };
        }

        private static String nextArgument(String[] args, int index, String param) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per " + param);
            }
            return args[index];
        }

        private static int parsePositive(String value, String param) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new IllegalArgumentException("Valore di " + param + " deve essere positivo: " + value);
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore non numerico per " + param + ": " + value, e);
            }
        }

        /**
         * Formato {@code A=1,B=false,C=T}; i valori accettano le stesse costanti delle formule.
         */
        static Map<String, Boolean> parseAssignment(String text) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (String pair : text.split(",")) {
                String[] parts = pair.split("=", 2);
                if (parts.length != 2 || parts[0].isBlank()) {
                    throw new IllegalArgumentException("Assegnamento malformato: " + pair);
                }
                String value = parts[1].trim().toLowerCase(Locale.ROOT);
                switch (value) {
                    case "1", "t", "true" -> assignment.put(parts[0].trim(), true);
                    case "0", "f", "false" -> assignment.put(parts[0].trim(), false);
                    default -> throw new IllegalArgumentException("Valore booleano non valido: " + parts[1]);
                }
            }
            return assignment;
        }
    }

    //endregion
}
