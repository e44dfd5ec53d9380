package org.logic.engine;

import org.logic.cnf.CNFConverter;
import org.logic.expression.ExpressionParser;
import org.logic.sat.SolverType;
import org.logic.table.TruthTableGenerator;

import java.util.Objects;

/**
 * CONFIGURAZIONE DEL MOTORE - Parametri condivisi dai sistemi logici
 *
 * Costruita una volta e passata per riferimento a {@link LogicEngine}; le copie
 * modificate si ottengono con i metodi {@code with...}.
 *
 * @param cnfStrategy strategia di conversione CNF
 * @param solverType algoritmo di risoluzione SAT
 * @param maxNestingDepth annidamento massimo di parentesi e negazioni
 * @param maxTableVariables variabili massime in una tavola di verità
 * @param maxClauses clausole intermedie massime nella conversione per distribuzione
 * @param maxDecisions budget di decisioni del solutore, 0 = illimitato
 * @param restarts restart periodici, richiede CDCL
 * @param subsumption sussunzione delle clausole apprese a ogni restart, richiede CDCL
 */
public record EngineConfiguration(CnfStrategy cnfStrategy,
                                  SolverType solverType,
                                  int maxNestingDepth,
                                  int maxTableVariables,
                                  int maxClauses,
                                  long maxDecisions,
                                  boolean restarts,
                                  boolean subsumption) {

    public EngineConfiguration {
        Objects.requireNonNull(cnfStrategy, "Strategia CNF non può essere null");
        Objects.requireNonNull(solverType, "Tipo di solutore non può essere null");
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Annidamento massimo deve essere positivo: " + maxNestingDepth);
        }
        if (maxTableVariables < 0) {
            throw new IllegalArgumentException("Variabili massime non possono essere negative: " + maxTableVariables);
        }
        if (maxClauses < 1) {
            throw new IllegalArgumentException("Clausole massime devono essere positive: " + maxClauses);
        }
        if (maxDecisions < 0) {
            throw new IllegalArgumentException("Budget di decisioni non può essere negativo: " + maxDecisions);
        }
        if ((restarts || subsumption) && solverType != SolverType.CDCL) {
            throw new IllegalArgumentException("Restart e sussunzione richiedono il solutore CDCL");
        }
    }

    public static EngineConfiguration defaults() {
        return new EngineConfiguration(
                CnfStrategy.DISTRIBUTIVE,
                SolverType.DPLL,
                ExpressionParser.DEFAULT_MAX_NESTING_DEPTH,
                TruthTableGenerator.DEFAULT_MAX_VARIABLES,
                CNFConverter.DEFAULT_MAX_CLAUSES,
                0,
                false,
                false);
    }

    public EngineConfiguration withCnfStrategy(CnfStrategy strategy) {
        return new EngineConfiguration(strategy, solverType, maxNestingDepth,
                maxTableVariables, maxClauses, maxDecisions, restarts, subsumption);
    }

    /**
     * Tornando a DPLL restart e sussunzione vengono disattivati.
     */
    public EngineConfiguration withSolverType(SolverType type) {
        boolean cdcl = type == SolverType.CDCL;
        return new EngineConfiguration(cnfStrategy, type, maxNestingDepth,
                maxTableVariables, maxClauses, maxDecisions, cdcl && restarts, cdcl && subsumption);
    }

    public EngineConfiguration withMaxNestingDepth(int depth) {
        return new EngineConfiguration(cnfStrategy, solverType, depth,
                maxTableVariables, maxClauses, maxDecisions, restarts, subsumption);
    }

    public EngineConfiguration withMaxTableVariables(int variables) {
        return new EngineConfiguration(cnfStrategy, solverType, maxNestingDepth,
                variables, maxClauses, maxDecisions, restarts, subsumption);
    }

    public EngineConfiguration withMaxClauses(int clauses) {
        return new EngineConfiguration(cnfStrategy, solverType, maxNestingDepth,
                maxTableVariables, clauses, maxDecisions, restarts, subsumption);
    }

    public EngineConfiguration withMaxDecisions(long decisions) {
        return new EngineConfiguration(cnfStrategy, solverType, maxNestingDepth,
                maxTableVariables, maxClauses, decisions, restarts, subsumption);
    }

    public EngineConfiguration withRestarts(boolean enabled) {
        return new EngineConfiguration(cnfStrategy, solverType, maxNestingDepth,
                maxTableVariables, maxClauses, maxDecisions, enabled, subsumption);
    }

    public EngineConfiguration withSubsumption(boolean enabled) {
        return new EngineConfiguration(cnfStrategy, solverType, maxNestingDepth,
                maxTableVariables, maxClauses, maxDecisions, restarts, enabled);
    }
}
