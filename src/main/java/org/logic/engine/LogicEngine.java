package org.logic.engine;

import org.logic.errors.SatException;
import org.logic.errors.Stage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * MOTORE LOGICO - Registro esplicito dei sistemi logici
 *
 * Costruito una volta a partire da una {@link EngineConfiguration} e passato per
 * riferimento ai componenti che ne hanno bisogno. Registra il sistema classico e
 * il sistema SAT; altri sistemi possono essere aggiunti con {@link #register}.
 */
public class LogicEngine {

    private static final Logger LOGGER = Logger.getLogger(LogicEngine.class.getName());

    private final EngineConfiguration configuration;
    private final Map<String, LogicSystem> systems = new LinkedHashMap<>();

    public LogicEngine(EngineConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "Configurazione non può essere null");
        register(new ClassicalSystem(configuration));
        register(new SatSystem(configuration));
        LOGGER.fine(() -> "Motore logico inizializzato: " + configuration);
    }

    /**
     * Registra un sistema, sostituendo quello con lo stesso nome.
     */
    public void register(LogicSystem system) {
        Objects.requireNonNull(system, "Sistema non può essere null");
        systems.put(system.getName(), system);
    }

    public Optional<LogicSystem> findSystem(String name) {
        return Optional.ofNullable(systems.get(name));
    }

    /**
     * Sistema registrato con il nome e il tipo indicati.
     *
     * @throws SatException se nessun sistema di quel tipo è registrato con quel nome
     */
    public <T extends LogicSystem> T requireSystem(String name, Class<T> type) throws SatException {
        LogicSystem system = systems.get(name);
        if (!type.isInstance(system)) {
            throw new SatException(Stage.SOLVE, "requireSystem",
                    "percorso di risoluzione non disponibile: " + name);
        }
        return type.cast(system);
    }

    public ClassicalSystem classical() throws SatException {
        return requireSystem(ClassicalSystem.NAME, ClassicalSystem.class);
    }

    public SatSystem sat() throws SatException {
        return requireSystem(SatSystem.NAME, SatSystem.class);
    }

    public Map<String, LogicSystem> getSystems() {
        return Collections.unmodifiableMap(systems);
    }

    public EngineConfiguration getConfiguration() {
        return configuration;
    }
}
