package com.loadspec.cli;

import com.loadspec.cli.ui.Spinner;
import com.loadspec.dto.response.CommandResponse;
import com.loadspec.exception.AiErrorType;
import com.loadspec.model.backend.ErrorStatistics;
import com.loadspec.model.backend.ServiceHealth;
import com.loadspec.service.api.AiBackend;
import com.loadspec.service.backend.OllamaBackend;
import java.util.List;
import java.util.Map;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;

/**
 * Reports on the configured AI backend.
 */
@ShellComponent
public class BackendCommand {

    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_YELLOW = "\u001B[33m";

    private final AiBackend backend;
    private final Spinner spinner;

    public BackendCommand(AiBackend backend, Spinner spinner) {
        this.backend = backend;
        this.spinner = spinner;
    }

    @ShellMethod(key = "backend-status", value = "Show readiness, health and error statistics of the AI backend.")
    public void status() {
        boolean reachable = spinner.spin("Checking " + backend.name() + "...", backend::healthCheck);
        System.out.println(new CommandResponse(reachable,
                "Backend '" + backend.name() + "' is " + (reachable ? "reachable" : "unreachable")
                        + (backend.isReady() ? " and ready" : " and not initialized"),
                reachable ? List.of() : List.of(AiErrorType.CONNECTION_FAILED.degradationHint(),
                        "Use 'parse --fallback-only' until the backend is back")).toAnsiString());

        if (backend instanceof OllamaBackend ollama) {
            ServiceHealth health = ollama.serviceHealth();
            System.out.println(ANSI_CYAN + "Connections: " + health.activeConnections() + " active, "
                    + health.queuedRequests() + " queued" + ANSI_RESET);
            System.out.println(ANSI_CYAN + "Last health check: "
                    + (health.lastCheck() == null ? "never" : health.lastCheck()) + ANSI_RESET);
        }

        ErrorStatistics statistics = backend.errorStatistics();
        if (statistics.total() == 0) {
            System.out.println("No backend errors recorded.");
            return;
        }
        System.out.println("Errors (" + statistics.total() + " total):");
        for (Map.Entry<AiErrorType, Long> entry : statistics.counts().entrySet()) {
            System.out.println("  " + ANSI_YELLOW + entry.getKey() + ": " + entry.getValue() + ANSI_RESET
                    + " (last at " + statistics.lastOccurrence().get(entry.getKey()) + ")");
        }
        statistics.recentErrors().stream()
                .skip(Math.max(0, statistics.recentErrors().size() - 5))
                .forEach(error -> System.out.println("  - " + error));
    }
}
