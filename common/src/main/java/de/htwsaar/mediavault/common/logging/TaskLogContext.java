package de.htwsaar.mediavault.common.logging;

import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Logging-Kontext für die Verarbeitung eines einzelnen Download-Tasks.
 * Die Task-Kennung wird für die Dauer der Verarbeitung im MDC abgelegt, sodass sie
 * automatisch in allen Logeinträgen des Worker-Threads enthalten ist.
 */
public final class TaskLogContext {

    /** Schlüsselname der Task-Kennung im Logging-Kontext */
    public static final String TASK_KEY = "task";

    private TaskLogContext() {}

    /**
     * Führt {@code action} mit gesetzter Task-Kennung aus.
     *
     * @param taskId Kennung des Tasks (z. B. Post-ID oder Dateiname)
     * @param action auszuführende Arbeit
     * @return Ergebnis von {@code action}
     */
    public static <T> T callWithTask(String taskId, Supplier<T> action) {
        String previous = MDC.get(TASK_KEY);
        MDC.put(TASK_KEY, taskId == null || taskId.isBlank() ? "-" : taskId);
        try {
            return action.get();
        } finally {
            // Worker-Threads werden wiederverwendet: Kontext nach dem Task zurücksetzen
            if (previous == null) {
                MDC.remove(TASK_KEY);
            } else {
                MDC.put(TASK_KEY, previous);
            }
        }
    }
}
