package de.htwsaar.mediavault.cli.command;

/**
 * Exit-Codes aller Commands.
 *
 * <ul>
 *   <li>0 = OK</li>
 *   <li>1 = Exception/IO, Index nicht zu öffnen</li>
 *   <li>2 = mindestens ein Task endgültig fehlgeschlagen</li>
 *   <li>3 = Client-Validation (ungültige Optionen, Konfiguration oder Task-Datei)</li>
 * </ul>
 */
public final class ExitCodes {
    public static final int OK = 0;
    public static final int ERROR = 1;
    public static final int TASKS_FAILED = 2;
    public static final int INVALID_INPUT = 3;

    private ExitCodes() {}
}
