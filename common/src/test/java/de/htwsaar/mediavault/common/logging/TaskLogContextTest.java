package de.htwsaar.mediavault.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests für {@link TaskLogContext}.
 *
 * <p>Ziel: Task-Kennung ist während der Arbeit sichtbar und danach wieder entfernt.</p>
 */
class TaskLogContextTest {

    @Test
    void shouldExposeTaskIdOnlyDuringAction() {
        String seen = TaskLogContext.callWithTask("p1", () -> MDC.get(TaskLogContext.TASK_KEY));

        assertEquals("p1", seen);
        assertNull(MDC.get(TaskLogContext.TASK_KEY));
    }

    @Test
    void shouldRemoveTaskIdWhenActionThrows() {
        assertThrows(IllegalStateException.class, () -> TaskLogContext.callWithTask("p2", () -> {
            throw new IllegalStateException("boom");
        }));

        assertNull(MDC.get(TaskLogContext.TASK_KEY));
    }
}
