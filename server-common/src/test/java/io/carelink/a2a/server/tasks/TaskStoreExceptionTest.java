package io.carelink.a2a.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.carelink.a2a.spec.A2AServerException;
import io.carelink.a2a.spec.TaskState;
import org.junit.jupiter.api.Test;

class TaskStoreExceptionTest {

    @Test
    void testConstructor_noArgs() {
        TaskStoreException exception = new TaskStoreException();
        assertNull(exception.getMessage());
        assertNull(exception.getCause());
        assertNull(exception.getTaskId());
    }

    @Test
    void testConstructor_causeOnly() {
        RuntimeException cause = new RuntimeException("Store unavailable");
        TaskStoreException exception = new TaskStoreException(cause);

        assertNotNull(exception.getMessage());
        assertTrue(exception.getMessage().contains("RuntimeException"));
        assertSame(cause, exception.getCause());
        assertNull(exception.getTaskId());
    }

    @Test
    void testConstructor_taskIdMessageAndCause() {
        RuntimeException cause = new RuntimeException("Connection timeout");
        TaskStoreException exception = new TaskStoreException("task-456", "Save operation failed", cause);

        assertEquals("Save operation failed", exception.getMessage());
        assertEquals("task-456", exception.getTaskId());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testIsServerException() {
        assertInstanceOf(A2AServerException.class, new TaskStoreException("task-1", "failed"));
    }

    @Test
    void testTransitionExceptionNamesStates() {
        IllegalTaskStateTransitionException exception =
                new IllegalTaskStateTransitionException("task-789", TaskState.COMPLETED, TaskState.WORKING);

        assertEquals("task-789", exception.getTaskId());
        assertEquals("Task task-789 cannot move from completed to working", exception.getMessage());
        assertInstanceOf(TaskStoreException.class, exception);
    }
}
