package com.foreman.core.delegate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;
import com.foreman.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OwnerRegistryDelegateTest {

    private static Task task(String id, String owner) {
        return new Task(id, owner, "Do " + id, "finishing", List.of(), TaskStatus.IN_PROGRESS, 0,
                null, null, Map.of(), List.of(), null, null);
    }

    private static TaskWorker worker(String... owners) throws Exception {
        TaskWorker worker = mock(TaskWorker.class);
        when(worker.owners()).thenReturn(Set.of(owners));
        when(worker.perform(any())).thenAnswer(inv -> TaskResult.of("done by " + owners[0]));
        return worker;
    }

    @Test
    @DisplayName("Routes each task to the worker registered for its owner, ignoring case")
    void routesByOwner() throws Exception {
        TaskWorker painter = worker("Painter");
        TaskWorker plumber = worker("Plumber");
        var delegate = new OwnerRegistryDelegate(List.of(painter, plumber));

        assertEquals("done by Painter", delegate.execute(task("1", "painter")).summary());
        assertEquals("done by Plumber", delegate.execute(task("2", " PLUMBER ")).summary());
        verify(painter).perform(any());
        verify(plumber).perform(any());
    }

    @Test
    @DisplayName("Unknown owner raises UnknownOwnerException without calling any worker")
    void unknownOwner() throws Exception {
        TaskWorker painter = worker("Painter");
        var delegate = new OwnerRegistryDelegate(List.of(painter));

        var ex = assertThrows(UnknownOwnerException.class, () -> delegate.execute(task("1", "Welder")));
        assertEquals("No worker registered for owner Welder", ex.getMessage());
        assertInstanceOf(DelegateException.class, ex);
        verify(painter, never()).perform(any());
    }

    @Test
    @DisplayName("Two workers claiming the same owner is a configuration error")
    void duplicateOwner() throws Exception {
        TaskWorker first = worker("Mason");
        TaskWorker second = worker("mason");

        assertThrows(IllegalStateException.class, () -> new OwnerRegistryDelegate(List.of(first, second)));
    }

    @Test
    @DisplayName("supports and registeredOwners reflect the registered workers")
    void introspection() throws Exception {
        var delegate = new OwnerRegistryDelegate(List.of(worker("Roofer", "HVAC")));

        assertTrue(delegate.supports("hvac"));
        assertFalse(delegate.supports("Painter"));
        assertFalse(delegate.supports(null));
        assertEquals(List.of("HVAC", "ROOFER"), delegate.registeredOwners());
    }
}
