package de.bsommerfeld.cortx.supervisor;

import de.bsommerfeld.cortx.core.domain.ProcessCategory;
import de.bsommerfeld.cortx.core.domain.ProcessMetadata;
import de.bsommerfeld.cortx.supervisor.exception.AlreadyRunningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProcessRegistryTest {

    private ProcessRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry();
    }

    private static ManagedProcess handle(ProcessCategory category, String id, long pid) {
        Process process = mock(Process.class);
        when(process.pid()).thenReturn(pid);
        return new ManagedProcess(category, id, process, ProcessMetadata.NONE);
    }

    @Test
    void register_shouldMakeIdVisible() throws Exception {
        registry.register(handle(ProcessCategory.SERVICE, "api", 1));

        assertTrue(registry.contains(ProcessCategory.SERVICE, "api"));
        assertFalse(registry.isEmpty());
    }

    @Test
    void register_shouldRejectDuplicateId() throws Exception {
        registry.register(handle(ProcessCategory.SERVICE, "api", 1));

        var e = assertThrows(AlreadyRunningException.class,
                () -> registry.register(handle(ProcessCategory.SERVICE, "api", 2)));
        assertEquals("api", e.getEntityId());
        assertEquals(ProcessCategory.SERVICE, e.getCategory());
    }

    @Test
    void categories_shouldHaveIndependentNamespaces() throws Exception {
        registry.register(handle(ProcessCategory.SERVICE, "build", 1));
        registry.register(handle(ProcessCategory.PROJECT_SCRIPT, "build", 2));
        registry.register(handle(ProcessCategory.GLOBAL_SCRIPT, "build", 3));

        assertEquals(3, registry.snapshot().size());
    }

    @Test
    void reserve_shouldRejectSecondReservation() throws Exception {
        registry.reserve(ProcessCategory.GLOBAL_SCRIPT, "job");

        assertThrows(AlreadyRunningException.class, () -> registry.reserve(ProcessCategory.GLOBAL_SCRIPT, "job"));
        assertFalse(registry.contains(ProcessCategory.GLOBAL_SCRIPT, "job"));
    }

    @Test
    void reserve_shouldRejectRegisteredId() throws Exception {
        registry.register(handle(ProcessCategory.SERVICE, "api", 1));

        assertThrows(AlreadyRunningException.class, () -> registry.reserve(ProcessCategory.SERVICE, "api"));
    }

    @Test
    void release_shouldMakeIdReservableAgain() throws Exception {
        registry.reserve(ProcessCategory.SERVICE, "api");
        registry.release(ProcessCategory.SERVICE, "api");

        assertDoesNotThrow(() -> registry.reserve(ProcessCategory.SERVICE, "api"));
    }

    @Test
    void register_shouldConsumeReservation() throws Exception {
        registry.reserve(ProcessCategory.SERVICE, "api");
        ManagedProcess api = handle(ProcessCategory.SERVICE, "api", 1);
        registry.register(api);
        registry.remove(ProcessCategory.SERVICE, "api");

        assertDoesNotThrow(() -> registry.reserve(ProcessCategory.SERVICE, "api"));
    }

    @Test
    void removeIfSame_shouldNotEvictNewerHandle() throws Exception {
        ManagedProcess old = handle(ProcessCategory.SERVICE, "api", 1);
        registry.register(old);
        registry.remove(ProcessCategory.SERVICE, "api");
        ManagedProcess current = handle(ProcessCategory.SERVICE, "api", 2);
        registry.register(current);

        assertFalse(registry.removeIfSame(old));
        assertFalse(registry.isRegistered(old));
        assertTrue(registry.isRegistered(current));
        assertTrue(registry.removeIfSame(current));
        assertFalse(registry.contains(ProcessCategory.SERVICE, "api"));
    }

    @Test
    void remove_shouldReturnEmptyWhenAbsent() {
        assertTrue(registry.remove(ProcessCategory.SERVICE, "ghost").isEmpty());
    }

    @Test
    void list_shouldReturnSortedSnapshot() throws Exception {
        registry.register(handle(ProcessCategory.PROJECT_SCRIPT, "zeta", 1));
        registry.register(handle(ProcessCategory.PROJECT_SCRIPT, "alpha", 2));
        registry.register(handle(ProcessCategory.SERVICE, "other", 3));

        List<String> ids = registry.list(ProcessCategory.PROJECT_SCRIPT);
        registry.register(handle(ProcessCategory.PROJECT_SCRIPT, "mid", 4));

        assertEquals(List.of("alpha", "zeta"), ids);
    }

    @Test
    void drain_shouldEmptyEveryCategory() throws Exception {
        registry.register(handle(ProcessCategory.SERVICE, "a", 1));
        registry.register(handle(ProcessCategory.GLOBAL_SCRIPT, "b", 2));

        List<ManagedProcess> drained = registry.drain();

        assertEquals(2, drained.size());
        assertTrue(registry.isEmpty());
    }
}
