package io.fragment.engine.test;

import io.fragment.engine.api.ResourceDescriptor;
import io.fragment.engine.api.ResourceHandle;
import io.fragment.engine.api.ResourceType;
import io.fragment.engine.resources.LoadPriorityQueue;
import io.fragment.engine.resources.LoadRequest;
import io.fragment.engine.resources.ResourceIndex;
import io.fragment.engine.resources.ResourceLoadService;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class ResourceLoadServiceTest {

    private RecordingEngineLogger logger;
    private ResourceIndex index;
    private LoadPriorityQueue queue;
    private List<String> imported;
    private ResourceLoadService service;

    @BeforeEach
    void setUp() {
        logger = new RecordingEngineLogger();
        index = new ResourceIndex(logger, 100L);
        index.replaceAll(ResourceIndexTest.generation("res", 5));
        queue = new LoadPriorityQueue(logger, 100L);
        imported = new CopyOnWriteArrayList<>();
        service = new ResourceLoadService(index, queue, this::importRecording, logger);
    }

    @Test
    void nullCollaboratorsThrow() {
        assertThatThrownBy(() -> new ResourceLoadService(null, queue, d -> true, logger))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ResourceLoadService(index, queue, null, logger))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void pendingRequestsAreImportedInPriorityOrder() {
        LoadRequest late = service.requestLoad(handle("key1"), 50).orElseThrow();
        LoadRequest urgent = service.requestLoad(handle("key2"), 1).orElseThrow();

        assertThat(service.processPending(1_000.0)).isEqualTo(2);

        assertThat(imported).containsExactly("key2", "key1");
        assertThat(urgent.completion().join()).isTrue();
        assertThat(late.completion().join()).isTrue();
        assertThat(service.loadedCount()).isEqualTo(2);
    }

    @Test
    void repeatedRequestReturnsTheQueuedOne() {
        LoadRequest first = service.requestLoad(handle("key3"), 10).orElseThrow();
        LoadRequest second = service.requestLoad(handle("key3"), 1).orElseThrow();
        assertThat(second).isSameAs(first);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void unknownResourceCompletesAsFailed() {
        LoadRequest request = service.requestLoad(handle("nope")).orElseThrow();
        service.processPending(1_000.0);

        assertThat(request.completion().join()).isFalse();
        assertThat(imported).isEmpty();
        assertThat(service.failedCount()).isEqualTo(1);
        assertThat(logger.contains(RecordingEngineLogger.Kind.ERROR, "nope")).isTrue();
    }

    @Test
    void importerExceptionCompletesAsFailed() {
        service = new ResourceLoadService(index, queue, d -> { throw new IOException("disk gone"); }, logger);
        LoadRequest request = service.requestLoad(handle("key0")).orElseThrow();

        service.processPending(1_000.0);

        assertThat(request.completion().join()).isFalse();
        assertThat(logger.ofKind(RecordingEngineLogger.Kind.EXCEPTION))
            .anySatisfy(e -> assertThat(e.cause()).hasMessage("disk gone"));
    }

    @Test
    void abortedRequestIsNeverImported() {
        LoadRequest request = service.requestLoad(handle("key4")).orElseThrow();
        assertThat(service.abortLoading(handle("key4"))).isTrue();

        assertThat(service.processPending(1_000.0)).isZero();
        assertThat(request.isCancelled()).isTrue();
        assertThat(imported).isEmpty();
    }

    @Test
    void zeroBudgetProcessesNothing() {
        service.requestLoad(handle("key0"));
        assertThat(service.processPending(0.0)).isZero();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void budgetStopsDrainingOnceSpent() {
        service = new ResourceLoadService(index, queue, d -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return true;
        }, logger);
        for (int i = 0; i < 5; i++) service.requestLoad(handle("key" + i));

        int processed = service.processPending(5.0);

        assertThat(processed).isEqualTo(1);
        assertThat(queue.size()).isEqualTo(4);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private boolean importRecording(ResourceDescriptor descriptor) {
        imported.add(descriptor.key());
        return true;
    }

    private static ResourceHandle handle(String key) {
        return new ResourceHandle(key, ResourceType.TEXTURE);
    }
}
