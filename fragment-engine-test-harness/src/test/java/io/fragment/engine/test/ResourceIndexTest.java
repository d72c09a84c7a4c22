package io.fragment.engine.test;

import io.fragment.engine.api.ResourceDescriptor;
import io.fragment.engine.api.ResourceLocationType;
import io.fragment.engine.api.ResourceType;
import io.fragment.engine.resources.ResourceIndex;
import org.junit.jupiter.api.*;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class ResourceIndexTest {

    private RecordingEngineLogger logger;
    private ResourceIndex index;

    @BeforeEach
    void setUp() {
        logger = new RecordingEngineLogger();
        index = new ResourceIndex(logger, 100L);
    }

    @Test
    void newIndexIsEmpty() {
        assertThat(index.size()).isZero();
        assertThat(index.lookup("anything")).isEmpty();
        assertThat(index.snapshot()).isEmpty();
        assertThat(index.generation()).isZero();
    }

    @Test
    void replaceAllSwapsTheWholeContents() {
        index.replaceAll(generation("old", 3));
        assertThat(index.replaceAll(Map.of("solo", descriptor("solo", "new")))).isTrue();

        assertThat(index.size()).isEqualTo(1);
        assertThat(index.lookup("key0")).isEmpty();
        assertThat(index.lookup("solo")).get()
            .extracting(ResourceDescriptor::relativePath).isEqualTo("new/solo.png");
        assertThat(index.generation()).isEqualTo(2);
    }

    @Test
    void snapshotIsDetachedFromLaterReplacements() {
        index.replaceAll(generation("old", 4));
        Map<String, ResourceDescriptor> snapshot = index.snapshot();
        index.replaceAll(Map.of());

        assertThat(snapshot).hasSize(4);
        assertThatThrownBy(() -> snapshot.put("x", descriptor("x", "old")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullKeyThrows() {
        assertThatThrownBy(() -> index.lookup(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void readersNeverSeeAMixOfGenerations() throws Exception {
        Map<String, ResourceDescriptor> oldGen = generation("old", 50);
        Map<String, ResourceDescriptor> newGen = generation("new", 50);
        index.replaceAll(oldGen);

        AtomicBoolean stop = new AtomicBoolean(false);
        CopyOnWriteArrayList<String> violations = new CopyOnWriteArrayList<>();

        Thread writer = new Thread(() -> {
            for (int i = 0; i < 300 && !stop.get(); i++) {
                index.replaceAll(i % 2 == 0 ? newGen : oldGen);
            }
        });
        Thread reader = new Thread(() -> {
            for (int i = 0; i < 300; i++) {
                Map<String, ResourceDescriptor> snapshot = index.snapshot();
                Set<String> prefixes = new LinkedHashSet<>();
                for (ResourceDescriptor d : snapshot.values()) {
                    prefixes.add(d.relativePath().substring(0, 3));
                }
                if (snapshot.size() != 50 || prefixes.size() != 1) {
                    violations.add("size=" + snapshot.size() + " prefixes=" + prefixes);
                }
            }
        });
        writer.start();
        reader.start();
        reader.join(10_000);
        stop.set(true);
        writer.join(10_000);

        assertThat(violations).isEmpty();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static Map<String, ResourceDescriptor> generation(String prefix, int count) {
        Map<String, ResourceDescriptor> map = new HashMap<>();
        for (int i = 0; i < count; i++) {
            map.put("key" + i, descriptor("key" + i, prefix));
        }
        return map;
    }

    static ResourceDescriptor descriptor(String key, String prefix) {
        return new ResourceDescriptor(key, null, ResourceLocationType.ASSET_FILE,
            prefix + "/" + key + ".png", 0L, 10L, ".png", ResourceType.TEXTURE, 0,
            null, null, "test.fres");
    }
}
