package org.pragmatica.aether.document;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.AetherFrontend;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentStoreTest {
    private final DocumentStore store = DocumentStore.create(AetherFrontend.create());

    @Test
    void open_storesParsedDocument() {
        var document = store.open("file:///a.ae", "Set A 1\nFunc F() { Return A }");

        assertThat(document.hasErrors()).isFalse();
        assertThat(document.symbols().size()).isEqualTo(2);
        assertThat(store.get("file:///a.ae")).contains(document);
        assertThat(store.uris()).containsExactly("file:///a.ae");
    }

    @Test
    void change_replacesPreviousParse() {
        store.open("file:///a.ae", "Set A 1");

        var changed = store.change("file:///a.ae", "Set a 1");

        assertThat(changed.hasErrors()).isTrue();
        assertThat(changed.program().isEmpty()).isTrue();
        assertThat(store.get("file:///a.ae")).contains(changed);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void close_removesDocument() {
        store.open("file:///a.ae", "Set A 1");

        assertThat(store.close("file:///a.ae")).isPresent();
        assertThat(store.close("file:///a.ae")).isEmpty();
        assertThat(store.get("file:///a.ae")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void concurrentUpdates_keepOneEntryPerUri() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<ParsedDocument>> tasks = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                var uri = "file:///doc" + (i % 4) + ".ae";
                var text = "Set VALUE_" + i + " " + i;
                tasks.add(() -> store.change(uri, text));
            }
            for (var future : executor.invokeAll(tasks)) {
                assertThat(future.get().hasErrors()).isFalse();
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(store.size()).isEqualTo(4);
        for (var uri : store.uris()) {
            assertThat(store.get(uri).orElseThrow().symbols().size()).isEqualTo(1);
        }
    }
}
