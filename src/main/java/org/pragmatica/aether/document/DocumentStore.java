package org.pragmatica.aether.document;

import org.pragmatica.aether.AetherFrontend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Latest parse of every open document, keyed by URI.
 *
 * <p>Each open or change reparses the full text and replaces the entry; concurrent updates of one
 * URI resolve as last write wins. Safe for use from multiple threads.
 */
public final class DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private final AetherFrontend frontend;
    private final Map<String, ParsedDocument> documents = new ConcurrentHashMap<>();

    private DocumentStore(AetherFrontend frontend) {
        this.frontend = frontend;
    }

    public static DocumentStore create(AetherFrontend frontend) {
        checkNotNull(frontend, "frontend");
        return new DocumentStore(frontend);
    }

    public ParsedDocument open(String uri, String text) {
        var document = store(uri, text);
        log.info("Opened {} ({} errors, {} symbols)", uri, document.errors().size(), document.symbols().size());
        return document;
    }

    public ParsedDocument change(String uri, String text) {
        var document = store(uri, text);
        log.debug("Reparsed {} ({} errors)", uri, document.errors().size());
        return document;
    }

    public Optional<ParsedDocument> close(String uri) {
        var removed = Optional.ofNullable(documents.remove(uri));
        if (removed.isPresent()) {
            log.info("Closed {}", uri);
        } else {
            log.debug("Close of unknown document {}", uri);
        }
        return removed;
    }

    public Optional<ParsedDocument> get(String uri) {
        return Optional.ofNullable(documents.get(uri));
    }

    public Set<String> uris() {
        return Set.copyOf(documents.keySet());
    }

    public int size() {
        return documents.size();
    }

    private ParsedDocument store(String uri, String text) {
        checkNotNull(uri, "uri");
        var document = frontend.parse(text);
        documents.put(uri, document);
        return document;
    }
}
