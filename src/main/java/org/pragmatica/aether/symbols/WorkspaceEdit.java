package org.pragmatica.aether.symbols;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;

/**
 * Text edits grouped by document URI.
 */
public record WorkspaceEdit(Map<String, List<TextEdit>> changes) {

    public WorkspaceEdit {
        var copy = ImmutableMap.<String, List<TextEdit>>builder();
        changes.forEach((uri, edits) -> copy.put(uri, ImmutableList.copyOf(edits)));
        changes = copy.build();
    }
}
