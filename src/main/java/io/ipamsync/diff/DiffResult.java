package io.ipamsync.diff;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Names (or raw values) to add to and remove from an existing collection to reach the desired one.
 */
@Data
@AllArgsConstructor
public class DiffResult {
    private final List<String> added;
    private final List<String> removed;

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
