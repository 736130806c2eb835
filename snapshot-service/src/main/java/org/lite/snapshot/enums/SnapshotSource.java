package org.lite.snapshot.enums;

/**
 * Origin of a snapshot's content: typed in by a person or suggested by an LLM
 */
public enum SnapshotSource {
    HUMAN,
    AI
}
