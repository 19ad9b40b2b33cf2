/**
 * Persistence adapters for safety incidents and conversation activity.
 * <p><strong>Formats:</strong> NDJSON, one object per line, written with the Jackson streaming API.</p>
 * <p><strong>Concurrency:</strong> File adapters serialize writes and queries on the adapter instance; in-memory
 * adapters use copy-on-write lists.</p>
 * <p><strong>Security:</strong> Only input excerpts are stored, never full conversations.</p>
 */
package ca.gc.cra.guardian.infrastructure.persistence;
