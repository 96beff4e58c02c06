package com.di.fragnova.model;

import lombok.Builder;
import lombok.Value;

/**
 * A movable data unit. Immutable for the duration of a planning pass.
 */
@Value
@Builder
public class Fragment {
    String id;
    /** Payload size in bytes; always &gt; 0 once the descriptor has been validated. */
    long size;
    /** Caller-supplied weight. */
    double importance;
    /** Predicted reuse count (&ge; 0). */
    long reuse;
    /** Informational category tag (e.g. "short", "long"). */
    String timescale;
}
