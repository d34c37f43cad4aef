package io.engram.core.extraction;

import java.util.List;

/**
 * Turns a conversation into memory unit drafts.
 *
 * @throws io.engram.core.error.ExtractionException from {@link #extract} on any failure; callers
 *     treat it as "no memory units created" for the whole conversation
 */
public interface ExtractionService {
    List<MemoryUnitDraft> extract(List<DialogueTurn> turns);
}
