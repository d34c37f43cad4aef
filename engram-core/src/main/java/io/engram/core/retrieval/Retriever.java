package io.engram.core.retrieval;

import java.util.List;

@FunctionalInterface
public interface Retriever {
    List<RetrievedUnit> retrieve(String query);
}
