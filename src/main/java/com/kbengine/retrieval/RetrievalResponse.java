package com.kbengine.retrieval;

import java.util.List;
import java.util.Map;

import com.kbengine.vector.RetrievalResult;

public record RetrievalResponse(
        String query,
        SearchMode mode,
        List<RetrievalResult> results,
        List<String> searchedNamespaces,
        Map<String, String> omittedNamespaces) {

    public boolean noContext() {
        return results.isEmpty();
    }

    public boolean partial() {
        return !omittedNamespaces.isEmpty();
    }
}
