package com.apimerge.service.api;

import com.apimerge.model.MergeResult;
import com.apimerge.model.SourceDocument;
import com.apimerge.model.SourcePayload;
import java.util.List;

/**
 * Runs complete merges: filtering disabled sources, gating invalid documents, folding the rest
 * and writing the final metadata.
 * <p>
 * Sources that are excluded along the way appear as diagnostics in the returned
 * {@link MergeResult}. When nothing is left to merge the result is the empty sentinel.
 */
public interface MergeService {

    /**
     * Fetches the documents of all configured, enabled sources and merges them.
     *
     * @param grouping Whether tags are namespaced per source.
     * @return The merge result, including retrieval and validation diagnostics.
     */
    MergeResult mergeConfigured(boolean grouping);

    /**
     * Merges already decoded documents.
     *
     * @param documents Sources with their documents, in merge order.
     * @param grouping  Whether tags are namespaced per source.
     * @return The merge result.
     */
    MergeResult merge(List<SourceDocument> documents, boolean grouping);

    /**
     * Decodes the given payloads and merges them.
     *
     * @param payloads Sources with their raw document text, in merge order.
     * @param grouping Whether tags are namespaced per source.
     * @return The merge result.
     * @throws com.apimerge.exception.ApiMergeException if any payload cannot be decoded; the
     *                                                   message names the source.
     */
    MergeResult mergePayloads(List<SourcePayload> payloads, boolean grouping);
}
