package com.adlanda.authorityindexer.service.embedding;

import com.adlanda.authorityindexer.exception.EmbeddingProviderException;
import com.adlanda.authorityindexer.exception.RateLimitedException;

import java.util.List;

/**
 * Remote embedding model.
 */
public interface EmbeddingProvider {

    /**
     * Embeds all texts in one request.
     *
     * @param texts Texts in submission order
     * @return One vector per text, in the same order
     * @throws RateLimitedException        if the provider throttled the request
     * @throws EmbeddingProviderException  for any other provider failure
     */
    List<float[]> embed(List<String> texts);

    /**
     * Model identifier sent with each request.
     */
    String modelId();
}
